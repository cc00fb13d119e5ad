package com.metadata.disambiguation.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Node to candidate-set association built incrementally by the matching passes.
 * Created fresh for every resolution run; not safe for concurrent use.
 */
public class MatchSet {

    private final Map<Node, Set<Candidate>> matches = new LinkedHashMap<>();

    /**
     * Adds a candidate to the node's matches.
     *
     * @return true if the candidate was not already present
     */
    public boolean addMatch(Node node, Candidate candidate) {
        return matches.computeIfAbsent(node, k -> new LinkedHashSet<>()).add(candidate);
    }

    /**
     * Unions the given candidates into the node's matches.
     *
     * @return the number of candidates that were newly added
     */
    public int addMatches(Node node, Collection<Candidate> candidates) {
        int added = 0;
        for (Candidate candidate : candidates) {
            if (addMatch(node, candidate)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Returns the current matches for a node; empty when there are none or the node is null.
     */
    public Set<Candidate> getMatches(Node node) {
        if (node == null) {
            return Set.of();
        }
        Set<Candidate> found = matches.get(node);
        return found != null ? Collections.unmodifiableSet(found) : Set.of();
    }

    public boolean hasMatches(Node node) {
        return !getMatches(node).isEmpty();
    }

    /**
     * Nodes with at least one match.
     */
    public Set<Node> matchedNodes() {
        return Collections.unmodifiableSet(matches.keySet());
    }

    public int size() {
        return matches.size();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /**
     * Read-only view of the whole mapping.
     */
    public Map<Node, Set<Candidate>> asMap() {
        Map<Node, Set<Candidate>> view = new LinkedHashMap<>();
        matches.forEach((node, candidates) -> view.put(node, Collections.unmodifiableSet(candidates)));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public String toString() {
        return "MatchSet{" + matches + '}';
    }
}
