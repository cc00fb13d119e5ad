package com.metadata.disambiguation.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable set of nodes extracted from one document.
 * Owned by a single resolution run and not safe for concurrent use.
 */
public class NodeGraph implements Iterable<Node> {

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    public NodeGraph() {
    }

    public NodeGraph(Collection<Node> nodes) {
        nodes.forEach(this::add);
    }

    /**
     * Adds a node. A node with the same id is replaced.
     */
    public Node add(Node node) {
        Objects.requireNonNull(node, "node is required");
        nodes.put(node.getId(), node);
        return node;
    }

    /**
     * Links {@code from} to {@code to} through a to-one relation and records the
     * inverse to-many relation on {@code to}.
     *
     * @param reverseRelation name of the inverse relation on {@code to}, or null for none
     */
    public void connect(Node from, String relation, Node to, String reverseRelation) {
        requireMember(from);
        requireMember(to);
        from.setRelated(relation, to);
        if (reverseRelation != null) {
            to.addRelatedMany(reverseRelation, from);
        }
    }

    public Optional<Node> get(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(Node node) {
        return nodes.containsKey(node.getId());
    }

    /**
     * Removes a node and every edge that points at it.
     *
     * @return true if the node was part of this graph
     */
    public boolean remove(Node node) {
        if (nodes.remove(node.getId()) == null) {
            return false;
        }
        for (Node other : nodes.values()) {
            other.detach(node);
        }
        return true;
    }

    /**
     * Returns the nodes whose type is one of the given types, in insertion order.
     */
    public List<Node> ofTypes(Set<String> types) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (types.contains(node.getType())) {
                result.add(node);
            }
        }
        return result;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return List.copyOf(nodes.values()).iterator();
    }

    private void requireMember(Node node) {
        if (!contains(node)) {
            throw new IllegalArgumentException("Node " + node.getId() + " is not part of this graph");
        }
    }
}
