package com.metadata.disambiguation.api;

import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.matching.ManyToOneOutcome;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of disambiguating one node graph.
 */
public sealed interface DisambiguationResult permits DisambiguationResult.Resolved, DisambiguationResult.Ambiguous {

    /**
     * The matches recorded so far. Complete for {@link Resolved}, partial for {@link Ambiguous}.
     */
    MatchSet matches();

    boolean isResolved();

    static DisambiguationResult resolved(MatchSet matches) {
        return new Resolved(matches);
    }

    static DisambiguationResult ambiguous(ManyToOneOutcome.Ambiguous conflict, MatchSet partialMatches) {
        return new Ambiguous(conflict.node(), conflict.relation(), conflict.relatedNode(),
                conflict.candidates(), partialMatches);
    }

    /**
     * Every pass completed.
     */
    record Resolved(MatchSet matches) implements DisambiguationResult {
        public Resolved {
            Objects.requireNonNull(matches, "matches is required");
        }

        @Override
        public boolean isResolved() {
            return true;
        }
    }

    /**
     * A pass stopped because a related node matched more than one record.
     * The caller must merge the candidates, or reject the document.
     *
     * @param node        the node that could not be matched
     * @param relation    the relation leading to the ambiguous node
     * @param relatedNode the node with several matches
     * @param candidates  the records it matched
     * @param matches     matches recorded by the passes that completed before the conflict
     */
    record Ambiguous(Node node, String relation, Node relatedNode, Set<Candidate> candidates, MatchSet matches)
            implements DisambiguationResult {
        public Ambiguous {
            Objects.requireNonNull(node, "node is required");
            Objects.requireNonNull(matches, "matches is required");
            candidates = Set.copyOf(candidates);
        }

        @Override
        public boolean isResolved() {
            return false;
        }
    }
}
