package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.core.model.Node;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of many-to-one matching: either the pass completed, or a node's related node
 * matched more than one record and the conflict must be settled by a merge decision.
 */
public sealed interface ManyToOneOutcome permits ManyToOneOutcome.Matched, ManyToOneOutcome.Ambiguous {

    /**
     * The pass completed.
     *
     * @param added number of new node to candidate matches
     */
    record Matched(int added) implements ManyToOneOutcome {
    }

    /**
     * A related node has more than one match. No matches were recorded by the pass.
     *
     * @param node        the node being matched
     * @param relation    the relation whose related node is ambiguous
     * @param relatedNode the related node
     * @param candidates  every record the related node matched
     */
    record Ambiguous(Node node, String relation, Node relatedNode, Set<Candidate> candidates)
            implements ManyToOneOutcome {

        public Ambiguous {
            Objects.requireNonNull(node, "node is required");
            Objects.requireNonNull(relatedNode, "relatedNode is required");
            candidates = Set.copyOf(candidates);
        }

        public String message() {
            return "Multiple matches for node " + relatedNode.getId() + " (" + relation + " of "
                    + node.getId() + "): " + candidates;
        }
    }
}
