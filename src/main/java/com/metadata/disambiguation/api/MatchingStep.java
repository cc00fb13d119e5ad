package com.metadata.disambiguation.api;

import com.metadata.disambiguation.core.model.MatchSet;
import com.metadata.disambiguation.core.model.Node;
import com.metadata.disambiguation.core.model.NodeGraph;
import com.metadata.disambiguation.matching.ManyToOneOutcome;
import com.metadata.disambiguation.matching.MatchingStrategy;
import com.metadata.disambiguation.schema.SchemaRegistry;
import com.metadata.disambiguation.schema.TargetSchema;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One matching pass of a {@link MatchingPlan}, applied to the graph nodes it concerns.
 */
public sealed interface MatchingStep permits MatchingStep.ByAttrs, MatchingStep.ByManyToOne,
        MatchingStep.ByOneToMany, MatchingStep.Subjects, MatchingStep.AgentWorkRelations {

    /**
     * Runs the pass.
     *
     * @return the conflict if the pass found an ambiguous match, empty otherwise
     */
    Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                            SchemaRegistry schemas, MatchSet matches);

    static MatchingStep byAttrs(String target, List<String> attrNames) {
        return new ByAttrs(target, attrNames, Set.of());
    }

    static MatchingStep byAttrs(String target, List<String> attrNames, Set<String> allowedSubtypes) {
        return new ByAttrs(target, attrNames, allowedSubtypes);
    }

    static MatchingStep byManyToOne(String target, List<String> relationNames) {
        return new ByManyToOne(target, relationNames, Set.of());
    }

    static MatchingStep byManyToOne(String target, List<String> relationNames, Set<String> allowedSubtypes) {
        return new ByManyToOne(target, relationNames, allowedSubtypes);
    }

    static MatchingStep byOneToMany(String target, String relationName) {
        return new ByOneToMany(target, relationName);
    }

    static MatchingStep subjects() {
        return new Subjects();
    }

    static MatchingStep agentWorkRelations() {
        return new AgentWorkRelations();
    }

    /**
     * Nodes of the target's subtypes, or only of the allowed subtypes when some are given.
     */
    private static List<Node> select(NodeGraph graph, TargetSchema schema, Set<String> allowedSubtypes) {
        return graph.ofTypes(allowedSubtypes.isEmpty() ? schema.subtypes() : allowedSubtypes);
    }

    record ByAttrs(String target, List<String> attrNames, Set<String> allowedSubtypes) implements MatchingStep {
        public ByAttrs {
            attrNames = List.copyOf(attrNames);
            allowedSubtypes = allowedSubtypes != null ? Set.copyOf(allowedSubtypes) : Set.of();
        }

        @Override
        public Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                                       SchemaRegistry schemas, MatchSet matches) {
            List<Node> nodes = select(graph, schemas.get(target), allowedSubtypes);
            strategy.matchByAttrs(nodes, target, attrNames, allowedSubtypes, matches);
            return Optional.empty();
        }
    }

    record ByManyToOne(String target, List<String> relationNames, Set<String> allowedSubtypes)
            implements MatchingStep {
        public ByManyToOne {
            relationNames = List.copyOf(relationNames);
            allowedSubtypes = allowedSubtypes != null ? Set.copyOf(allowedSubtypes) : Set.of();
        }

        @Override
        public Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                                       SchemaRegistry schemas, MatchSet matches) {
            List<Node> nodes = select(graph, schemas.get(target), allowedSubtypes);
            ManyToOneOutcome outcome = strategy.matchByManyToOne(nodes, target, relationNames, allowedSubtypes, matches);
            if (outcome instanceof ManyToOneOutcome.Ambiguous ambiguous) {
                return Optional.of(ambiguous);
            }
            return Optional.empty();
        }
    }

    record ByOneToMany(String target, String relationName) implements MatchingStep {
        @Override
        public Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                                       SchemaRegistry schemas, MatchSet matches) {
            List<Node> nodes = select(graph, schemas.get(target), Set.of());
            strategy.matchByOneToMany(nodes, target, relationName, matches);
            return Optional.empty();
        }
    }

    record Subjects() implements MatchingStep {
        @Override
        public Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                                       SchemaRegistry schemas, MatchSet matches) {
            strategy.matchSubjects(select(graph, schemas.get("subject"), Set.of()), matches);
            return Optional.empty();
        }
    }

    record AgentWorkRelations() implements MatchingStep {
        @Override
        public Optional<ManyToOneOutcome.Ambiguous> run(MatchingStrategy strategy, NodeGraph graph,
                                                       SchemaRegistry schemas, MatchSet matches) {
            strategy.matchAgentWorkRelations(select(graph, schemas.get("abstractagentworkrelation"), Set.of()), matches);
            return Optional.empty();
        }
    }
}
