package com.metadata.disambiguation.api;

import com.metadata.disambiguation.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of matching passes run after the initial pass.
 *
 * <p>Order matters: a many-to-one pass can only use related nodes that an earlier pass matched,
 * and a one-to-many pass only sees the matches of its related nodes recorded so far.</p>
 */
public final class MatchingPlan {

    private final List<MatchingStep> steps;

    private MatchingPlan(List<MatchingStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public static MatchingPlan of(List<MatchingStep> steps) {
        return new MatchingPlan(steps);
    }

    /**
     * The standard order for harvested metadata:
     * <ol>
     *   <li>work and agent identifiers by {@code uri}</li>
     *   <li>works and agents through their matched identifiers</li>
     *   <li>tags by {@code name}</li>
     *   <li>subjects by URI or name</li>
     *   <li>work/tag and work/subject links, then work relations, through their matched ends</li>
     *   <li>agent/work relations by name comparison</li>
     * </ol>
     *
     * @param schemas registry the steps will run against; every target of the plan must be registered
     * @throws IllegalArgumentException if a target is missing from the registry
     */
    public static MatchingPlan defaults(SchemaRegistry schemas) {
        List<MatchingStep> steps = List.of(
                MatchingStep.byAttrs("workidentifier", List.of("uri")),
                MatchingStep.byAttrs("agentidentifier", List.of("uri")),
                MatchingStep.byOneToMany("creativework", "identifiers"),
                MatchingStep.byOneToMany("agent", "identifiers"),
                MatchingStep.byAttrs("tag", List.of("name")),
                MatchingStep.subjects(),
                MatchingStep.byManyToOne("throughtags", List.of("tag", "creative_work")),
                MatchingStep.byManyToOne("throughsubjects", List.of("subject", "creative_work")),
                MatchingStep.byManyToOne("abstractworkrelation", List.of("subject", "related")),
                MatchingStep.agentWorkRelations()
        );
        for (MatchingStep step : steps) {
            if (step instanceof MatchingStep.ByAttrs attrs) {
                schemas.get(attrs.target()).columns(attrs.attrNames());
            } else if (step instanceof MatchingStep.ByManyToOne manyToOne) {
                schemas.get(manyToOne.target()).relationColumns(manyToOne.relationNames());
            } else if (step instanceof MatchingStep.ByOneToMany oneToMany) {
                schemas.get(oneToMany.target()).reverseRelationColumn(oneToMany.relationName());
            }
        }
        return new MatchingPlan(steps);
    }

    public List<MatchingStep> steps() {
        return steps;
    }

    /**
     * Returns a copy of this plan with a step appended.
     */
    public MatchingPlan then(MatchingStep step) {
        List<MatchingStep> extended = new ArrayList<>(steps);
        extended.add(step);
        return new MatchingPlan(extended);
    }

    public int size() {
        return steps.size();
    }

    @Override
    public String toString() {
        return "MatchingPlan{" + steps + '}';
    }
}
