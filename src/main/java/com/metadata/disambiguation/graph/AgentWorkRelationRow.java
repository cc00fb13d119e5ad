package com.metadata.disambiguation.graph;

import com.metadata.disambiguation.core.model.Candidate;

import java.util.Objects;

/**
 * A persisted agent/work relation together with the agent it credits.
 */
public record AgentWorkRelationRow(Candidate relation, Candidate agent) {

    public AgentWorkRelationRow {
        Objects.requireNonNull(relation, "relation is required");
        Objects.requireNonNull(agent, "agent is required");
    }

    public String citedAs() {
        String citedAs = relation.stringProperty("cited_as");
        return citedAs != null ? citedAs : "";
    }

    public String agentName() {
        String name = agent.stringProperty("name");
        return name != null ? name : "";
    }

    public Long orderCited() {
        return relation.longProperty("order_cited");
    }
}
