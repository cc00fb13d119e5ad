package com.metadata.disambiguation.matching;

import com.metadata.disambiguation.names.HumanName;

/**
 * The parsed names of one agent/work relation: the name it is cited under and
 * the canonical name of the credited agent.
 *
 * @param source   the relation these names were parsed from (incoming node or persisted row)
 * @param citedAs  parsed cited-as name
 * @param agentName parsed canonical agent name
 */
public record RelationNames<T>(T source, HumanName citedAs, HumanName agentName) {
}
