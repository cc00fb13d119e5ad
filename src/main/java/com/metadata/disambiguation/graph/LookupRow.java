package com.metadata.disambiguation.graph;

import com.metadata.disambiguation.core.model.Candidate;

/**
 * One result of a batched lookup: the originating node id and the record it matched.
 */
public record LookupRow(String nodeId, Candidate candidate) {
}
