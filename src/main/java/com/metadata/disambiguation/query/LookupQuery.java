package com.metadata.disambiguation.query;

import java.util.Map;
import java.util.Objects;

/**
 * A parameterized Cypher query resolving a batch of nodes in one round trip.
 *
 * @param cypher   the query text
 * @param params   bound parameters
 * @param rowCount number of node rows in the batch
 */
public record LookupQuery(String cypher, Map<String, Object> params, int rowCount) {

    public LookupQuery {
        Objects.requireNonNull(cypher, "cypher is required");
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
