package com.metadata.disambiguation.graph;

import java.util.List;
import java.util.Map;

/**
 * Read access to the graph holding persisted records.
 * Nothing in a disambiguation run writes through this interface.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a Cypher read query.
     *
     * @param query  Cypher text with {@code $name} placeholders
     * @param params values bound to the placeholders
     * @return one map per returned row, keyed by column alias
     * @throws GraphQueryException if the store rejects the query
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    /**
     * Returns true if the store answers a trivial query.
     */
    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
