package com.metadata.disambiguation.graph;

/**
 * Runtime exception thrown when the graph store fails to execute a query.
 */
public class GraphQueryException extends RuntimeException {

    public GraphQueryException(String message) {
        super(message);
    }

    public GraphQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
