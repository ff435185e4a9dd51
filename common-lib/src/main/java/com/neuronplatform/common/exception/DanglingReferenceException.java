package com.neuronplatform.common.exception;

/**
 * Raised when an edge names a source or target node that is not part of the graph.
 * Fatal to the insert only; the graph is left unchanged.
 */
public class DanglingReferenceException extends GraphException {

    private final String endpoint;

    public DanglingReferenceException(String endpoint, String nodeId) {
        super(nodeId, "Edge " + endpoint + " '" + nodeId + "' not found in graph");
        this.endpoint = endpoint;
    }

    /** {@code "source"} or {@code "target"}. */
    public String getEndpoint() {
        return endpoint;
    }
}
