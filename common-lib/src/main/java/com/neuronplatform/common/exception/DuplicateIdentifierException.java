package com.neuronplatform.common.exception;

/**
 * Raised when a node is inserted under an id that the graph already holds.
 * Fatal to the insert only; the graph is left unchanged.
 */
public class DuplicateIdentifierException extends GraphException {

    public DuplicateIdentifierException(String nodeId) {
        super(nodeId, "Duplicate node id: " + nodeId);
    }
}
