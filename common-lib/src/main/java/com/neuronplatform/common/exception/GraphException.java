package com.neuronplatform.common.exception;

/**
 * Base type for structural failures raised while assembling a
 * {@link com.neuronplatform.common.graph.BrainGraph}.
 *
 * <p>Carries the identifier of the offending node or edge endpoint so that
 * loaders can report per-record diagnostics without parsing the message.
 */
public class GraphException extends RuntimeException {
    private final String elementId;

    public GraphException(String elementId, String message) {
        super("[" + elementId + "] " + message);
        this.elementId = elementId;
    }

    public String getElementId() {
        return elementId;
    }
}
