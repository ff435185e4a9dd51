package com.neuronplatform.orchestrator.loader;

import java.util.List;

/**
 * Raised when a data file yields any diagnostic. Carries every problem found in the
 * file, in discovery order, so a bad file is reported in one pass.
 */
public class DataLoadException extends RuntimeException {

    private final List<String> diagnostics;

    public DataLoadException(String kind, List<String> diagnostics) {
        super(kind + " validation errors:\n" + String.join("\n", diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public DataLoadException(String kind, String diagnostic, Throwable cause) {
        super(kind + " validation errors:\n" + diagnostic, cause);
        this.diagnostics = List.of(diagnostic);
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
