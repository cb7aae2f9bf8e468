package com.cyclo.analyzer.core;

/**
 * Base type for every failure that ends an analysis run.
 * Each subtype maps to its own process exit code.
 */
public abstract class TemplateAnalysisException extends Exception {

    protected TemplateAnalysisException(String message) {
        super(message);
    }

    protected TemplateAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Exit status the CLI reports for this failure.
     */
    public abstract int exitCode();
}
