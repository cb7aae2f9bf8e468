package com.cyclo.analyzer.core;

/**
 * Template nesting exceeds the configured depth limit.
 */
public class NestingTooDeepException extends TemplateAnalysisException {

    public static final int EXIT_CODE = 5;

    private final int limit;

    public NestingTooDeepException(int limit, int line) {
        super("Template nesting exceeds the limit of " + limit + " levels at line " + line);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
