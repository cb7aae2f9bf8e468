package com.cyclo.analyzer.core;

/**
 * A syntax node whose control flow is not modelled (inheritance, includes,
 * macros, recursive or filtered loops, loop controls).
 */
public class UnsupportedConstructException extends TemplateAnalysisException {

    public static final int EXIT_CODE = 4;

    private final String construct;
    private final int line;

    public UnsupportedConstructException(String construct, int line) {
        super("Unsupported construct '" + construct + "' at line " + line);
        this.construct = construct;
        this.line = line;
    }

    public String getConstruct() {
        return construct;
    }

    public int getLine() {
        return line;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
