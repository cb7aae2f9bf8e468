package com.cyclo.analyzer.core;

/**
 * The template source was rejected by the parser.
 */
public class TemplateSyntaxException extends TemplateAnalysisException {

    public static final int EXIT_CODE = 3;

    private final String templateName;
    private final int line;
    private final String reason;

    public TemplateSyntaxException(String reason, String templateName, int line) {
        super(templateName + ":" + line + ": " + reason);
        this.reason = reason;
        this.templateName = templateName;
        this.line = line;
    }

    public String getTemplateName() {
        return templateName;
    }

    /**
     * 1-based line the error was detected on.
     */
    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }
}
