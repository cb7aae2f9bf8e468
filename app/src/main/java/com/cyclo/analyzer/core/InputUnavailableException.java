package com.cyclo.analyzer.core;

import java.nio.file.Path;

/**
 * The template (or an explicitly requested config file) is missing or unreadable.
 */
public class InputUnavailableException extends TemplateAnalysisException {

    public static final int EXIT_CODE = 2;

    private final Path path;

    public InputUnavailableException(Path path, Throwable cause) {
        super("Cannot read " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public InputUnavailableException(Path path, String reason) {
        super("Cannot read " + path + ": " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public int exitCode() {
        return EXIT_CODE;
    }

    private static String describe(Throwable cause) {
        if (cause == null)
            return "unknown error";
        String name = cause.getClass().getSimpleName();
        return switch (name) {
            case "NoSuchFileException" -> "no such file";
            case "AccessDeniedException" -> "permission denied";
            case "MalformedInputException" -> "not valid UTF-8 text";
            default -> cause.getMessage() != null ? cause.getMessage() : name;
        };
    }
}
