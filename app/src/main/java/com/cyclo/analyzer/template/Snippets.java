package com.cyclo.analyzer.template;

/**
 * Quoting helpers for node descriptions.
 */
final class Snippets {

    private static final int MAX_LENGTH = 40;

    private Snippets() {
    }

    static String quote(String s) {
        if (s == null)
            return "None";
        String escaped = s
                .replace("\\", "\\\\")
                .replace("'", "\\'")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        if (escaped.length() > MAX_LENGTH) {
            escaped = escaped.substring(0, MAX_LENGTH - 3) + "...";
        }
        return "'" + escaped + "'";
    }
}
