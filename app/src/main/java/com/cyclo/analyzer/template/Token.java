package com.cyclo.analyzer.template;

/**
 * Lexer output. For {@link Type#VARIABLE} and {@link Type#BLOCK} the value is the
 * trimmed tag content without delimiters or whitespace-control markers.
 */
public record Token(Type type, String value, int line) {

    public enum Type {
        TEXT,
        VARIABLE,
        BLOCK
    }

    /**
     * Leading identifier of a block tag, e.g. {@code "for"} for {@code {% for x in y %}}
     * and {@code "if"} for {@code {% if(x) %}}. Empty when the tag does not start with
     * a name.
     */
    public String tagName() {
        if (value.isEmpty() || !isNameStart(value.charAt(0))) {
            return "";
        }
        int end = 1;
        while (end < value.length() && isNamePart(value.charAt(end))) {
            end++;
        }
        return value.substring(0, end);
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    /**
     * Everything after the tag name, trimmed.
     */
    public String tagArguments() {
        return value.substring(tagName().length()).trim();
    }
}
