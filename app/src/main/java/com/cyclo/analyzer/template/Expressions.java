package com.cyclo.analyzer.template;

/**
 * Scanning helpers for tag arguments. Only positions outside string literals and
 * brackets count as top level.
 */
final class Expressions {

    private Expressions() {
    }

    /**
     * Index of the first top-level occurrence of {@code word} as a whole word, or -1.
     */
    static int findKeyword(String s, String word, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                default -> {
                    if (depth == 0 && s.startsWith(word, i)
                            && isBoundary(s, i - 1) && isBoundary(s, i + word.length())) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    /**
     * Index of the top-level {@code =} of an assignment, skipping comparison operators.
     */
    static int findAssignment(String s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                case '=' -> {
                    char prev = i > 0 ? s.charAt(i - 1) : ' ';
                    char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
                    if (depth == 0 && next != '=' && "=!<>".indexOf(prev) < 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private static boolean isBoundary(String s, int index) {
        if (index < 0 || index >= s.length())
            return true;
        char c = s.charAt(index);
        return !(Character.isLetterOrDigit(c) || c == '_' || c == '.');
    }
}
