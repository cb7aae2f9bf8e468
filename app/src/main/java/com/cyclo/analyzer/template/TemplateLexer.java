package com.cyclo.analyzer.template;

import com.cyclo.analyzer.core.AnalyzerConfig;
import com.cyclo.analyzer.core.TemplateSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template source into text, variable and block tokens.
 * Comments are dropped; {@code raw} blocks come out as a single text token.
 */
public class TemplateLexer {

    private static final Pattern END_RAW = Pattern.compile("\\{%([-+]?)\\s*endraw\\s*([-+]?)%}");

    private final boolean trimBlocks;
    private final boolean lstripBlocks;
    private final boolean keepTrailingNewline;

    public TemplateLexer(AnalyzerConfig config) {
        this.trimBlocks = config.isTrimBlocks();
        this.lstripBlocks = config.isLstripBlocks();
        this.keepTrailingNewline = config.isKeepTrailingNewline();
    }

    public List<Token> tokenize(String templateName, String source) throws TemplateSyntaxException {
        String src = keepTrailingNewline ? source : dropTrailingNewline(source);
        List<Token> tokens = new ArrayList<>();

        int pos = 0;
        int line = 1;
        while (pos < src.length()) {
            int open = findOpening(src, pos);
            if (open < 0) {
                emitText(tokens, src.substring(pos), line);
                break;
            }

            char kind = src.charAt(open + 1);
            int innerStart = open + 2;
            char leftMarker = innerStart < src.length() ? src.charAt(innerStart) : 0;
            boolean leftStrip = leftMarker == '-';
            boolean leftKeep = leftMarker == '+' && kind != '{';
            if (leftStrip || leftKeep) {
                innerStart++;
            }

            String text = src.substring(pos, open);
            int textLine = line;
            line += countNewlines(text);
            if (leftStrip) {
                text = stripTrailing(text);
            } else if (lstripBlocks && kind != '{' && !leftKeep) {
                text = lstripLineTail(text, pos == 0 || src.charAt(pos - 1) == '\n');
            }
            emitText(tokens, text, textLine);

            int tagLine = line;
            String closing = switch (kind) {
                case '{' -> "}}";
                case '%' -> "%}";
                default -> "#}";
            };
            int close = kind == '#'
                    ? src.indexOf(closing, innerStart)
                    : findClosing(src, innerStart, closing);
            if (close < 0) {
                throw new TemplateSyntaxException(
                        "unexpected end of template, expected '" + closing + "'", templateName, tagLine);
            }

            String inner = src.substring(innerStart, close);
            boolean rightStrip = inner.endsWith("-");
            boolean rightKeep = inner.endsWith("+") && kind != '{';
            if (rightStrip || rightKeep) {
                inner = inner.substring(0, inner.length() - 1);
            }
            line += countNewlines(src.substring(open, close + 2));
            pos = close + 2;

            String content = inner.trim();
            if (kind == '%' && content.equals("raw")) {
                Matcher end = END_RAW.matcher(src);
                if (!end.find(pos)) {
                    throw new TemplateSyntaxException("missing end of raw directive", templateName, tagLine);
                }
                String raw = src.substring(pos, end.start());
                if (rightStrip) {
                    raw = raw.stripLeading();
                } else if (trimBlocks && !rightKeep && raw.startsWith("\n")) {
                    raw = raw.substring(1);
                }
                if (end.group(1).equals("-")) {
                    raw = stripTrailing(raw);
                }
                emitText(tokens, raw, line);
                line += countNewlines(src.substring(pos, end.end()));
                pos = end.end();
                rightStrip = end.group(2).equals("-");
                rightKeep = end.group(2).equals("+");
            } else if (kind == '{') {
                tokens.add(new Token(Token.Type.VARIABLE, content, tagLine));
            } else if (kind == '%') {
                if (content.isEmpty()) {
                    throw new TemplateSyntaxException("tag name expected", templateName, tagLine);
                }
                tokens.add(new Token(Token.Type.BLOCK, content, tagLine));
            }

            if (rightStrip) {
                int next = skipWhitespace(src, pos);
                line += countNewlines(src.substring(pos, next));
                pos = next;
            } else if (trimBlocks && kind != '{' && !rightKeep) {
                if (src.startsWith("\r\n", pos)) {
                    pos += 2;
                    line++;
                } else if (src.startsWith("\n", pos)) {
                    pos++;
                    line++;
                }
            }
        }
        return tokens;
    }

    private static String dropTrailingNewline(String source) {
        if (source.endsWith("\r\n"))
            return source.substring(0, source.length() - 2);
        if (source.endsWith("\n"))
            return source.substring(0, source.length() - 1);
        return source;
    }

    private static int findOpening(String src, int from) {
        int i = src.indexOf('{', from);
        while (i >= 0 && i + 1 < src.length()) {
            char next = src.charAt(i + 1);
            if (next == '{' || next == '%' || next == '#') {
                return i;
            }
            i = src.indexOf('{', i + 1);
        }
        return -1;
    }

    // The closing delimiter only counts outside string literals and open brackets,
    // so "%}" in a literal or "}}" ending a nested dict does not close the tag.
    private static int findClosing(String src, int from, String closing) {
        char quote = 0;
        int depth = 0;
        for (int i = from; i < src.length(); i++) {
            char c = src.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (depth == 0 && src.startsWith(closing, i)) {
                return i;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            }
        }
        return -1;
    }

    private static void emitText(List<Token> tokens, String text, int line) {
        if (!text.isEmpty()) {
            tokens.add(new Token(Token.Type.TEXT, text, line));
        }
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    // Removes spaces and tabs between the start of the tag's line and the tag.
    private static String lstripLineTail(String text, boolean startsAtLineStart) {
        int lineStart = text.lastIndexOf('\n') + 1;
        if (lineStart == 0 && !startsAtLineStart) {
            return text;
        }
        for (int i = lineStart; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return text;
            }
        }
        return text.substring(0, lineStart);
    }

    private static int skipWhitespace(String src, int from) {
        int i = from;
        while (i < src.length() && Character.isWhitespace(src.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int countNewlines(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
