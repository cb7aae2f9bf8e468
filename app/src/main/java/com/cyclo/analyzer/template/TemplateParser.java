package com.cyclo.analyzer.template;

import com.cyclo.analyzer.core.AnalyzerConfig;
import com.cyclo.analyzer.core.NestingTooDeepException;
import com.cyclo.analyzer.core.TemplateAnalysisException;
import com.cyclo.analyzer.core.TemplateSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser turning lexer tokens into a {@link TemplateRoot}.
 * <p>
 * Supports the control-flow subset of Jinja2 ({@code if}, {@code for}) plus the
 * tags that only scope a body. Inheritance, includes, macros and loop controls
 * are parsed into {@link UnmodeledTag} so the caller can reject them by name.
 */
public class TemplateParser {

    private static final Set<String> IF_TERMINATORS = Set.of("elif", "else", "endif");
    private static final Set<String> FOR_TERMINATORS = Set.of("else", "endfor");
    private static final Set<String> SCOPED_TAGS = Set.of("with", "filter", "autoescape");
    private static final Set<String> UNMODELED_BLOCK_TAGS = Set.of("block", "macro", "call");
    private static final Set<String> UNMODELED_LEAF_TAGS = Set.of(
            "extends", "include", "import", "from", "break", "continue");

    private final TemplateLexer lexer;
    private final int maxDepth;

    public TemplateParser(AnalyzerConfig config) {
        this.lexer = new TemplateLexer(config);
        this.maxDepth = config.getMaxDepth();
    }

    public TemplateRoot parse(String templateName, String source) throws TemplateAnalysisException {
        List<Token> tokens = lexer.tokenize(templateName, source);
        Session session = new Session(templateName, tokens);
        // the root is level 1, its body level 2
        Body body = session.parseBody(Set.of(), null, 2);
        return new TemplateRoot(templateName, body.nodes());
    }

    private record Body(List<TemplateNode> nodes, Token terminator) {
    }

    /**
     * Cursor over the token list of a single parse.
     */
    private final class Session {

        private final String templateName;
        private final List<Token> tokens;
        private int pos;

        Session(String templateName, List<Token> tokens) {
            this.templateName = templateName;
            this.tokens = tokens;
        }

        /**
         * Parses nodes until one of {@code endTags} is reached (left unconsumed) or the
         * tokens run out. Running out is an error unless {@code endTags} is empty.
         *
         * @param level syntax tree level of the parsed nodes; an {@link Output} sits at
         *              this level and its items one below, matching how the graph
         *              builder counts nesting
         */
        Body parseBody(Set<String> endTags, Token opener, int level) throws TemplateAnalysisException {
            List<TemplateNode> nodes = new ArrayList<>();
            List<TemplateNode> buffer = new ArrayList<>();
            int bufferLine = 0;

            while (pos < tokens.size()) {
                Token token = tokens.get(pos);
                switch (token.type()) {
                    case TEXT -> {
                        checkLevel(level + 1, token);
                        if (buffer.isEmpty())
                            bufferLine = token.line();
                        buffer.add(new TemplateData(token.value(), token.line()));
                        pos++;
                    }
                    case VARIABLE -> {
                        if (token.value().isEmpty()) {
                            throw error("expected an expression, got end of print statement", token);
                        }
                        checkLevel(level + 1, token);
                        if (buffer.isEmpty())
                            bufferLine = token.line();
                        buffer.add(new Expression(token.value(), token.line()));
                        pos++;
                    }
                    case BLOCK -> {
                        flush(nodes, buffer, bufferLine);
                        String tag = token.tagName();
                        if (endTags.contains(tag)) {
                            return new Body(nodes, token);
                        }
                        pos++;
                        nodes.add(parseTag(token, level));
                    }
                }
            }
            flush(nodes, buffer, bufferLine);

            if (!endTags.isEmpty()) {
                String expected = String.join("' or '", endTags.stream().sorted().toList());
                int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
                throw new TemplateSyntaxException(
                        "unexpected end of template, expected '" + expected + "' to close the '"
                                + opener.tagName() + "' tag opened at line " + opener.line(),
                        templateName, line);
            }
            return new Body(nodes, null);
        }

        private void flush(List<TemplateNode> nodes, List<TemplateNode> buffer, int line) {
            if (!buffer.isEmpty()) {
                nodes.add(new Output(buffer, line));
                buffer.clear();
            }
        }

        private void checkLevel(int level, Token token) throws NestingTooDeepException {
            if (level > maxDepth) {
                throw new NestingTooDeepException(maxDepth, token.line());
            }
        }

        private TemplateNode parseTag(Token token, int level) throws TemplateAnalysisException {
            String tag = token.tagName();
            String args = token.tagArguments();
            if (tag.isEmpty()) {
                throw error("tag name expected", token);
            }
            checkLevel(level, token);

            if (UNMODELED_LEAF_TAGS.contains(tag)) {
                return new UnmodeledTag(tag, args, List.of(), token.line());
            }

            if (tag.equals("if"))
                return parseIf(token, level);
            if (tag.equals("for"))
                return parseFor(token, level);
            if (tag.equals("set"))
                return parseSet(token, level);
            if (SCOPED_TAGS.contains(tag)) {
                List<TemplateNode> body = parseClosedBody("end" + tag, token, level);
                return new ScopedBlockNode(tag, args, body, token.line());
            }
            if (UNMODELED_BLOCK_TAGS.contains(tag)) {
                List<TemplateNode> body = parseClosedBody("end" + tag, token, level);
                return new UnmodeledTag(tag, args, body, token.line());
            }
            if (tag.startsWith("end") || tag.equals("elif") || tag.equals("else")) {
                throw error("encountered unexpected tag '" + tag + "'", token);
            }
            throw error("encountered unknown tag '" + tag + "'", token);
        }

        private List<TemplateNode> parseClosedBody(String endTag, Token opener, int level)
                throws TemplateAnalysisException {
            Body body = parseBody(Set.of(endTag), opener, level + 1);
            pos++;
            return body.nodes();
        }

        private IfNode parseIf(Token opener, int level) throws TemplateAnalysisException {
            String test = requireTest(opener);
            Body body = parseBody(IF_TERMINATORS, opener, level + 1);

            List<IfNode> elifs = new ArrayList<>();
            List<TemplateNode> elseBody = null;
            Body current = body;
            while (true) {
                Token terminator = current.terminator();
                pos++;
                String tag = terminator.tagName();
                if (tag.equals("endif")) {
                    break;
                }
                if (tag.equals("elif")) {
                    String elifTest = requireTest(terminator);
                    // an elif branch is a child node of the if, so its body is one level deeper
                    checkLevel(level + 1, terminator);
                    current = parseBody(IF_TERMINATORS, opener, level + 2);
                    elifs.add(IfNode.branch(elifTest, current.nodes(), terminator.line()));
                } else {
                    current = parseBody(Set.of("endif"), opener, level + 1);
                    elseBody = current.nodes();
                }
            }
            return new IfNode(test, body.nodes(), elifs, elseBody, opener.line());
        }

        private String requireTest(Token token) throws TemplateSyntaxException {
            String test = token.tagArguments();
            if (test.isEmpty()) {
                throw error("expected an expression after '" + token.tagName() + "'", token);
            }
            return test;
        }

        private ForNode parseFor(Token opener, int level) throws TemplateAnalysisException {
            String args = opener.tagArguments();
            int in = Expressions.findKeyword(args, "in", 0);
            if (in < 0) {
                throw error("expected 'in' in for loop", opener);
            }
            String target = args.substring(0, in).trim();
            String rest = args.substring(in + 2).trim();

            boolean recursive = false;
            int recursiveAt = Expressions.findKeyword(rest, "recursive", 0);
            if (recursiveAt >= 0 && rest.substring(recursiveAt + "recursive".length()).isBlank()) {
                recursive = true;
                rest = rest.substring(0, recursiveAt).trim();
            }

            String filter = null;
            int ifAt = Expressions.findKeyword(rest, "if", 0);
            if (ifAt >= 0) {
                filter = rest.substring(ifAt + 2).trim();
                rest = rest.substring(0, ifAt).trim();
                if (filter.isEmpty()) {
                    throw error("expected a condition after 'if' in for loop", opener);
                }
            }

            if (target.isEmpty()) {
                throw error("expected a loop target before 'in'", opener);
            }
            if (rest.isEmpty()) {
                throw error("expected an iterable after 'in'", opener);
            }

            Body body = parseBody(FOR_TERMINATORS, opener, level + 1);
            pos++;
            List<TemplateNode> elseBody = null;
            if (body.terminator().tagName().equals("else")) {
                elseBody = parseClosedBody("endfor", opener, level);
            }
            return new ForNode(target, rest, body.nodes(), elseBody, filter, recursive, opener.line());
        }

        private TemplateNode parseSet(Token opener, int level) throws TemplateAnalysisException {
            String args = opener.tagArguments();
            int assign = Expressions.findAssignment(args);
            if (assign >= 0) {
                String target = args.substring(0, assign).trim();
                String value = args.substring(assign + 1).trim();
                if (target.isEmpty() || value.isEmpty()) {
                    throw error("malformed assignment", opener);
                }
                return new SetNode(target, value, opener.line());
            }
            if (args.isEmpty()) {
                throw error("expected an assignment target after 'set'", opener);
            }
            List<TemplateNode> body = parseClosedBody("endset", opener, level);
            return new SetBlockNode(args, body, opener.line());
        }

        private TemplateSyntaxException error(String reason, Token token) {
            return new TemplateSyntaxException(reason, templateName, token.line());
        }
    }
}
