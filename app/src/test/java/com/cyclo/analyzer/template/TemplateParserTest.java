package com.cyclo.analyzer.template;

import com.cyclo.analyzer.core.AnalyzerConfig;
import com.cyclo.analyzer.core.NestingTooDeepException;
import com.cyclo.analyzer.core.TemplateAnalysisException;
import com.cyclo.analyzer.core.TemplateSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateParserTest {

    private final TemplateParser parser = new TemplateParser(AnalyzerConfig.defaults());

    private TemplateRoot parse(String source) throws TemplateAnalysisException {
        return parser.parse("test.j2", source);
    }

    private TemplateSyntaxException syntaxError(String source) {
        return assertThrows(TemplateSyntaxException.class, () -> parse(source));
    }

    @Test
    void testTextAndExpressionsShareOneOutput() throws TemplateAnalysisException {
        TemplateRoot root = parse("Hello {{ name }}!");

        assertEquals("test.j2", root.name());
        assertEquals(1, root.body().size());
        Output output = assertInstanceOf(Output.class, root.body().get(0));
        assertEquals(List.of(
                new TemplateData("Hello ", 1),
                new Expression("name", 1),
                new TemplateData("!", 1)), output.items());
    }

    @Test
    void testBlockTagSplitsOutput() throws TemplateAnalysisException {
        TemplateRoot root = parse("a{% set x = 1 %}b");

        assertEquals(3, root.body().size());
        assertInstanceOf(Output.class, root.body().get(0));
        assertEquals(new SetNode("x", "1", 1), root.body().get(1));
        assertInstanceOf(Output.class, root.body().get(2));
    }

    @Test
    void testIfElifElse() throws TemplateAnalysisException {
        TemplateRoot root = parse("{% if x %}A{% elif y %}B{% elif z %}C{% else %}D{% endif %}");

        IfNode node = assertInstanceOf(IfNode.class, root.body().get(0));
        assertEquals("x", node.test());
        assertEquals(1, node.body().size());
        assertEquals(2, node.elifs().size());
        assertEquals("y", node.elifs().get(0).test());
        assertEquals("z", node.elifs().get(1).test());
        assertTrue(node.elifs().get(0).elifs().isEmpty(), "Elif branches carry no nested elifs");
        assertTrue(node.elifs().get(0).elseBranch().isEmpty(), "Else belongs to the outer if");
        assertTrue(node.elseBranch().isPresent());
        assertEquals(1, node.elseBranch().get().size());
    }

    @Test
    void testIfWithoutElse() throws TemplateAnalysisException {
        IfNode node = assertInstanceOf(IfNode.class, parse("{% if x %}A{% endif %}").body().get(0));
        assertTrue(node.elseBranch().isEmpty());
        assertTrue(node.elifs().isEmpty());
    }

    @Test
    void testTagNameEndsAtFirstNonIdentifierCharacter() throws TemplateAnalysisException {
        IfNode node = assertInstanceOf(IfNode.class,
                parse("{% if(x) %}A{% elif(y) %}B{% endif %}").body().get(0));
        assertEquals("(x)", node.test());
        assertEquals(1, node.elifs().size());
        assertEquals("(y)", node.elifs().get(0).test());

        ForNode loop = assertInstanceOf(ForNode.class,
                parse("{% for(x) in y %}{{ x }}{% endfor %}").body().get(0));
        assertEquals("(x)", loop.target());
        assertEquals("y", loop.iterable());
    }

    @Test
    void testTagWithoutName() {
        TemplateSyntaxException e = syntaxError("{% (x) %}");
        assertEquals("tag name expected", e.getReason());
    }

    @Test
    void testForLoopParts() throws TemplateAnalysisException {
        ForNode node = assertInstanceOf(ForNode.class,
                parse("{% for key, value in config.items() %}{{ key }}{% else %}none{% endfor %}").body().get(0));

        assertEquals("key, value", node.target());
        assertEquals("config.items()", node.iterable());
        assertEquals(1, node.body().size());
        assertTrue(node.elseBranch().isPresent());
        assertTrue(node.loopFilter().isEmpty());
        assertFalse(node.recursive());
    }

    @Test
    void testForLoopFilterAndRecursive() throws TemplateAnalysisException {
        ForNode filtered = assertInstanceOf(ForNode.class,
                parse("{% for u in users if u.active %}x{% endfor %}").body().get(0));
        assertEquals("users", filtered.iterable());
        assertEquals("u.active", filtered.filter());

        ForNode recursive = assertInstanceOf(ForNode.class,
                parse("{% for item in tree recursive %}x{% endfor %}").body().get(0));
        assertEquals("tree", recursive.iterable());
        assertTrue(recursive.recursive());
    }

    @Test
    void testKeywordInsideStringIsNotSplit() throws TemplateAnalysisException {
        ForNode node = assertInstanceOf(ForNode.class,
                parse("{% for c in 'skip if in doubt' %}x{% endfor %}").body().get(0));
        assertEquals("'skip if in doubt'", node.iterable());
        assertNull(node.filter());
    }

    @Test
    void testSetBlockAndScopedBlocks() throws TemplateAnalysisException {
        TemplateRoot root = parse("{% set greeting %}hi{% endset %}"
                + "{% with a = 1 %}{{ a }}{% endwith %}"
                + "{% filter upper %}x{% endfilter %}"
                + "{% autoescape true %}y{% endautoescape %}");

        assertEquals(4, root.body().size());
        SetBlockNode set = assertInstanceOf(SetBlockNode.class, root.body().get(0));
        assertEquals("greeting", set.target());
        ScopedBlockNode with = assertInstanceOf(ScopedBlockNode.class, root.body().get(1));
        assertEquals("with", with.tag());
        assertEquals("a = 1", with.arguments());
        assertEquals("filter", ((ScopedBlockNode) root.body().get(2)).tag());
        assertEquals("autoescape", ((ScopedBlockNode) root.body().get(3)).tag());
    }

    @Test
    void testSetWithComparisonIsNotSplitOnEquals() throws TemplateAnalysisException {
        SetNode set = assertInstanceOf(SetNode.class, parse("{% set ok = a == b %}").body().get(0));
        assertEquals("ok", set.target());
        assertEquals("a == b", set.value());
    }

    @Test
    void testUnmodeledTagsAreParsed() throws TemplateAnalysisException {
        TemplateRoot root = parse("{% extends 'base.j2' %}"
                + "{% block content %}{% if x %}A{% endif %}{% endblock %}"
                + "{% include 'other.j2' %}"
                + "{% macro m(a) %}{{ a }}{% endmacro %}");

        assertEquals(4, root.body().size());
        UnmodeledTag block = assertInstanceOf(UnmodeledTag.class, root.body().get(1));
        assertEquals("block", block.tag());
        assertEquals(1, block.body().size());
        assertEquals("include", ((UnmodeledTag) root.body().get(2)).tag());
    }

    @Test
    void testMissingEndTag() {
        TemplateSyntaxException e = syntaxError("{% if x %}\nA\n{% for i in y %}B{% endfor %}");
        assertTrue(e.getReason().contains("'endif'"), e.getReason());
        assertTrue(e.getReason().contains("line 1"), e.getReason());
    }

    @Test
    void testUnexpectedEndTag() {
        TemplateSyntaxException e = syntaxError("A\n{% endfor %}");
        assertEquals(2, e.getLine());
        assertTrue(e.getReason().contains("unexpected tag 'endfor'"));
    }

    @Test
    void testMismatchedEndTag() {
        TemplateSyntaxException e = syntaxError("{% if x %}A{% endfor %}");
        assertTrue(e.getReason().contains("'endfor'"));
    }

    @Test
    void testElifAfterElse() {
        TemplateSyntaxException e = syntaxError("{% if x %}A{% else %}B{% elif y %}C{% endif %}");
        assertTrue(e.getReason().contains("'elif'"));
    }

    @Test
    void testUnknownTag() {
        TemplateSyntaxException e = syntaxError("{% frobnicate %}");
        assertEquals("encountered unknown tag 'frobnicate'", e.getReason());
    }

    @Test
    void testMalformedTags() {
        syntaxError("{% if %}A{% endif %}");
        syntaxError("{% if x %}A{% elif %}B{% endif %}");
        syntaxError("{% for i %}A{% endfor %}");
        syntaxError("{% for in items %}A{% endfor %}");
        syntaxError("{% for i in %}A{% endfor %}");
        syntaxError("{% for i in x if %}A{% endfor %}");
        syntaxError("{% set %}");
        syntaxError("{{ }}");
    }

    @Test
    void testNestingLimit() {
        TemplateParser shallow = new TemplateParser(AnalyzerConfig.defaults().withMaxDepth(3));
        String source = "{% if a %}{% if b %}{% if c %}x{% endif %}{% endif %}{% endif %}";

        assertThrows(NestingTooDeepException.class, () -> shallow.parse("t", source));
        assertDoesNotThrow(() -> parser.parse("t", source));
    }

    @Test
    void testNestingLimitCountsOutputAndElifLevels() {
        // root 1, if 2, output 3, text 4
        String ifOnly = "{% if x %}A{% endif %}";
        assertThrows(NestingTooDeepException.class,
                () -> new TemplateParser(AnalyzerConfig.defaults().withMaxDepth(3)).parse("t", ifOnly));
        assertDoesNotThrow(() -> new TemplateParser(AnalyzerConfig.defaults().withMaxDepth(4)).parse("t", ifOnly));

        // the elif branch adds a level: elif 3, output 4, text 5
        String withElif = "{% if x %}A{% elif y %}B{% endif %}";
        assertThrows(NestingTooDeepException.class,
                () -> new TemplateParser(AnalyzerConfig.defaults().withMaxDepth(4)).parse("t", withElif));
        assertDoesNotThrow(() -> new TemplateParser(AnalyzerConfig.defaults().withMaxDepth(5)).parse("t", withElif));
    }

    @Test
    void testNodeLines() throws TemplateAnalysisException {
        TemplateRoot root = parse("first\n{% for i in x %}\n  {% if i %}y{% endif %}\n{% endfor %}");

        ForNode loop = assertInstanceOf(ForNode.class, root.body().get(1));
        assertEquals(2, loop.line());
        IfNode inner = assertInstanceOf(IfNode.class, loop.body().get(1));
        assertEquals(3, inner.line());
    }
}
