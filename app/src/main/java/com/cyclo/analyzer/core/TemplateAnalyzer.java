package com.cyclo.analyzer.core;

import com.cyclo.analyzer.structural.CfgBuilder;
import com.cyclo.analyzer.structural.ControlFlowGraph;
import com.cyclo.analyzer.structural.TemplateTreeAdapter;
import com.cyclo.analyzer.structural.metrics.ComplexityCalculator;
import com.cyclo.analyzer.template.TemplateNode;
import com.cyclo.analyzer.template.TemplateParser;
import com.cyclo.analyzer.template.TemplateRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a template, parses it, builds its control-flow graph and scores it.
 */
public class TemplateAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TemplateAnalyzer.class);

    private final AnalyzerConfig config;
    private final TemplateParser parser;

    public TemplateAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.parser = new TemplateParser(config);
    }

    /**
     * Analyse a template file. The file is read in full before parsing starts.
     */
    public AnalysisResult analyze(Path templateFile) throws TemplateAnalysisException {
        String source = read(templateFile);
        return analyzeSource(templateFile.toString(), source);
    }

    /**
     * Analyse template source that is already in memory.
     */
    public AnalysisResult analyzeSource(String templateName, String source) throws TemplateAnalysisException {
        TemplateRoot root = parser.parse(templateName, source);
        log.debug("Parsed {}: {} top-level nodes", templateName, root.body().size());

        CfgBuilder<TemplateNode> builder = new CfgBuilder<>(
                new TemplateTreeAdapter(), config.getMaxDepth(), config.isImplicitElse());
        ControlFlowGraph<TemplateNode> graph = builder.build(root);

        int complexity = ComplexityCalculator.calculate(graph);
        log.debug("{}: {} nodes, {} edges, complexity {}",
                templateName, graph.nodeCount(), graph.edgeCount(), complexity);
        return new AnalysisResult(templateName, graph, complexity);
    }

    private String read(Path templateFile) throws InputUnavailableException {
        if (Files.isDirectory(templateFile)) {
            throw new InputUnavailableException(templateFile, "is a directory");
        }
        try {
            return Files.readString(templateFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputUnavailableException(templateFile, e);
        }
    }
}
