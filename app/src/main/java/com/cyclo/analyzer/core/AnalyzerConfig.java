package com.cyclo.analyzer.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for template analysis.
 * Loaded from cyclo.yaml in the working directory (or an explicit file) or uses
 * sensible defaults.
 */
public class AnalyzerConfig {

    public static final String DEFAULT_FILE_NAME = "cyclo.yaml";

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    // Parser defaults (Jinja2 environment defaults)
    private boolean trimBlocks = false;
    private boolean lstripBlocks = false;
    private boolean keepTrailingNewline = false;

    // Graph defaults
    private int maxDepth = 256;
    private boolean implicitElse = false;

    // Output defaults
    private boolean dumpGraph = true;

    /**
     * Look for cyclo.yaml in the given directory, or return defaults.
     * A file that exists but cannot be read falls back to defaults with a warning.
     */
    public static AnalyzerConfig discover(Path directory) {
        AnalyzerConfig config = new AnalyzerConfig();
        Path configFile = directory.resolve(DEFAULT_FILE_NAME);

        if (Files.exists(configFile)) {
            try {
                config.readFrom(configFile);
                log.info("Loaded configuration from: {}", configFile);
            } catch (IOException | YAMLException | ClassCastException e) {
                log.warn("Could not read config file {}, using defaults: {}", configFile, e.getMessage());
                return new AnalyzerConfig();
            }
        }
        return config;
    }

    /**
     * Load an explicitly requested configuration file. Unlike {@link #discover(Path)}
     * a missing or malformed file is an error.
     */
    public static AnalyzerConfig load(Path configFile) throws InputUnavailableException {
        if (!Files.isRegularFile(configFile)) {
            throw new InputUnavailableException(configFile, "no such file");
        }
        AnalyzerConfig config = new AnalyzerConfig();
        try {
            config.readFrom(configFile);
        } catch (IOException e) {
            throw new InputUnavailableException(configFile, e);
        } catch (YAMLException | ClassCastException e) {
            throw new InputUnavailableException(configFile, "malformed configuration: " + e.getMessage());
        }
        log.info("Loaded configuration from: {}", configFile);
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    private void readFrom(Path configFile) throws IOException {
        try (InputStream is = Files.newInputStream(configFile)) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(is);
            if (data != null) {
                parseYaml(data);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("parser") instanceof Map) {
            Map<String, Object> parser = (Map<String, Object>) data.get("parser");
            trimBlocks = getBool(parser, "trim_blocks", trimBlocks);
            lstripBlocks = getBool(parser, "lstrip_blocks", lstripBlocks);
            keepTrailingNewline = getBool(parser, "keep_trailing_newline", keepTrailingNewline);
        }

        if (data.get("graph") instanceof Map) {
            Map<String, Object> graph = (Map<String, Object>) data.get("graph");
            maxDepth = getInt(graph, "max_depth", maxDepth);
            implicitElse = getBool(graph, "implicit_else", implicitElse);
        }

        if (data.get("output") instanceof Map) {
            Map<String, Object> output = (Map<String, Object>) data.get("output");
            dumpGraph = getBool(output, "dump_graph", dumpGraph);
        }

        if (maxDepth < 1) {
            log.warn("graph.max_depth must be positive, got {}; using 256", maxDepth);
            maxDepth = 256;
        }
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    // Parser
    public boolean isTrimBlocks() {
        return trimBlocks;
    }

    public boolean isLstripBlocks() {
        return lstripBlocks;
    }

    public boolean isKeepTrailingNewline() {
        return keepTrailingNewline;
    }

    // Graph
    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isImplicitElse() {
        return implicitElse;
    }

    // Output
    public boolean isDumpGraph() {
        return dumpGraph;
    }

    public AnalyzerConfig withTrimBlocks(boolean trimBlocks) {
        this.trimBlocks = trimBlocks;
        return this;
    }

    public AnalyzerConfig withLstripBlocks(boolean lstripBlocks) {
        this.lstripBlocks = lstripBlocks;
        return this;
    }

    public AnalyzerConfig withKeepTrailingNewline(boolean keepTrailingNewline) {
        this.keepTrailingNewline = keepTrailingNewline;
        return this;
    }

    public AnalyzerConfig withDumpGraph(boolean dumpGraph) {
        this.dumpGraph = dumpGraph;
        return this;
    }

    public AnalyzerConfig withImplicitElse(boolean implicitElse) {
        this.implicitElse = implicitElse;
        return this;
    }

    /**
     * @throws IllegalArgumentException if {@code maxDepth} is below 1
     */
    public AnalyzerConfig withMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }
}
