package com.cyclo.analyzer;

import com.cyclo.analyzer.core.AnalysisResult;
import com.cyclo.analyzer.core.AnalyzerConfig;
import com.cyclo.analyzer.core.TemplateAnalysisException;
import com.cyclo.analyzer.core.TemplateAnalyzer;
import com.cyclo.analyzer.report.GraphDumpReporter;
import com.cyclo.analyzer.structural.graphs.CfgDotGenerator;
import com.cyclo.analyzer.template.TemplateNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cyclomatic complexity of a Jinja-style template.
 *
 * Usage: cyclo [--config <file>] [--dot <file>] [--quiet] <template>
 */
public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage(err);
            return EXIT_USAGE;
        }

        try {
            AnalyzerConfig config = cliArgs.configFile() != null
                    ? AnalyzerConfig.load(cliArgs.configFile())
                    : AnalyzerConfig.discover(Path.of(""));
            if (cliArgs.quiet()) {
                config = config.withDumpGraph(false);
            }

            // Analysis completes before anything is printed, so failures leave stdout empty
            AnalysisResult result = new TemplateAnalyzer(config).analyze(cliArgs.template());

            if (cliArgs.dotFile() != null) {
                String dot = new CfgDotGenerator().generateDot(
                        result.templateName(), result.graph(), TemplateNode::describe);
                Files.writeString(cliArgs.dotFile(), dot);
            }

            new GraphDumpReporter().report(result, out, config.isDumpGraph());
            return EXIT_OK;
        } catch (TemplateAnalysisException e) {
            err.println("Error: " + e.getMessage());
            return e.exitCode();
        } catch (IOException e) {
            err.println("Error: could not write " + cliArgs.dotFile() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("""
                Usage: cyclo [--config <file>] [--dot <file>] [--quiet] <template>

                Arguments:
                  <template>         Template file to analyze (required)
                  --config <file>    YAML configuration (default: ./cyclo.yaml if present)
                  --dot <file>       Also write the control-flow graph in Graphviz DOT format
                  --quiet            Print only the complexity score
                """);
    }

    private record CliArgs(
            Path template,
            Path configFile,
            Path dotFile,
            boolean quiet) {
    }

    private static CliArgs parseArgs(String[] args) {
        Path template = null;
        Path configFile = null;
        Path dotFile = null;
        boolean quiet = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> {
                    if (i + 1 >= args.length)
                        return null;
                    configFile = Path.of(args[++i]);
                }
                case "--dot" -> {
                    if (i + 1 >= args.length)
                        return null;
                    dotFile = Path.of(args[++i]);
                }
                case "--quiet", "-q" -> quiet = true;
                default -> {
                    if (args[i].startsWith("-") || template != null)
                        return null;
                    template = Path.of(args[i]);
                }
            }
        }

        if (template == null) {
            return null;
        }
        return new CliArgs(template, configFile, dotFile, quiet);
    }
}
