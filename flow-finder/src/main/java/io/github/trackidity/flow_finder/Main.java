package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.AnalysisConfig;
import io.github.trackidity.flow_finder.model.AnalysisResult;
import io.github.trackidity.flow_finder.model.AnalysisUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

public class Main {

    static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CLIEntryPoint()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Command(name = "flow-finder", subcommands = {Analyzer.class}, mixinStandardHelpOptions = true,
            version = "0.1")
    public static class CLIEntryPoint implements Runnable {
        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }
    }

    @CommandLine.Command(name = "analyze", mixinStandardHelpOptions = true, version = "0.1",
            description = "Finds the state-changing entry points of every concrete contract and the entry points "
                    + "that can write each state variable.")
    static class Analyzer implements Callable<Integer> {
        @CommandLine.Option(
                names = {"-i", "--input"},
                paramLabel = "INPUT",
                description = "The path to the contract facts JSON produced by the Solidity front-end",
                required = true
        )
        Path input;

        @CommandLine.Option(
                names = {"-o", "--output"},
                paramLabel = "OUTPUT",
                description = "The path to the file the analysis result should be written to. If not specified,"
                        + " the result is written to stdout."
        )
        Path output;

        @CommandLine.Option(
                names = {"-s", "--stats-file"},
                paramLabel = "STATS-FILE",
                description = "The path to the file where per entry point traversal statistics should be written to"
        )
        Path statsFile;

        @CommandLine.Option(
                names = {"-d", "--max-depth"},
                paramLabel = "MAX-DEPTH",
                description = "Call depth bound for tracing and call trees. Overrides the input configuration."
        )
        Integer maxDepth;

        @CommandLine.Option(
                names = {"--exclude-dependencies"},
                paramLabel = "BOOLEAN",
                description = "Hide dependency contracts and do not expand calls into dependency code",
                arity = "1"
        )
        Boolean excludeDependencies;

        @CommandLine.Option(
                names = {"--expand-dependencies"},
                paramLabel = "BOOLEAN",
                description = "Expand calls into dependency code even when dependencies are excluded",
                arity = "1"
        )
        Boolean expandDependencies;

        @CommandLine.Option(
                names = {"--include-abstract"},
                paramLabel = "BOOLEAN",
                description = "List entry points and variables of abstract contracts too",
                arity = "1"
        )
        Boolean includeAbstract;

        @CommandLine.Option(
                names = {"-f", "--filter-path"},
                paramLabel = "GLOB",
                description = "Files matching this pattern are dropped before analysis. Can be repeated."
        )
        List<String> filterPaths;

        @Override
        public Integer call() {
            WorkflowExtractor.Extraction extraction;
            try {
                AnalysisUnit unit = new AnalysisUnitLoader().load(input);
                extraction = new WorkflowExtractor().extract(unit, configure(unit));
            } catch (AnalysisException e) {
                log.error("Analysis failed: {}", e.getMessage());
                extraction = new WorkflowExtractor.Extraction(AnalysisResult.failure(e.getMessage()), List.of());
            }
            try {
                if (output != null) {
                    ResultWriter.writeResult(extraction.result(), output);
                } else {
                    ResultWriter.writeResult(extraction.result(), System.out);
                }
                if (statsFile != null && extraction.result().ok()) {
                    ResultWriter.writeTraceStatsToJson(extraction.traceStats(), statsFile);
                }
            } catch (IOException e) {
                log.error("Failed to write analysis result", e);
                return 1;
            }
            return extraction.result().ok() ? 0 : 1;
        }

        /**
         * The input document's configuration with the options given on the command line applied on top.
         */
        AnalysisConfig configure(AnalysisUnit unit) {
            AnalysisConfig config = unit.configuration() != null ? unit.configuration() : AnalysisConfig.defaults();
            if (maxDepth != null) {
                config = config.withMaxDepth(maxDepth);
            }
            if (excludeDependencies != null) {
                config = config.withExcludeDependencies(excludeDependencies);
            }
            if (expandDependencies != null) {
                config = config.withExpandDependencies(expandDependencies);
            }
            if (includeAbstract != null) {
                config = config.withIncludeAbstract(includeAbstract);
            }
            if (filterPaths != null && !filterPaths.isEmpty()) {
                config = config.withFilterPaths(filterPaths);
            }
            return config;
        }
    }
}
