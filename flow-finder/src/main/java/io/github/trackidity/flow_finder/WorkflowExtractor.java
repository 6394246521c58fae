package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.graph.ContractCallGraph;
import io.github.trackidity.flow_finder.model.*;
import io.github.trackidity.flow_finder.utils.PathClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs one analysis over a snapshot of contract facts: inheritance resolution, entry point
 * classification, call graph construction, write tracing and call tree serialization for
 * every concrete contract. A run either yields the complete result or fails as a whole.
 */
public class WorkflowExtractor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExtractor.class);

    /**
     * The result document and the per entry point traversal statistics of a run.
     */
    public record Extraction(AnalysisResult result, List<TraceStats> traceStats) {
    }

    /**
     * Analyzes the unit with its own configuration, or the defaults when it has none.
     */
    public Extraction extract(AnalysisUnit unit) {
        return extract(unit, unit.configuration() != null ? unit.configuration() : AnalysisConfig.defaults());
    }

    public Extraction extract(AnalysisUnit unit, AnalysisConfig config) {
        try {
            return run(unit, config);
        } catch (AnalysisException e) {
            log.error("Analysis failed: {}", e.getMessage());
            return new Extraction(AnalysisResult.failure(e.getMessage()), List.of());
        }
    }

    private Extraction run(AnalysisUnit unit, AnalysisConfig config) throws AnalysisException {
        PathClassifier classifier = PathClassifier.create(config.dependencyDirectories(), config.filterPaths());
        AnalysisContext context = new AnalysisContext(unit, config, classifier);

        InheritanceResolver.Resolution resolution = new InheritanceResolver(context).resolve();
        if (resolution.hasErrors()) {
            Map.Entry<ContractId, String> first = resolution.errors().entrySet().iterator().next();
            throw new AnalysisException(first.getValue());
        }

        EntryPointClassifier entryPointClassifier = new EntryPointClassifier(context);
        CallGraphBuilder graphBuilder = new CallGraphBuilder(context);
        WriteReachabilityTracer tracer = new WriteReachabilityTracer(context);
        CallTreeSerializer serializer = new CallTreeSerializer(context);

        List<ContractAnalysis> analyses = new ArrayList<>();
        List<TraceStats> stats = new ArrayList<>();
        int entryPointCount = 0;
        for (EffectiveContract effective : resolution.contracts()) {
            if (!entryPointClassifier.isConcrete(effective.contract())) {
                continue;
            }
            List<EntryPoint> entryPoints = entryPointClassifier.classify(effective);
            ContractCallGraph graph = graphBuilder.build(effective, entryPoints);
            List<TraceResult> traces = new ArrayList<>();
            Map<String, List<CallTreeNode>> trees = new LinkedHashMap<>();
            for (EntryPoint entryPoint : entryPoints) {
                TraceResult trace = tracer.trace(entryPoint, effective, graph);
                traces.add(trace);
                stats.add(TraceStats.of(trace));
                trees.put(entryPoint.flowId(), serializer.serialize(graph, entryPoint));
            }
            entryPointCount += entryPoints.size();
            analyses.add(new ContractAnalysis(effective, entryPoints, traces, trees));
        }

        List<Diagnostic> diagnostics = context.diagnostics();
        AnalysisResult result = new ResultAssembler().assemble(analyses, diagnostics);
        log.info("Found {} entry points in {} concrete contracts", entryPointCount, analyses.size());
        if (!diagnostics.isEmpty()) {
            log.info("{} references could not be resolved and were dropped", diagnostics.size());
        }
        stats.sort(Comparator.comparing(TraceStats::flowId));
        return new Extraction(result, stats);
    }
}
