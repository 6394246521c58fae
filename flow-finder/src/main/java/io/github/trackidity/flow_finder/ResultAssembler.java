package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import io.github.trackidity.flow_finder.utils.FlowIds;

import java.util.*;

/**
 * Turns per-contract analyses into the output document: entry points grouped by file,
 * and the inverted index from state variables to the entry points that write them.
 * All orderings are explicit so identical input gives byte-identical output.
 */
public class ResultAssembler {

    private static final Comparator<WriterView> WRITER_ORDER = Comparator
            .comparing(WriterView::location, Location::compare)
            .thenComparing(WriterView::label)
            .thenComparing(WriterView::flowId);

    private static final Comparator<VariableView> VARIABLE_ORDER = Comparator
            .comparingInt((VariableView v) -> v.location().line())
            .thenComparing(VariableView::name);

    public AnalysisResult assemble(List<ContractAnalysis> analyses, List<Diagnostic> diagnostics) {
        return AnalysisResult.success(files(analyses), variables(analyses), diagnostics);
    }

    private List<FileEntryPoints> files(List<ContractAnalysis> analyses) {
        Map<String, List<EntryPoint>> byFile = new TreeMap<>();
        Map<String, List<CallTreeNode>> trees = new HashMap<>();
        for (ContractAnalysis analysis : analyses) {
            for (EntryPoint entryPoint : analysis.entryPoints()) {
                byFile.computeIfAbsent(entryPoint.contract().file(), k -> new ArrayList<>()).add(entryPoint);
            }
            trees.putAll(analysis.callTrees());
        }
        List<FileEntryPoints> files = new ArrayList<>();
        for (Map.Entry<String, List<EntryPoint>> entry : byFile.entrySet()) {
            List<EntryPoint> entryPoints = new ArrayList<>(entry.getValue());
            entryPoints.sort(EntryPointClassifier.ORDER);
            List<EntryPointView> views = new ArrayList<>();
            for (EntryPoint entryPoint : entryPoints) {
                views.add(new EntryPointView(entryPoint.flowId(), entryPoint.label(), entryPoint.contract().name(),
                        entryPoint.inherited(), entryPoint.inheritedFrom(), entryPoint.tooltip(),
                        entryPoint.location(), trees.getOrDefault(entryPoint.flowId(), List.of())));
            }
            files.add(new FileEntryPoints(entry.getKey(), views));
        }
        return files;
    }

    private List<VariableGroup> variables(List<ContractAnalysis> analyses) {
        List<ContractAnalysis> ordered = new ArrayList<>(analyses);
        ordered.sort(Comparator.comparing(a -> a.effective().contract().id()));
        List<VariableGroup> groups = new ArrayList<>();
        for (ContractAnalysis analysis : ordered) {
            ContractFacts contract = analysis.effective().contract();
            List<VariableView> vars = new ArrayList<>();
            for (Member<StateVariableFacts> member : analysis.effective().variables().values()) {
                StateVariableFacts variable = member.declaration();
                if (!variable.isWritable()) {
                    continue;
                }
                VariableKey key = new VariableKey(member.declaringContract().id(), variable.name());
                List<WriterView> writers = writersOf(key, analysis.traces());
                if (writers.isEmpty()) {
                    continue;
                }
                Location location = variable.location() != null
                        ? variable.location()
                        : Location.unknown(member.declaringContract().file());
                vars.add(new VariableView(FlowIds.varId(contract, variable.name()), variable.name(), variable.type(),
                        contract.name(), member.inherited(), member.inheritedFrom(), variable.constant(),
                        variable.immutable(), location, writers));
            }
            if (!vars.isEmpty()) {
                vars.sort(VARIABLE_ORDER);
                groups.add(new VariableGroup(contract.file(), contract.name(), vars));
            }
        }
        return groups;
    }

    /**
     * Entry points writing the variable, one entry per flow id.
     */
    private static List<WriterView> writersOf(VariableKey key, List<TraceResult> traces) {
        Map<String, WriterView> writers = new LinkedHashMap<>();
        for (TraceResult trace : traces) {
            trace.writeOf(key).ifPresent(write -> {
                EntryPoint entryPoint = trace.entryPoint();
                writers.putIfAbsent(entryPoint.flowId(), new WriterView(entryPoint.flowId(), entryPoint.label(),
                        entryPoint.contract().name(), entryPoint.location(), write.kind(), write.pathLength()));
            });
        }
        List<WriterView> sorted = new ArrayList<>(writers.values());
        sorted.sort(WRITER_ORDER);
        return sorted;
    }
}
