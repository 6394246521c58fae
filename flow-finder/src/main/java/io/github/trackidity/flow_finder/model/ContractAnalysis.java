package io.github.trackidity.flow_finder.model;

import java.util.List;
import java.util.Map;

/**
 * Per concrete contract results handed to the result assembler.
 *
 * @param callTrees call trees keyed by entry point flow id
 */
public record ContractAnalysis(
        EffectiveContract effective,
        List<EntryPoint> entryPoints,
        List<TraceResult> traces,
        Map<String, List<CallTreeNode>> callTrees
) {
}
