package io.github.trackidity.flow_finder.model;

import java.util.List;

/**
 * The parsed facts of one analysis run, optionally with the run configuration.
 */
public record AnalysisUnit(List<ContractFacts> contracts, AnalysisConfig configuration) {

    public AnalysisUnit {
        contracts = contracts == null ? List.of() : List.copyOf(contracts);
    }

    public AnalysisUnit(List<ContractFacts> contracts) {
        this(contracts, null);
    }
}
