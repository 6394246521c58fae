package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import io.github.trackidity.flow_finder.utils.PathClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * State of one analysis run: the filtered contracts, their lookup tables, the
 * resolved effective contracts and the recoverable diagnostics collected so far.
 * A new context is created for every run.
 */
public class AnalysisContext {

    private static final Logger log = LoggerFactory.getLogger(AnalysisContext.class);

    private final AnalysisConfig config;
    private final PathClassifier classifier;
    private final List<ContractFacts> contracts;
    private final Map<ContractId, ContractFacts> byId = new HashMap<>();
    private final Map<String, List<ContractFacts>> byName = new HashMap<>();
    private final Map<ContractId, EffectiveContract> effective = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public AnalysisContext(AnalysisUnit unit, AnalysisConfig config, PathClassifier classifier)
            throws AnalysisException {
        if (config.maxDepth() < 0) {
            throw new AnalysisException("max-depth must be >= 0, got " + config.maxDepth());
        }
        this.config = config;
        this.classifier = classifier;
        List<ContractFacts> kept = new ArrayList<>();
        for (ContractFacts contract : unit.contracts()) {
            if (contract.name() == null || contract.name().isBlank()) {
                throw new AnalysisException("Contract without a name in file " + contract.file());
            }
            if (contract.file() == null || contract.file().isBlank()) {
                throw new AnalysisException("Contract " + contract.name() + " has no source file");
            }
            if (classifier.isFiltered(contract.file())) {
                log.debug("Dropping {} ({}): matches a filter path", contract.name(), contract.file());
                continue;
            }
            if (byId.putIfAbsent(contract.id(), contract) != null) {
                throw new AnalysisException("Duplicate contract " + contract.name() + " in " + contract.file());
            }
            byName.computeIfAbsent(contract.name(), k -> new ArrayList<>()).add(contract);
            kept.add(contract);
        }
        byName.values().forEach(list -> list.sort(Comparator.comparing(ContractFacts::file)));
        this.contracts = List.copyOf(kept);
        log.debug("{} of {} contracts kept after path filtering", kept.size(), unit.contracts().size());
    }

    public AnalysisConfig config() {
        return config;
    }

    /**
     * Contracts in input order, filter paths already applied.
     */
    public List<ContractFacts> contracts() {
        return contracts;
    }

    /**
     * Resolves a contract referenced by name. A contract in {@code preferredFile} wins,
     * otherwise the first one in file order. Ambiguity is reported against {@code requester}.
     */
    public Optional<ContractFacts> resolveContract(String name, String preferredFile, String requester) {
        List<ContractFacts> candidates = byName.getOrDefault(name, List.of());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        for (ContractFacts candidate : candidates) {
            if (candidate.file().equals(preferredFile)) {
                return Optional.of(candidate);
            }
        }
        if (candidates.size() > 1) {
            warn(requester, "Ambiguous contract name " + name + ", using the one in " + candidates.get(0).file());
        }
        return Optional.of(candidates.get(0));
    }

    public void putEffective(EffectiveContract contract) {
        effective.put(contract.contract().id(), contract);
    }

    public Optional<EffectiveContract> effective(ContractId id) {
        return Optional.ofNullable(effective.get(id));
    }

    public boolean isDependency(ContractFacts contract) {
        return classifier.isDependency(contract);
    }

    public void warn(String contract, String message) {
        log.warn("{}: {}", contract, message);
        diagnostics.add(Diagnostic.warning(contract, message));
    }

    public void info(String contract, String message) {
        log.debug("{}: {}", contract, message);
        diagnostics.add(Diagnostic.info(contract, message));
    }

    /**
     * Diagnostics in a stable order, duplicates removed.
     */
    public List<Diagnostic> diagnostics() {
        return new ArrayList<>(new TreeSet<>(diagnostics));
    }
}
