package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import io.github.trackidity.flow_finder.utils.PathClassifier;

import java.util.Arrays;
import java.util.List;

/**
 * Small builders for contract facts, so tests read like the Solidity they model.
 */
final class ContractFixtures {

    static final String FILE = "contracts/Test.sol";

    private ContractFixtures() {
    }

    static ContractFacts contract(String name, List<String> bases, List<FunctionFacts> functions,
                                  List<StateVariableFacts> variables) {
        return contract(FILE, name, ContractKind.CONTRACT, bases, functions, List.of(), variables);
    }

    static ContractFacts contract(String file, String name, ContractKind kind, List<String> bases,
                                  List<FunctionFacts> functions, List<ModifierFacts> modifiers,
                                  List<StateVariableFacts> variables) {
        return new ContractFacts(file, name, kind, false, bases, null, functions, modifiers, variables,
                new Location(file, 0, 0));
    }

    static FunctionFacts function(String name, int line, List<CallRef> calls, List<WriteRef> writes) {
        return new FunctionFacts(name, List.of(), Visibility.PUBLIC, Mutability.NONPAYABLE, false, false, false, true,
                List.of(), calls, writes, at(line));
    }

    static FunctionFacts function(String name, Visibility visibility, Mutability mutability, int line) {
        return new FunctionFacts(name, List.of(), visibility, mutability, false, false, false, true, List.of(),
                List.of(), List.of(), at(line));
    }

    static FunctionFacts internal(String name, int line, List<CallRef> calls, List<WriteRef> writes) {
        return new FunctionFacts(name, List.of(), Visibility.INTERNAL, Mutability.NONPAYABLE, false, false, false,
                true, List.of(), calls, writes, at(line));
    }

    static FunctionFacts unimplemented(String name, int line) {
        return new FunctionFacts(name, List.of(), Visibility.PUBLIC, Mutability.NONPAYABLE, false, false, false,
                false, List.of(), List.of(), List.of(), at(line));
    }

    static FunctionFacts constructor(int line, List<CallRef> calls, List<WriteRef> writes) {
        return new FunctionFacts("constructor", List.of(), Visibility.PUBLIC, Mutability.NONPAYABLE, true, false,
                false, true, List.of(), calls, writes, at(line));
    }

    static FunctionFacts withModifiers(FunctionFacts function, String... modifiers) {
        return new FunctionFacts(function.name(), function.parameters(), function.visibility(),
                function.mutability(), function.constructor(), function.receive(), function.fallback(),
                function.implemented(), Arrays.asList(modifiers), function.calls(), function.writes(),
                function.location());
    }

    static ModifierFacts modifier(String name, int line, List<CallRef> calls, List<WriteRef> writes) {
        return new ModifierFacts(name, calls, writes, at(line));
    }

    static StateVariableFacts variable(String name, int line) {
        return new StateVariableFacts(name, "uint256", false, false, at(line));
    }

    static CallRef call(String name) {
        return CallRef.internal(null, name);
    }

    static WriteRef write(String variable) {
        return WriteRef.of(variable);
    }

    static Location at(int line) {
        return new Location(FILE, line, 4);
    }

    static AnalysisContext context(AnalysisConfig config, ContractFacts... contracts) throws AnalysisException {
        return new AnalysisContext(new AnalysisUnit(List.of(contracts)), config,
                PathClassifier.create(config.dependencyDirectories(), config.filterPaths()));
    }

    static AnalysisContext context(ContractFacts... contracts) throws AnalysisException {
        return context(AnalysisConfig.defaults(), contracts);
    }

    /**
     * Resolves inheritance and returns the effective view of the named contract.
     */
    static EffectiveContract effective(AnalysisContext context, String name) {
        InheritanceResolver.Resolution resolution = new InheritanceResolver(context).resolve();
        return resolution.contracts().stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
