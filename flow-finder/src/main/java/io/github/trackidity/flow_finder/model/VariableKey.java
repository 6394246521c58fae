package io.github.trackidity.flow_finder.model;

/**
 * Identity of a state variable: the declaring contract plus the variable name.
 */
public record VariableKey(ContractId contract, String name) {

    @Override
    public String toString() {
        return contract.name() + "." + name;
    }
}
