package io.github.trackidity.flow_finder.model;

/**
 * The declaration that won inheritance resolution for one name, with the contract
 * that declared it.
 */
public record Member<T>(T declaration, ContractFacts declaringContract, boolean inherited) {

    public String inheritedFrom() {
        return inherited ? declaringContract.name() : null;
    }
}
