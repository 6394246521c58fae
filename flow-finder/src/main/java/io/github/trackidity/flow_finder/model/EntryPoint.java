package io.github.trackidity.flow_finder.model;

/**
 * An externally reachable, state-changing function of a concrete contract.
 *
 * @param flowId            stable fingerprint, see {@link io.github.trackidity.flow_finder.utils.FlowIds}
 * @param contract          the concrete contract this entry point is listed under
 * @param declaringContract the contract that declares the function
 */
public record EntryPoint(
        String flowId,
        String label,
        FunctionFacts function,
        ContractFacts contract,
        ContractFacts declaringContract,
        boolean inherited,
        String tooltip,
        Location location
) {

    public String inheritedFrom() {
        return inherited ? declaringContract.name() : null;
    }
}
