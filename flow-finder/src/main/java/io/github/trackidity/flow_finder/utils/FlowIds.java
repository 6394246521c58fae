package io.github.trackidity.flow_finder.utils;

import io.github.trackidity.flow_finder.model.ContractFacts;
import io.github.trackidity.flow_finder.model.FunctionFacts;

/**
 * Builds the identifiers the presentation layer keys its hide/review state on. They
 * are derived from file, contract and signature only, so they survive re-analysis and
 * edits that merely move code.
 */
public class FlowIds {

    /**
     * Flow id of an entry point declared by the contract it is listed under.
     */
    public static String ownFlowId(ContractFacts contract, FunctionFacts function) {
        return contract.file() + "::" + contract.name() + "." + function.signature();
    }

    /**
     * Flow id of an entry point listed under {@code contract} but declared in {@code origin}.
     */
    public static String inheritedFlowId(ContractFacts contract, FunctionFacts function, ContractFacts origin) {
        return ownFlowId(contract, function) + "::from::" + origin.name();
    }

    public static String varId(ContractFacts contract, String variableName) {
        return contract.file() + "::" + contract.name() + "." + variableName;
    }

    /**
     * Canonical name of a declaration, e.g. {@code Token.transfer(address,uint256)}.
     */
    public static String canonicalName(ContractFacts contract, FunctionFacts function) {
        return contract.name() + "." + function.signature();
    }

    /**
     * Display label: the bare function name, without parameters.
     */
    public static String label(FunctionFacts function) {
        return function.name();
    }
}
