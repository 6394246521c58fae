package io.github.trackidity.flow_finder.graph;

import io.github.trackidity.flow_finder.model.ContractFacts;
import io.github.trackidity.flow_finder.model.FunctionFacts;
import io.github.trackidity.flow_finder.model.ModifierFacts;

import java.util.*;
import java.util.function.IntFunction;

/**
 * Arena-backed call graph of one concrete contract. Units are appended once and
 * never removed, so handles stay valid for the lifetime of the graph.
 */
public class ContractCallGraph implements CallGraph {

    private final String contractName;
    private final List<CallableUnit> units = new ArrayList<>();
    private final List<List<CallEdge>> edges = new ArrayList<>();
    private final Map<String, Integer> handles = new HashMap<>();

    public ContractCallGraph(String contractName) {
        this.contractName = contractName;
    }

    public String contractName() {
        return contractName;
    }

    /**
     * Returns the handle of the unit, adding it first when it is new.
     */
    public int intern(ContractFacts contract, FunctionFacts function) {
        return intern(CallableUnit.idOf(contract, function), h -> new CallableUnit(h, contract, function, null));
    }

    public int intern(ContractFacts contract, ModifierFacts modifier) {
        return intern(CallableUnit.idOf(contract, modifier), h -> new CallableUnit(h, contract, null, modifier));
    }

    private int intern(String id, IntFunction<CallableUnit> factory) {
        Integer existing = handles.get(id);
        if (existing != null) {
            return existing;
        }
        int handle = units.size();
        units.add(factory.apply(handle));
        edges.add(List.of());
        handles.put(id, handle);
        return handle;
    }

    public void setEdges(int handle, List<CallEdge> out) {
        edges.set(handle, List.copyOf(out));
    }

    @Override
    public CallableUnit unit(int handle) {
        return units.get(handle);
    }

    @Override
    public List<CallEdge> callsFrom(int handle) {
        return edges.get(handle);
    }

    @Override
    public OptionalInt handleOf(String unitId) {
        Integer handle = handles.get(unitId);
        return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
    }

    @Override
    public int size() {
        return units.size();
    }
}
