package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.graph.CallEdge;
import io.github.trackidity.flow_finder.graph.CallGraph;
import io.github.trackidity.flow_finder.graph.CallableUnit;
import io.github.trackidity.flow_finder.graph.ContractCallGraph;
import io.github.trackidity.flow_finder.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.OptionalInt;

import static io.github.trackidity.flow_finder.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CallTreeSerializer
 */
@ExtendWith(MockitoExtension.class)
class CallTreeSerializerTest {

    private static EntryPoint entryPointOf(ContractFacts contract, FunctionFacts function) {
        return new EntryPoint(FILE + "::" + contract.name() + "." + function.signature(), function.name(), function,
                contract, contract, false, "", function.location());
    }

    private static List<CallTreeNode> serialize(AnalysisContext context, String concrete, String entry) {
        EffectiveContract effective = effective(context, concrete);
        List<EntryPoint> entryPoints = new EntryPointClassifier(context).classify(effective);
        ContractCallGraph graph = new CallGraphBuilder(context).build(effective, entryPoints);
        EntryPoint entryPoint = entryPoints.stream().filter(ep -> ep.label().equals(entry)).findFirst().orElseThrow();
        return new CallTreeSerializer(context).serialize(graph, entryPoint);
    }

    @Test
    void testCycleLeavesOnMockGraph() throws AnalysisException {
        FunctionFacts rootFn = function("run", 1, List.of(), List.of());
        FunctionFacts helperFn = internal("helper", 2, List.of(), List.of());
        FunctionFacts innerFn = internal("inner", 3, List.of(), List.of());
        ContractFacts contract = contract("Rec", List.of(), List.of(rootFn, helperFn, innerFn), List.of());
        AnalysisContext context = context(contract);

        CallGraph graph = mock(CallGraph.class);
        when(graph.handleOf(CallableUnit.idOf(contract, rootFn))).thenReturn(OptionalInt.of(0));
        when(graph.unit(0)).thenReturn(new CallableUnit(0, contract, rootFn, null));
        when(graph.unit(1)).thenReturn(new CallableUnit(1, contract, helperFn, null));
        when(graph.unit(2)).thenReturn(new CallableUnit(2, contract, innerFn, null));
        when(graph.callsFrom(0)).thenReturn(List.of(
                new CallEdge(CallKind.INTERNAL, 1, "helper", "Rec", at(5)),
                new CallEdge(CallKind.EXTERNAL, CallEdge.NO_TARGET, "transfer", "IERC20", at(6)),
                new CallEdge(CallKind.INTERNAL, 0, "run", "Rec", at(7))));
        when(graph.callsFrom(1)).thenReturn(List.of(new CallEdge(CallKind.INTERNAL, 2, "inner", "Rec", at(8))));
        when(graph.callsFrom(2)).thenReturn(List.of(new CallEdge(CallKind.INTERNAL, 1, "helper", "Rec", at(9))));

        List<CallTreeNode> calls = new CallTreeSerializer(context).serialize(graph, entryPointOf(contract, rootFn));

        assertEquals(3, calls.size());
        CallTreeNode helper = calls.get(0);
        assertEquals(NodeStatus.EXPANDED, helper.status());
        assertEquals("Internal", helper.kindLabel());
        assertEquals("Rec.helper()", helper.tooltip());
        CallTreeNode inner = helper.calls().get(0);
        assertEquals(NodeStatus.EXPANDED, inner.status());
        CallTreeNode back = inner.calls().get(0);
        assertTrue(back.cycle());
        assertEquals(CallableUnit.idOf(contract, helperFn), back.ref());
        assertTrue(back.calls().isEmpty());

        CallTreeNode external = calls.get(1);
        assertEquals(NodeStatus.LEAF, external.status());
        assertEquals("IERC20.transfer", external.tooltip());
        assertFalse(external.cycle());

        CallTreeNode self = calls.get(2);
        assertTrue(self.cycle());
        assertEquals(CallableUnit.idOf(contract, rootFn), self.ref());
    }

    @Test
    void testNodesBeyondMaxDepthAreTruncatedLeaves() throws AnalysisException {
        ContractFacts contract = contract("Deep", List.of(), List.of(
                function("entry", 1, List.of(call("level1")), List.of()),
                internal("level1", 2, List.of(call("level2")), List.of()),
                internal("level2", 3, List.of(), List.of())), List.of());
        AnalysisConfig config = AnalysisConfig.defaults().withMaxDepth(1);
        List<CallTreeNode> calls = serialize(context(config, contract), "Deep", "entry");

        CallTreeNode level1 = calls.get(0);
        assertEquals(NodeStatus.EXPANDED, level1.status());
        CallTreeNode level2 = level1.calls().get(0);
        assertEquals(NodeStatus.TRUNCATED, level2.status());
        assertTrue(level2.truncated());
        assertFalse(level2.cycle());
        assertNull(level2.ref());
    }

    @Test
    void testRepeatedExpansionIsShared() throws AnalysisException {
        ContractFacts contract = contract("Fan", List.of(), List.of(
                function("entry", 1, List.of(call("a"), call("b")), List.of()),
                internal("a", 2, List.of(call("common")), List.of()),
                internal("b", 3, List.of(call("common")), List.of()),
                internal("common", 4, List.of(), List.of())), List.of());
        List<CallTreeNode> calls = serialize(context(contract), "Fan", "entry");

        CallTreeNode first = calls.get(0).calls().get(0);
        CallTreeNode second = calls.get(1).calls().get(0);
        assertEquals("common", first.label());
        assertFalse(first.shared());
        assertTrue(second.shared());
        assertEquals(NodeStatus.EXPANDED, second.status());
    }

    @Test
    void testDependencyCallsAreCollapsedUnlessExpanded() throws AnalysisException {
        ContractFacts vendor = new ContractFacts("node_modules/vendor/Base.sol", "VendorBase", ContractKind.ABSTRACT,
                false, List.of(), null, List.of(internal("_hook", 2, List.of(call("_inner")), List.of()),
                internal("_inner", 3, List.of(), List.of())), List.of(), List.of(), null);
        ContractFacts app = contract("App", List.of("VendorBase"),
                List.of(function("go", 1, List.of(call("_hook")), List.of())), List.of());

        CallTreeNode collapsed = serialize(context(vendor, app), "App", "go").get(0);
        assertEquals(NodeStatus.COLLAPSED, collapsed.status());
        assertTrue(collapsed.calls().isEmpty());

        AnalysisConfig expand = AnalysisConfig.defaults().withExpandDependencies(true);
        CallTreeNode expanded = serialize(context(expand, vendor, app), "App", "go").get(0);
        assertEquals(NodeStatus.EXPANDED, expanded.status());
        assertEquals("_inner", expanded.calls().get(0).label());
    }
}
