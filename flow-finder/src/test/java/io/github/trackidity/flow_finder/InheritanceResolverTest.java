package io.github.trackidity.flow_finder;

import io.github.trackidity.flow_finder.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.trackidity.flow_finder.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InheritanceResolver
 */
class InheritanceResolverTest {

    private static List<String> names(EffectiveContract effective) {
        return effective.precedence().stream().map(ContractFacts::name).toList();
    }

    @Test
    void testFirstListedBaseWins() throws AnalysisException {
        ContractFacts base1 = contract("Base1", List.of(), List.of(function("f", 1, List.of(), List.of())), List.of());
        ContractFacts base2 = contract("Base2", List.of(), List.of(function("f", 5, List.of(), List.of())), List.of());
        ContractFacts derived = contract("Derived", List.of("Base1", "Base2"), List.of(), List.of());
        EffectiveContract effective = effective(context(base1, base2, derived), "Derived");

        Member<FunctionFacts> f = effective.function("f()").orElseThrow();
        assertEquals("Base1", f.declaringContract().name());
        assertTrue(f.inherited());
        assertEquals("Base1", f.inheritedFrom());
        assertEquals(List.of("Derived", "Base1", "Base2"), names(effective));
    }

    @Test
    void testOverrideShadowsBase() throws AnalysisException {
        ContractFacts base1 = contract("Base1", List.of(), List.of(function("f", 1, List.of(), List.of())), List.of());
        ContractFacts derived = contract("Derived", List.of("Base1"),
                List.of(function("f", 10, List.of(), List.of())), List.of());
        EffectiveContract effective = effective(context(base1, derived), "Derived");

        Member<FunctionFacts> f = effective.function("f()").orElseThrow();
        assertEquals("Derived", f.declaringContract().name());
        assertFalse(f.inherited());
        assertNull(f.inheritedFrom());
    }

    @Test
    void testDiamondKeepsSharedAncestorLast() throws AnalysisException {
        ContractFacts a = contract("A", List.of(), List.of(function("f", 1, List.of(), List.of())), List.of());
        ContractFacts b = contract("B", List.of("A"), List.of(), List.of());
        ContractFacts c = contract("C", List.of("A"), List.of(function("f", 20, List.of(), List.of())), List.of());
        ContractFacts d = contract("D", List.of("B", "C"), List.of(), List.of());
        EffectiveContract effective = effective(context(a, b, c, d), "D");

        assertEquals(List.of("D", "B", "C", "A"), names(effective));
        assertEquals("C", effective.function("f()").orElseThrow().declaringContract().name());
    }

    @Test
    void testFrontEndLinearizationIsAuthoritative() throws AnalysisException {
        ContractFacts base1 = contract("Base1", List.of(), List.of(function("f", 1, List.of(), List.of())), List.of());
        ContractFacts base2 = contract("Base2", List.of(), List.of(function("f", 5, List.of(), List.of())), List.of());
        ContractFacts derived = new ContractFacts(FILE, "Derived", ContractKind.CONTRACT, false,
                List.of("Base1", "Base2"), List.of("Base2", "Base1"), List.of(), List.of(), List.of(), null);
        EffectiveContract effective = effective(context(base1, base2, derived), "Derived");

        assertEquals(List.of("Derived", "Base2", "Base1"), names(effective));
        assertEquals("Base2", effective.function("f()").orElseThrow().declaringContract().name());
    }

    @Test
    void testImplementationBeatsAbstractDeclaration() throws AnalysisException {
        ContractFacts api = contract("Api", List.of(), List.of(unimplemented("f", 1)), List.of());
        ContractFacts impl = contract("Impl", List.of(), List.of(function("f", 5, List.of(), List.of())), List.of());
        ContractFacts derived = contract("Derived", List.of("Api", "Impl"), List.of(), List.of());
        EffectiveContract effective = effective(context(api, impl, derived), "Derived");

        Member<FunctionFacts> f = effective.function("f()").orElseThrow();
        assertEquals("Impl", f.declaringContract().name());
        assertTrue(f.declaration().implemented());
    }

    @Test
    void testConstructorsAreNotInherited() throws AnalysisException {
        ContractFacts base = contract("Base", List.of(), List.of(constructor(1, List.of(), List.of())), List.of());
        ContractFacts derived = contract("Derived", List.of("Base"), List.of(), List.of());
        EffectiveContract effective = effective(context(base, derived), "Derived");

        assertTrue(effective.function("constructor()").isEmpty());
    }

    @Test
    void testVariablesAndModifiersAreInherited() throws AnalysisException {
        ContractFacts base = contract(FILE, "Base", ContractKind.ABSTRACT, List.of(), List.of(),
                List.of(modifier("onlyOwner", 2, List.of(), List.of())), List.of(variable("owner", 1)));
        ContractFacts derived = contract("Derived", List.of("Base"), List.of(), List.of(variable("x", 10)));
        EffectiveContract effective = effective(context(base, derived), "Derived");

        assertEquals("Base", effective.variable("owner").orElseThrow().inheritedFrom());
        assertFalse(effective.variable("x").orElseThrow().inherited());
        assertTrue(effective.modifier("onlyOwner").orElseThrow().inherited());
    }

    @Test
    void testMissingBaseIsDroppedWithWarning() throws AnalysisException {
        ContractFacts derived = contract("Derived", List.of("Missing"),
                List.of(function("f", 1, List.of(), List.of())), List.of());
        AnalysisContext context = context(derived);
        EffectiveContract effective = effective(context, "Derived");

        assertEquals(List.of("Derived"), names(effective));
        assertEquals(1, effective.warnings().size());
        assertEquals(1, context.diagnostics().size());
        Diagnostic diagnostic = context.diagnostics().get(0);
        assertEquals(Diagnostic.Severity.WARNING, diagnostic.severity());
        assertEquals("Derived", diagnostic.contract());
        assertTrue(diagnostic.message().contains("Missing"));
    }

    @Test
    void testCycleRejectsMembersAndDescendants() throws AnalysisException {
        ContractFacts a = contract("A", List.of("B"), List.of(), List.of());
        ContractFacts b = contract("B", List.of("A"), List.of(), List.of());
        ContractFacts c = contract("C", List.of("A"), List.of(), List.of());
        ContractFacts free = contract("Free", List.of(), List.of(), List.of());
        InheritanceResolver.Resolution resolution = new InheritanceResolver(context(a, b, c, free)).resolve();

        assertTrue(resolution.hasErrors());
        assertEquals(3, resolution.errors().size());
        assertTrue(resolution.errors().get(a.id()).startsWith("Inheritance cycle"));
        assertTrue(resolution.errors().get(c.id()).contains("inheritance cycle"));
        assertEquals(List.of("Free"), resolution.contracts().stream().map(EffectiveContract::name).toList());
    }

    @Test
    void testSameFileBaseIsPreferred() throws AnalysisException {
        ContractFacts otherOwnable = contract("other/Ownable.sol", "Ownable", ContractKind.CONTRACT, List.of(),
                List.of(function("a", 1, List.of(), List.of())), List.of(), List.of());
        ContractFacts ownable = contract(FILE, "Ownable", ContractKind.CONTRACT, List.of(),
                List.of(function("b", 1, List.of(), List.of())), List.of(), List.of());
        ContractFacts derived = contract("Derived", List.of("Ownable"), List.of(), List.of());
        EffectiveContract effective = effective(context(otherOwnable, ownable, derived), "Derived");

        assertEquals(FILE, effective.precedence().get(1).file());
        assertTrue(effective.function("b()").isPresent());
        assertTrue(effective.function("a()").isEmpty());
    }
}
