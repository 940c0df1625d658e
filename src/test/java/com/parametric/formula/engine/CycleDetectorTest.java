package com.parametric.formula.engine;

import com.parametric.formula.api.CycleResult;
import com.parametric.formula.core.FormulaDialect;
import com.parametric.formula.core.ReferenceResolver;
import com.parametric.formula.node.ParameterNode;
import com.parametric.formula.node.ParameterStore;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CycleDetectorTest {

    private ReferenceResolver resolver;
    private ParameterStore store;
    private CycleDetector detector;

    @Before
    public void setUp() {
        resolver = new ReferenceResolver(FormulaDialect.defaults());
        store = new ParameterStore(resolver);
        detector = new CycleDetector(resolver);
    }

    private void add(long id, String name, String formula) {
        store.add(ParameterNode.type(id, name, "number"));
        if (formula != null)
            store.assignUnchecked(name, formula);
    }

    @Test
    public void testDefaultScopeIsPerRoot() {
        assertEquals(CycleDetector.VisitedScope.PER_ROOT, detector.visitedScope());
    }

    @Test
    public void testPathRunsFromDirectReferenceToTarget() {
        // B -> C -> A already exists
        add(1, "A", null);
        add(2, "B", "C");
        add(3, "C", "A");

        CycleResult result = detector.detectCycle(store.require("A"), "B", store);
        assertTrue(result.wouldCycle());
        assertEquals("B", result.directReference().name());
        assertEquals(List.of("B", "C", "A"), result.pathNames());
        assertEquals("B -> C -> A", result.formatPath());
    }

    @Test
    public void testBlankFormulaNeverCycles() {
        add(1, "A", null);
        add(2, "B", "A");
        assertFalse(detector.detectCycle(store.require("A"), "", store).wouldCycle());
        assertFalse(detector.detectCycle(store.require("A"), null, store).wouldCycle());
        assertSame(CycleResult.noCycle(), detector.detectCycle(store.require("A"), " ", store));
    }

    @Test
    public void testSelfReference() {
        add(1, "A", null);
        CycleResult result = detector.detectCycle(store.require("A"), "A + 1", store);
        assertTrue(result.wouldCycle());
        assertEquals(List.of("A"), result.pathNames());
    }

    @Test
    public void testNoCycle() {
        add(1, "A", null);
        add(2, "B", "C");
        add(3, "C", null);
        CycleResult result = detector.detectCycle(store.require("A"), "B * 2", store);
        assertFalse(result.wouldCycle());
        assertNull(result.directReference());
        assertTrue(result.path().isEmpty());
        assertEquals("", result.formatPath());
    }

    @Test
    public void testMaskedNameScenario() {
        store.add(ParameterNode.type(1, "Width", "length"));
        store.add(ParameterNode.type(2, "Width Offset", "length"));
        store.assignUnchecked("Width Offset", "Width * 2");

        CycleResult result = detector.detectCycle(store.require("Width"), "Width Offset", store);
        assertTrue(result.wouldCycle());
        assertEquals(List.of("Width Offset", "Width"), result.pathNames());
    }

    @Test
    public void testFailedBranchesLeaveNoTrace() {
        // B explores the dead end D (earlier in set order) before reaching A via C
        add(1, "A", null);
        add(2, "D", "E");
        add(3, "E", null);
        add(4, "B", "C + D");
        add(5, "C", "A");

        CycleResult result = detector.detectCycle(store.require("A"), "B", store);
        assertEquals(List.of("B", "C", "A"), result.pathNames());
    }

    @Test
    public void testFirstReferencedRootInSetOrderWins() {
        add(1, "A", null);
        add(2, "X", "A");
        add(3, "Y", "A");
        CycleResult result = detector.detectCycle(store.require("A"), "Y + X", store);
        assertEquals("X", result.directReference().name());
    }

    @Test
    public void testVisitedScopesAgreeOnIndependentPaths() {
        // T's proposed formula reaches a shared node M from two roots; only the
        // second root leads back to T
        add(1, "T", null);
        add(2, "X", "M");
        add(3, "M", "N");
        add(4, "N", null);
        add(5, "Y", "M + Q");
        add(6, "Q", "T");
        add(7, "Z", "M + N");

        CycleDetector shared = new CycleDetector(resolver, CycleDetector.VisitedScope.SHARED);
        for (String formula : List.of("X + Y", "Y + X", "X", "Z + Y", "X + Z", "M + Q")) {
            CycleResult perRoot = detector.detectCycle(store.require("T"), formula, store);
            CycleResult sharedResult = shared.detectCycle(store.require("T"), formula, store);
            assertEquals(formula, perRoot.wouldCycle(), sharedResult.wouldCycle());
            assertEquals(formula, perRoot.pathNames(), sharedResult.pathNames());
        }

        CycleResult result = shared.detectCycle(store.require("T"), "X + Y", store);
        assertTrue(result.wouldCycle());
        assertEquals(List.of("Y", "Q", "T"), result.pathNames());
    }

    @Test
    public void testLongChainDoesNotOverflowStack() {
        int n = 3000;
        for (int i = 0; i < n; i++)
            add(i + 1, "P" + i, i < n - 1 ? "P" + (i + 1) : null);

        CycleResult result = detector.detectCycle(store.require("P" + (n - 1)), "P0", store);
        assertTrue(result.wouldCycle());
        assertEquals(n, result.path().size());
        assertEquals("P0", result.path().get(0).name());
        assertEquals("P" + (n - 1), result.path().get(n - 1).name());
    }
}
