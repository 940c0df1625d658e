package com.parametric.formula;

import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.MutationResult;
import com.parametric.formula.core.FormulaDialect;
import com.parametric.formula.engine.CycleDetector;
import com.parametric.formula.node.ParameterNode;
import com.parametric.formula.util.LoggingMutationListener;
import org.junit.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class FormulaGraphTest {

    @Test
    public void testDefaults() {
        FormulaGraph graph = FormulaGraph.builder().build();
        assertSame(FormulaDialect.defaults(), graph.dialect());
        assertSame(graph.dialect(), graph.tokenizer().dialect());
        assertSame(graph.tokenizer(), graph.resolver().tokenizer());
        assertEquals(CycleDetector.VisitedScope.PER_ROOT, graph.cycleDetector().visitedScope());
        assertEquals(0, graph.store().size());
    }

    @Test
    public void testBuilderOptions() {
        FormulaDialect dialect = FormulaDialect.builder().reservedFunction("clamp").build();
        FormulaGraph graph = FormulaGraph.builder()
                .dialect(dialect)
                .visitedScope(CycleDetector.VisitedScope.SHARED)
                .build();
        assertSame(dialect, graph.dialect());
        assertEquals(CycleDetector.VisitedScope.SHARED, graph.cycleDetector().visitedScope());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullDialectRejected() {
        FormulaGraph.builder().dialect(null);
    }

    @Test
    public void testDoorWorkflow() {
        LoggingMutationListener listener = new LoggingMutationListener();
        FormulaGraph graph = FormulaGraph.fromResource("fixtures/door.json");
        graph.addListener(listener);

        // Type formula reading an instance parameter
        MutationResult result = graph.setFormula("Width", "Height");
        assertEquals(FormulaError.Kind.ILLEGAL_INSTANCE_REFERENCE, result.error().kind());

        // Width Offset already reads Width
        result = graph.setFormula("Width", "Width Offset");
        assertEquals(List.of("Width Offset", "Width"),
                result.errorAs(FormulaError.WouldCreateCycle.class).cycle().pathNames());

        // Dialect from the fixture is honored
        assertTrue(graph.setFormula("Height", "clamp(Nominal, 30, 40)").isSuccess());
        assertEquals("clamp(Nominal, 30, 40)", graph.parameter("Height").formula());

        // Forbidden data type is refused by the store
        result = graph.setFormula("Manual", "\"see drawing\"");
        assertEquals(FormulaError.Kind.COMMIT_REJECTED, result.error().kind());

        assertTrue(graph.unsetFormula("Height").isSuccess());
        assertNull(graph.parameter("Height").formula());

        assertEquals(1, listener.commits());
        assertEquals(1, listener.clears());
        assertEquals(3, listener.rejections());
        assertEquals(1, listener.rejections(FormulaError.Kind.WOULD_CREATE_CYCLE));
    }

    @Test
    public void testCopyFormula() {
        FormulaGraph graph = FormulaGraph.fromResource("fixtures/door.json");
        assertTrue(graph.copyFormula("Height", "Width Offset").isSuccess());
        assertEquals("Width * 2", graph.parameter("Height").formula());
        assertEquals(FormulaError.Kind.TYPE_MISMATCH, graph.copyFormula("Area", "Width Offset").error().kind());
    }

    @Test
    public void testCheckCycleDoesNotCommit() {
        FormulaGraph graph = FormulaGraph.fromResource("fixtures/door.json");
        assertTrue(graph.checkCycle("Width", "Trim Width").wouldCycle());
        assertFalse(graph.checkCycle("Width", "Nominal").wouldCycle());
        assertNull(graph.parameter("Width").formula());
    }

    @Test
    public void testProgrammaticStore() {
        FormulaGraph graph = FormulaGraph.builder().build();
        graph.store().add(ParameterNode.type(1, "A", "number")).add(ParameterNode.type(2, "B", "number"));
        assertTrue(graph.setFormula("B", "A * 2").isSuccess());
        assertEquals(List.of("B"), graph.navigator().getDependents(graph.parameter("A"), graph.store())
                .stream().map(p -> p.name()).toList());
        assertTrue(graph.analysis().isConstant(graph.store(), "42"));
    }

    @Test
    public void testFromJsonFile() throws IOException, URISyntaxException {
        Path path = Path.of(getClass().getClassLoader().getResource("fixtures/door.json").toURI());
        FormulaGraph graph = FormulaGraph.fromJson(path);
        assertEquals(9, graph.store().size());
        assertTrue(graph.explain().dumpReferences(graph.store()).startsWith("Parameters (9):"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParameterName() {
        FormulaGraph.builder().build().setFormula("Missing", "1");
    }
}
