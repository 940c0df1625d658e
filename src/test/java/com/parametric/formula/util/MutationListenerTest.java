package com.parametric.formula.util;

import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.FormulaMutationListener;
import com.parametric.formula.api.Parameter;
import com.parametric.formula.node.ParameterNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class MutationListenerTest {

    private final ParameterNode width = ParameterNode.type(1, "Width", "length");

    @Test
    public void testCompositeFansOut() {
        List<String> first = new ArrayList<>(), second = new ArrayList<>();
        CompositeMutationListener composite = new CompositeMutationListener()
                .add(recorder(first))
                .add(recorder(second));
        assertEquals(2, composite.size());

        composite.onCommitted(width, "2");
        composite.onRejected(width, "X", new FormulaError.UnknownReference("Width", List.of("X"), List.of()));

        assertEquals(List.of("commit:2", "reject:UNKNOWN_REFERENCE"), first);
        assertEquals(first, second);
    }

    @Test
    public void testNoneIgnoresEvents() {
        FormulaMutationListener.NONE.onCommitted(width, "1");
        FormulaMutationListener.NONE.onRejected(width, "1", new FormulaError.MissingSourceFormula("Width", "S"));
    }

    @Test
    public void testLoggingListenerCounts() {
        LoggingMutationListener listener = new LoggingMutationListener();
        listener.onCommitted(width, "2");
        listener.onCommitted(width, null);
        listener.onRejected(width, "Width", new FormulaError.IllegalInstanceReference("Width", List.of("H")));
        listener.onRejected(width, "Width", new FormulaError.IllegalInstanceReference("Width", List.of("H")));

        assertEquals(1, listener.commits());
        assertEquals(1, listener.clears());
        assertEquals(2, listener.rejections());
        assertEquals(2, listener.rejections(FormulaError.Kind.ILLEGAL_INSTANCE_REFERENCE));
        assertEquals(0, listener.rejections(FormulaError.Kind.TYPE_MISMATCH));

        listener.reset();
        assertEquals(0, listener.rejections());
    }

    private static FormulaMutationListener recorder(List<String> events) {
        return new FormulaMutationListener() {
            @Override
            public void onCommitted(Parameter target, String formula) {
                events.add("commit:" + formula);
            }

            @Override
            public void onRejected(Parameter target, String formula, FormulaError error) {
                events.add("reject:" + error.kind());
            }
        };
    }
}
