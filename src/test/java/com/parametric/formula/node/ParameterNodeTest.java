package com.parametric.formula.node;

import com.parametric.formula.api.ParameterId;
import org.junit.Test;

import static org.junit.Assert.*;

public class ParameterNodeTest {

    @Test
    public void testFactories() {
        ParameterNode type = ParameterNode.type(1, "Width", "length");
        assertFalse(type.isInstance());
        assertFalse(type.isBuiltIn());
        assertEquals("Type", type.designation());
        assertEquals(ParameterId.of(1), type.id());

        ParameterNode instance = ParameterNode.instance(2, "Height", "length");
        assertTrue(instance.isInstance());
        assertEquals("Instance", instance.designation());
        assertNull(instance.formula());
    }

    @Test
    public void testNullDataTypeBecomesEmpty() {
        assertEquals("", new ParameterNode(ParameterId.of(1), "A", false, null, false).dataType());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyNameRejected() {
        ParameterNode.type(1, "", "number");
    }

    @Test
    public void testToString() {
        ParameterNode node = ParameterNode.type(7, "Width", "length");
        node.assignFormula("Height * 2");
        assertEquals("Type 'Width' #7 = Height * 2", node.toString());
    }
}
