package com.parametric.formula.util;

import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.FormulaMutationListener;
import com.parametric.formula.api.Parameter;

import java.util.Arrays;

/**
 * Aggregates multiple {@link FormulaMutationListener} instances.
 */
public class CompositeMutationListener implements FormulaMutationListener {
    private FormulaMutationListener[] listeners = new FormulaMutationListener[0];

    public CompositeMutationListener add(FormulaMutationListener listener) {
        FormulaMutationListener[] old = listeners;
        FormulaMutationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onCommitted(Parameter target, String formula) {
        for (FormulaMutationListener l : listeners)
            l.onCommitted(target, formula);
    }

    @Override
    public void onRejected(Parameter target, String formula, FormulaError error) {
        for (FormulaMutationListener l : listeners)
            l.onRejected(target, formula, error);
    }
}
