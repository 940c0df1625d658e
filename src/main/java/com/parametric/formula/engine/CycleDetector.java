package com.parametric.formula.engine;

import com.parametric.formula.api.CycleResult;
import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterId;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks whether setting a formula on a target parameter would close a loop.
 *
 * <p>
 * The edge that would close the cycle (target -> r, for each parameter r the
 * proposed formula names) does not exist yet, so the search is rooted at each
 * directly referenced r and looks for a pre-existing path r -> ... -> target
 * through the <i>current</i> formulas. If one exists, adding target -> r
 * closes a loop.
 *
 * <p>
 * The depth-first search uses an explicit stack, so arbitrarily long reference
 * chains cannot overflow the thread stack. Path bookkeeping matches the
 * recursive formulation: a node is appended on entry, tested against the
 * target, skipped if already visited, expanded in set order, and removed
 * when its references are exhausted. Failed branches therefore never leave
 * nodes in the reported path.
 */
public final class CycleDetector {

    /** How the visited set is scoped across the roots of one call. */
    public enum VisitedScope {
        /** A fresh visited set for every directly referenced root. */
        PER_ROOT,
        /** One visited set shared by all roots of one call. */
        SHARED
    }

    private final ReferenceResolver resolver;
    private final VisitedScope visitedScope;

    public CycleDetector(ReferenceResolver resolver) {
        this(resolver, VisitedScope.PER_ROOT);
    }

    public CycleDetector(ReferenceResolver resolver, VisitedScope visitedScope) {
        this.resolver = resolver;
        this.visitedScope = visitedScope;
    }

    public VisitedScope visitedScope() {
        return visitedScope;
    }

    /**
     * Detects whether {@code proposedFormula} on {@code target} would create a
     * cycle.
     *
     * @param target          The parameter that would receive the formula.
     * @param proposedFormula The formula to check.
     * @param parameters      The current parameter set snapshot.
     * @return The cycle with its path, or {@link CycleResult#noCycle()}.
     */
    public CycleResult detectCycle(Parameter target, String proposedFormula, ParameterSet parameters) {
        // Clearing a formula can never create a cycle
        if (proposedFormula == null || proposedFormula.isBlank())
            return CycleResult.noCycle();

        List<Parameter> roots = resolver.getReferencedIn(parameters, proposedFormula);
        Set<ParameterId> visited = new HashSet<>();

        for (Parameter root : roots) {
            if (visitedScope == VisitedScope.PER_ROOT)
                visited = new HashSet<>();
            List<Parameter> path = findPath(root, target, parameters, visited);
            if (path != null)
                return CycleResult.cycle(root, path);
        }
        return CycleResult.noCycle();
    }

    /**
     * Iterative DFS from {@code start} to {@code target} over current formulas.
     *
     * @return The path start -> ... -> target, or null if target is
     *         unreachable.
     */
    private List<Parameter> findPath(Parameter start, Parameter target, ParameterSet parameters,
            Set<ParameterId> visited) {
        List<Parameter> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        if (enter(start, target, parameters, visited, path, stack))
            return path;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.hasNext()) {
                if (enter(frame.next(), target, parameters, visited, path, stack))
                    return path;
            } else {
                stack.pop();
                path.remove(path.size() - 1);
            }
        }
        return null;
    }

    /**
     * Enters a node: appends it to the path and either reports the target,
     * backs out of a visited or formula-less node, or pushes a frame over its
     * references.
     *
     * @return true if {@code node} is the target.
     */
    private boolean enter(Parameter node, Parameter target, ParameterSet parameters,
            Set<ParameterId> visited, List<Parameter> path, Deque<Frame> stack) {
        path.add(node);

        if (node.id().equals(target.id()))
            return true;

        if (!visited.add(node.id())) {
            path.remove(path.size() - 1);
            return false;
        }

        String formula = node.formula();
        if (formula == null || formula.isBlank()) {
            path.remove(path.size() - 1);
            return false;
        }

        stack.push(new Frame(resolver.getReferencedIn(parameters, formula)));
        return false;
    }

    /** Cursor over one node's references. */
    private static final class Frame {
        private final List<Parameter> references;
        private int next;

        Frame(List<Parameter> references) {
            this.references = references;
        }

        boolean hasNext() {
            return next < references.size();
        }

        Parameter next() {
            return references.get(next++);
        }
    }
}
