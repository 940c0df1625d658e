package com.parametric.formula.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of checking whether a proposed formula would close a reference loop.
 *
 * Example: if B's formula is "C" and C's formula is "A", then proposing "B" as
 * A's formula gives {@code directReference = B} and {@code path = [B, C, A]}:
 * the direct reference first, the target last.
 *
 * @param wouldCycle      true if committing the formula would create a cycle.
 * @param directReference The parameter named by the proposed formula that leads
 *                        back to the target, or null if there is no cycle.
 * @param path            The pre-existing chain from directReference to the
 *                        target (both inclusive); empty if there is no cycle.
 */
public record CycleResult(boolean wouldCycle, Parameter directReference, List<Parameter> path) {

    private static final CycleResult NO_CYCLE = new CycleResult(false, null, List.of());

    public CycleResult {
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static CycleResult noCycle() {
        return NO_CYCLE;
    }

    public static CycleResult cycle(Parameter directReference, List<Parameter> path) {
        return new CycleResult(true, directReference, path);
    }

    /** Names along the cycle path, in path order. */
    public List<String> pathNames() {
        return path.stream().map(Parameter::name).toList();
    }

    /**
     * Formats the cycle for error messages, e.g. "B -> C -> A".
     *
     * @return The formatted path, or an empty string if there is no cycle.
     */
    public String formatPath() {
        if (!wouldCycle || path.isEmpty())
            return "";
        return path.stream().map(Parameter::name).collect(Collectors.joining(" -> "));
    }
}
