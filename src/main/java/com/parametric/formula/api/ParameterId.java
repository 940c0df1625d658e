package com.parametric.formula.api;

/**
 * Opaque, stable identity of a parameter inside its host document.
 *
 * Two parameters are the same parameter if and only if their ids are equal,
 * regardless of their current names. Names can change (renames happen in the
 * host); ids cannot.
 *
 * Negative values are conventionally used by hosts for built-in parameters.
 */
public record ParameterId(long value) implements Comparable<ParameterId> {

    public static ParameterId of(long value) {
        return new ParameterId(value);
    }

    @Override
    public int compareTo(ParameterId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
