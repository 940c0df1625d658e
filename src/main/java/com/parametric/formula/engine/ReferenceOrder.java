package com.parametric.formula.engine;

import com.parametric.formula.api.Parameter;
import com.parametric.formula.api.ParameterSet;
import com.parametric.formula.core.ReferenceResolver;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluation order of a parameter set: every parameter after all parameters
 * its formula references.
 *
 * This is the static, whole-set view of the reference relation. It is what a
 * host evaluator needs (dependencies before dependents) and what the in-memory
 * store uses to refuse a commit that would leave a cycle behind.
 *
 * Data layout (compressed sparse row):
 * - order: parameters sorted topologically. Iterating 0..N visits
 * dependencies before dependents.
 * - dependentList: one flattened int array holding the order indices of the
 * dependents of every parameter.
 * - dependentOffset: dependentOffset[i] is the start of parameter i's
 * dependents in dependentList; dependentOffset[i+1] is the end.
 */
@Log4j2
public final class ReferenceOrder {
    private final Parameter[] order;
    private final int[] dependentOffset;
    private final int[] dependentList;
    private final int[] dependencyCount;
    private final Map<String, Integer> nameToIndex;

    private ReferenceOrder(Parameter[] order, int[] dependentOffset, int[] dependentList,
            int[] dependencyCount, Map<String, Integer> nameToIndex) {
        this.order = order;
        this.dependentOffset = dependentOffset;
        this.dependentList = dependentList;
        this.dependencyCount = dependencyCount;
        this.nameToIndex = nameToIndex;
    }

    /**
     * Builds the order of a parameter set from its current formulas.
     *
     * @throws IllegalStateException if the formulas contain a cycle.
     */
    public static ReferenceOrder of(ParameterSet parameters, ReferenceResolver resolver) {
        return of(parameters, resolver, null, null);
    }

    /**
     * Builds the order as it would be if {@code override} had
     * {@code overrideFormula} instead of its current formula.
     *
     * @throws IllegalStateException if the resulting formulas contain a cycle.
     */
    public static ReferenceOrder of(ParameterSet parameters, ReferenceResolver resolver,
            Parameter override, String overrideFormula) {
        Builder builder = builder();
        for (Parameter p : parameters)
            builder.addParameter(p);
        for (Parameter p : parameters) {
            String formula = override != null && override.id().equals(p.id()) ? overrideFormula : p.formula();
            for (Parameter dep : resolver.getReferencedIn(parameters, formula))
                builder.addReference(p.name(), dep.name());
        }
        return builder.build();
    }

    public int parameterCount() {
        return order.length;
    }

    /** Returns the parameter at the given order index. */
    public Parameter parameter(int index) {
        return order[index];
    }

    /** Resolves a parameter name to its order index. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return idx;
    }

    /** True if the parameter's formula references nothing (or it has none). */
    public boolean isSource(int index) {
        return dependencyCount[index] == 0;
    }

    public int dependentCount(int index) {
        return dependentOffset[index + 1] - dependentOffset[index];
    }

    public int dependent(int index, int i) {
        return dependentList[dependentOffset[index] + i];
    }

    public int dependencyCount(int index) {
        return dependencyCount[index];
    }

    /** Parameters in evaluation order. */
    public List<Parameter> parameters() {
        return List.of(order);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for the reference order.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Parameter> parameters = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        // dependency index -> dependent indices
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addParameter(Parameter parameter) {
            if (nameToIdx.containsKey(parameter.name()))
                throw new IllegalArgumentException("Duplicate parameter name: " + parameter.name());
            int idx = parameters.size();
            parameters.add(parameter);
            nameToIdx.put(parameter.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /**
         * Records that {@code owner}'s formula references {@code dependency}.
         * A self-reference is kept and reported as a cycle by {@link #build()}.
         */
        public Builder addReference(String owner, String dependency) {
            List<Integer> dependents = forwardEdges.get(requireIndex(dependency));
            int ownerIdx = requireIndex(owner);
            if (!dependents.contains(ownerIdx))
                dependents.add(ownerIdx);
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown parameter: " + name);
            return idx;
        }

        /**
         * Compiles the order.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         */
        public ReferenceOrder build() {
            int n = parameters.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees (number of dependencies)
            for (var entry : forwardEdges.entrySet())
                for (int dependent : entry.getValue())
                    inDegree[dependent]++;
            int[] dependencyCounts = inDegree.clone();

            // 2. Initialize queue with parameters that reference nothing
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] orderMap = new int[n], reverseMap = new int[n];
            int orderIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                orderMap[curr] = orderIdx;
                reverseMap[orderIdx] = curr;
                orderIdx++;
                for (int dependent : forwardEdges.get(curr))
                    if (--inDegree[dependent] == 0)
                        queue[tail++] = dependent;
            }
            if (orderIdx != n) {
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        unresolved.add(parameters.get(i).name());
                log.debug("Reference cycle among {}", unresolved);
                throw new IllegalStateException("Cycle detected! Processed " + orderIdx + " of " + n
                        + ". Unresolved parameters: " + String.join(", ", unresolved));
            }

            // 4. Construct compact arrays
            Parameter[] ordered = new Parameter[n];
            int[] counts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int oi = 0; oi < n; oi++) {
                int origIdx = reverseMap[oi];
                ordered[oi] = parameters.get(origIdx);
                counts[oi] = dependencyCounts[origIdx];
                newNameToIndex.put(ordered[oi].name(), oi);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int oi = 0; oi < n; oi++)
                offsets[oi + 1] = offsets[oi] + forwardEdges.get(reverseMap[oi]).size();

            int[] flatDependents = new int[offsets[n]];
            for (int oi = 0; oi < n; oi++) {
                List<Integer> dependents = forwardEdges.get(reverseMap[oi]);
                int base = offsets[oi];
                for (int j = 0; j < dependents.size(); j++)
                    flatDependents[base + j] = orderMap[dependents.get(j)];
            }
            return new ReferenceOrder(ordered, offsets, flatDependents, counts, newNameToIndex);
        }
    }
}
