package com.parametric.formula;

import com.parametric.formula.api.CycleResult;
import com.parametric.formula.api.FormulaMutationListener;
import com.parametric.formula.api.MutationResult;
import com.parametric.formula.core.FormulaDialect;
import com.parametric.formula.core.ReferenceResolver;
import com.parametric.formula.core.Tokenizer;
import com.parametric.formula.engine.CycleDetector;
import com.parametric.formula.engine.DependencyNavigator;
import com.parametric.formula.engine.FormulaMutationGuard;
import com.parametric.formula.io.JsonParameterParser;
import com.parametric.formula.io.ParameterSetCompiler;
import com.parametric.formula.io.ParameterSetDefinition;
import com.parametric.formula.node.ParameterNode;
import com.parametric.formula.node.ParameterStore;
import com.parametric.formula.util.CompositeMutationListener;
import com.parametric.formula.util.FormulaAnalysis;
import com.parametric.formula.util.FormulaExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A high-level wrapper wiring every component around one formula dialect.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the {@link Tokenizer}, {@link ReferenceResolver},
 * {@link DependencyNavigator}, {@link CycleDetector} and
 * {@link FormulaMutationGuard} from a single {@link FormulaDialect}</li>
 * <li>Loading JSON parameter set definitions into a {@link ParameterStore}</li>
 * <li>Providing name-based mutation methods against that store</li>
 * </ul>
 * Hosts with their own document model use the components directly and pass
 * their own parameter set and committer to {@link #guard()}.
 */
public final class FormulaGraph {
    private static final Logger log = LogManager.getLogger(FormulaGraph.class);

    private final FormulaDialect dialect;
    private final Tokenizer tokenizer;
    private final ReferenceResolver resolver;
    private final DependencyNavigator navigator;
    private final CycleDetector cycleDetector;
    private final FormulaMutationGuard guard;
    private final FormulaAnalysis analysis;
    private final FormulaExplain explain;
    private final CompositeMutationListener compositeListener = new CompositeMutationListener();
    private final ParameterStore store;

    private FormulaGraph(Builder b) {
        this.dialect = b.dialect;
        this.tokenizer = new Tokenizer(dialect);
        this.resolver = new ReferenceResolver(tokenizer);
        this.navigator = new DependencyNavigator(resolver);
        this.cycleDetector = new CycleDetector(resolver, b.visitedScope);
        this.guard = new FormulaMutationGuard(resolver, cycleDetector);
        this.analysis = new FormulaAnalysis(resolver);
        this.explain = new FormulaExplain(resolver);
        this.store = b.store != null ? b.store : new ParameterStore(resolver);

        if (b.listener != null)
            compositeListener.add(b.listener);
        guard.setListener(compositeListener);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads a parameter set definition from a JSON file.
     *
     * @param jsonPath Path to the JSON definition.
     */
    public static FormulaGraph fromJson(Path jsonPath) throws IOException {
        return fromDefinition(JsonParameterParser.parseFile(jsonPath));
    }

    /** Loads a parameter set definition from a classpath resource. */
    public static FormulaGraph fromResource(String resource) {
        return fromDefinition(JsonParameterParser.parseResource(resource));
    }

    public static FormulaGraph fromDefinition(ParameterSetDefinition def) {
        var compiled = new ParameterSetCompiler().compile(def);
        log.info("Loaded parameter set '{}' ({} parameters)", compiled.name(), compiled.store().size());
        return builder().dialect(compiled.dialect()).store(compiled.store()).build();
    }

    /**
     * Registers a listener for guarded mutations. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(FormulaMutationListener listener) {
        compositeListener.add(listener);
    }

    /** Sets a formula on the named parameter of the store through the guard. */
    public MutationResult setFormula(String name, String formula) {
        return guard.trySetFormula(store.require(name), formula, store, store);
    }

    /** Copies the source parameter's formula onto the target through the guard. */
    public MutationResult copyFormula(String target, String source) {
        return guard.trySetFormulaFromSource(store.require(target), store.require(source), store, store);
    }

    public MutationResult unsetFormula(String name) {
        return guard.unsetFormula(store.require(name), store);
    }

    /** Checks a proposed formula for cycles without committing anything. */
    public CycleResult checkCycle(String name, String formula) {
        return cycleDetector.detectCycle(store.require(name), formula, store);
    }

    public ParameterNode parameter(String name) {
        return store.require(name);
    }

    public FormulaDialect dialect() {
        return dialect;
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    public DependencyNavigator navigator() {
        return navigator;
    }

    public CycleDetector cycleDetector() {
        return cycleDetector;
    }

    public FormulaMutationGuard guard() {
        return guard;
    }

    public FormulaAnalysis analysis() {
        return analysis;
    }

    public FormulaExplain explain() {
        return explain;
    }

    public ParameterStore store() {
        return store;
    }

    /** Builder for {@link FormulaGraph}. */
    public static final class Builder {
        private FormulaDialect dialect = FormulaDialect.defaults();
        private CycleDetector.VisitedScope visitedScope = CycleDetector.VisitedScope.PER_ROOT;
        private FormulaMutationListener listener;
        private ParameterStore store;

        private Builder() {
        }

        public Builder dialect(FormulaDialect dialect) {
            if (dialect == null)
                throw new IllegalArgumentException("dialect must not be null");
            this.dialect = dialect;
            return this;
        }

        public Builder visitedScope(CycleDetector.VisitedScope visitedScope) {
            if (visitedScope == null)
                throw new IllegalArgumentException("visitedScope must not be null");
            this.visitedScope = visitedScope;
            return this;
        }

        public Builder listener(FormulaMutationListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * Uses an existing store. Without one, an empty store using the
         * builder's dialect is created.
         */
        public Builder store(ParameterStore store) {
            this.store = store;
            return this;
        }

        public FormulaGraph build() {
            return new FormulaGraph(this);
        }
    }
}
