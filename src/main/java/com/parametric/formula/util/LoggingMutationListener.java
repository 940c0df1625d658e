package com.parametric.formula.util;

import com.parametric.formula.api.FormulaError;
import com.parametric.formula.api.FormulaMutationListener;
import com.parametric.formula.api.Parameter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Logs every guarded mutation and keeps running counts.
 *
 * <p>
 * Commits are logged at info, rejections at warn with the full diagnostic
 * message. Counts are kept per {@link FormulaError.Kind} so tooling can report
 * what users most often get wrong.
 */
public final class LoggingMutationListener implements FormulaMutationListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(LoggingMutationListener.class);

    private final Map<FormulaError.Kind, Long> rejectionsByKind = new EnumMap<>(FormulaError.Kind.class);
    private long commits, clears;

    @Override
    public void onCommitted(Parameter target, String formula) {
        if (formula == null) {
            clears++;
            log.info("Cleared formula on '{}'", target.name());
        } else {
            commits++;
            log.info("Set formula on '{}': {}", target.name(), formula);
        }
    }

    @Override
    public void onRejected(Parameter target, String formula, FormulaError error) {
        rejectionsByKind.merge(error.kind(), 1L, Long::sum);
        log.warn("[{}] {}", error.kind(), error.message());
    }

    public long commits() {
        return commits;
    }

    public long clears() {
        return clears;
    }

    public long rejections() {
        long total = 0;
        for (long n : rejectionsByKind.values())
            total += n;
        return total;
    }

    public long rejections(FormulaError.Kind kind) {
        return rejectionsByKind.getOrDefault(kind, 0L);
    }

    public void reset() {
        commits = 0;
        clears = 0;
        rejectionsByKind.clear();
    }
}
