package com.smartroute.core.capability;

import com.smartroute.core.model.CapabilityAssessment;
import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates how well the local venue handles a task.
 * <p>
 * The base score comes from the {@link CapabilityTable}; unknown task types
 * fall back to a score of 0.5. The complexity class is the more demanding of
 * the table's class and the class inferred from the content (for unknown task
 * types only the inferred class, or MEDIUM when there is no content). The
 * class multiplier then adjusts the base score, clamped to [0,1].
 */
public class CapabilityEstimator {

    private static final Logger log = LoggerFactory.getLogger(CapabilityEstimator.class);

    static final double DEFAULT_SCORE = 0.5;
    static final ComplexityClass DEFAULT_COMPLEXITY = ComplexityClass.MEDIUM;

    private final CapabilityTable table;
    private final ComplexityAnalyzer analyzer;

    public CapabilityEstimator() {
        this(CapabilityTable.defaults(), new ComplexityAnalyzer());
    }

    public CapabilityEstimator(CapabilityTable table, ComplexityAnalyzer analyzer) {
        this.table = table;
        this.analyzer = analyzer;
    }

    public CapabilityAssessment estimate(String taskType, String content) {
        boolean blank = content == null || content.isBlank();
        ComplexityClass inferred = blank ? null : inferSafely(content);

        ComplexityClass complexity;
        double base;
        boolean known;
        try {
            CapabilityTable.Entry entry = table.require(taskType);
            base = entry.baseScore();
            complexity = inferred == null ? entry.complexity() : ComplexityClass.max(entry.complexity(), inferred);
            known = true;
        } catch (EstimationException e) {
            log.debug("{}; using defaults", e.getMessage());
            base = DEFAULT_SCORE;
            complexity = inferred == null ? DEFAULT_COMPLEXITY : inferred;
            known = false;
        }

        double score = Math.max(0.0, Math.min(1.0, base * multiplier(complexity)));
        long latencyMs = Math.round(baseLatencyMs(complexity) * (2.0 - score));
        return new CapabilityAssessment(taskType, complexity, CapabilityTier.fromScore(score),
                score, latencyMs, known);
    }

    private ComplexityClass inferSafely(String content) {
        try {
            return analyzer.analyze(content);
        } catch (RuntimeException e) {
            log.warn("Complexity analysis failed, assuming {}: {}", DEFAULT_COMPLEXITY, e.getMessage());
            return DEFAULT_COMPLEXITY;
        }
    }

    static double multiplier(ComplexityClass complexity) {
        return switch (complexity) {
            case SIMPLE -> 1.2;
            case MEDIUM -> 1.0;
            case COMPLEX -> 0.7;
            case ULTRA_COMPLEX -> 0.4;
        };
    }

    static long baseLatencyMs(ComplexityClass complexity) {
        return switch (complexity) {
            case SIMPLE -> 2_000;
            case MEDIUM -> 5_000;
            case COMPLEX -> 15_000;
            case ULTRA_COMPLEX -> 30_000;
        };
    }
}
