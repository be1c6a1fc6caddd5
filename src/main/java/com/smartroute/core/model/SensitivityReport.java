package com.smartroute.core.model;

import java.util.List;

/**
 * Result of classifying content for privacy risk.
 *
 * @param level           derived sensitivity level
 * @param compositeScore  blended score the thresholds were applied to
 * @param ruleScore       sum of match count times category severity
 * @param heuristicScore  score from the pluggable secondary scorer (0-10)
 * @param matches         every pattern that matched at least once
 * @param recommendations human-readable handling advice
 * @param failedClosed    true when an internal error forced the level to HIGH
 */
public record SensitivityReport(
    SensitivityLevel level,
    double compositeScore,
    double ruleScore,
    double heuristicScore,
    List<PatternMatch> matches,
    List<String> recommendations,
    boolean failedClosed
) {

    public SensitivityReport {
        matches = matches == null ? List.of() : List.copyOf(matches);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public boolean hasCategory(String category) {
        return matches.stream().anyMatch(m -> m.category().equals(category));
    }

    public static SensitivityReport failClosed(String reason) {
        return new SensitivityReport(SensitivityLevel.HIGH, 0.0, 0.0, 0.0, List.of(),
                List.of("Classification failed (" + reason + "); content treated as highly sensitive"), true);
    }
}
