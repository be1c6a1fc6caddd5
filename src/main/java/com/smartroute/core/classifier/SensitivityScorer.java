package com.smartroute.core.classifier;

/**
 * Secondary sensitivity signal blended with the rule score. Implementations
 * must be deterministic and return a value in [0, 10].
 */
@FunctionalInterface
public interface SensitivityScorer {

    double score(String content);
}
