package com.smartroute.core.model;

/**
 * Estimated local capability for a task.
 *
 * @param taskType           the task type that was assessed
 * @param complexity         resolved complexity class
 * @param tier               tier derived from {@code score}
 * @param score              local capability in [0,1]
 * @param estimatedLatencyMs rough local processing time
 * @param knownTaskType      false when defaults were used for an unknown task type
 */
public record CapabilityAssessment(
    String taskType,
    ComplexityClass complexity,
    CapabilityTier tier,
    double score,
    long estimatedLatencyMs,
    boolean knownTaskType
) {}
