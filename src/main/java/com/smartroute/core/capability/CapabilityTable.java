package com.smartroute.core.capability;

import com.smartroute.core.model.ComplexityClass;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable mapping from task type to the complexity class and base local
 * capability score of that task. Task types are matched case-insensitively,
 * and a few interaction-style names are accepted as aliases.
 */
public final class CapabilityTable {

    public record Entry(ComplexityClass complexity, double baseScore) {
        public Entry {
            if (baseScore < 0 || baseScore > 1) {
                throw new IllegalArgumentException("baseScore must be in [0,1]: " + baseScore);
            }
        }
    }

    private static final Map<String, String> ALIASES = Map.of(
            "code_generation", "function_generation",
            "testing", "test_generation",
            "debugging", "bug_detection",
            "optimization", "optimization_suggestions",
            "technical_analysis", "code_explanation",
            "documentation", "comment_generation"
    );

    private final Map<String, Entry> entries;

    private CapabilityTable(Map<String, Entry> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static CapabilityTable defaults() {
        return builder()
                .put("syntax_checking", ComplexityClass.SIMPLE, 0.95)
                .put("code_formatting", ComplexityClass.SIMPLE, 0.90)
                .put("variable_renaming", ComplexityClass.SIMPLE, 0.88)
                .put("variable_naming", ComplexityClass.SIMPLE, 0.88)
                .put("comment_generation", ComplexityClass.SIMPLE, 0.85)
                .put("simple_refactoring", ComplexityClass.SIMPLE, 0.82)
                .put("code_completion", ComplexityClass.SIMPLE, 0.80)
                .put("bug_detection", ComplexityClass.MEDIUM, 0.78)
                .put("function_generation", ComplexityClass.MEDIUM, 0.70)
                .put("test_generation", ComplexityClass.MEDIUM, 0.68)
                .put("code_explanation", ComplexityClass.MEDIUM, 0.65)
                .put("optimization_suggestions", ComplexityClass.MEDIUM, 0.60)
                .put("performance_analysis", ComplexityClass.COMPLEX, 0.40)
                .put("complex_generation", ComplexityClass.COMPLEX, 0.40)
                .put("architecture_design", ComplexityClass.COMPLEX, 0.35)
                .put("complex_algorithm", ComplexityClass.COMPLEX, 0.30)
                .put("security_audit", ComplexityClass.COMPLEX, 0.25)
                .put("system_design", ComplexityClass.ULTRA_COMPLEX, 0.20)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of this table with the given entries added or replaced.
     */
    public CapabilityTable withEntries(Map<String, Entry> extra) {
        var merged = new LinkedHashMap<>(entries);
        extra.forEach((k, v) -> merged.put(normalize(k), v));
        return new CapabilityTable(merged);
    }

    /**
     * @throws EstimationException when the task type has no entry
     */
    public Entry require(String taskType) {
        String key = normalize(taskType);
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = entries.get(ALIASES.getOrDefault(key, key));
        }
        if (entry == null) {
            throw new EstimationException("No capability data for task type '" + taskType + "'");
        }
        return entry;
    }

    public boolean contains(String taskType) {
        String key = normalize(taskType);
        return entries.containsKey(key) || entries.containsKey(ALIASES.getOrDefault(key, key));
    }

    public int size() {
        return entries.size();
    }

    private static String normalize(String taskType) {
        return taskType == null ? "" : taskType.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        public Builder put(String taskType, ComplexityClass complexity, double baseScore) {
            entries.put(normalize(taskType), new Entry(complexity, baseScore));
            return this;
        }

        public CapabilityTable build() {
            return new CapabilityTable(entries);
        }
    }
}
