package com.smartroute.core.classifier;

import java.util.List;
import java.util.Locale;

/**
 * Default {@link SensitivityScorer}: counts how many sensitive words occur in
 * the content and scales by content length.
 */
public class KeywordDensityScorer implements SensitivityScorer {

    static final List<String> SENSITIVE_WORDS =
            List.of("secret", "private", "confidential", "password", "key", "token");

    @Override
    public double score(String content) {
        if (content == null || content.isEmpty()) {
            return 0.0;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        long present = SENSITIVE_WORDS.stream().filter(lower::contains).count();
        double density = present / Math.max(content.length() / 100.0, 1.0);
        return Math.min(density * 5.0, 10.0);
    }
}
