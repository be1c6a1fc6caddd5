package com.smartroute.core.classifier;

import com.smartroute.core.model.PatternMatch;
import com.smartroute.core.model.SensitivityLevel;
import com.smartroute.core.model.SensitivityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Scores content for privacy risk.
 * <p>
 * The rule score is {@code sum(matchCount * severity)} over every category
 * pattern. It is blended with the pluggable {@link SensitivityScorer} using
 * configurable weights (0.7 / 0.3 by default). A blended score of 8 or more,
 * or any critical secret, is HIGH; 3 or more is MEDIUM; anything else is LOW.
 * <p>
 * Classification is a pure function of the content. Any internal failure
 * yields a HIGH report rather than an exception.
 */
public class SensitivityClassifier {

    private static final Logger log = LoggerFactory.getLogger(SensitivityClassifier.class);

    static final double HIGH_THRESHOLD = 8.0;
    static final double MEDIUM_THRESHOLD = 3.0;

    private final List<SensitivityRules.Category> categories;
    private final SensitivityScorer scorer;
    private final double ruleWeight;
    private final double heuristicWeight;

    public SensitivityClassifier() {
        this(SensitivityRules.defaults(), new KeywordDensityScorer(), 0.7, 0.3);
    }

    public SensitivityClassifier(SensitivityScorer scorer, double ruleWeight, double heuristicWeight) {
        this(SensitivityRules.defaults(), scorer, ruleWeight, heuristicWeight);
    }

    public SensitivityClassifier(List<SensitivityRules.Category> categories, SensitivityScorer scorer,
                                 double ruleWeight, double heuristicWeight) {
        if (ruleWeight < 0 || heuristicWeight < 0) {
            throw new IllegalArgumentException("Classifier weights must be non-negative");
        }
        this.categories = List.copyOf(categories);
        this.scorer = scorer;
        this.ruleWeight = ruleWeight;
        this.heuristicWeight = heuristicWeight;
    }

    public SensitivityReport classify(String content) {
        try {
            return doClassify(content == null ? "" : content);
        } catch (ClassificationException e) {
            log.warn("Sensitivity classification failed, treating content as HIGH: {}", e.getMessage());
            return SensitivityReport.failClosed(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Sensitivity classification failed, treating content as HIGH: {}", e.getMessage(), e);
            return SensitivityReport.failClosed(e.getClass().getSimpleName());
        }
    }

    private SensitivityReport doClassify(String content) {
        var matches = new ArrayList<PatternMatch>();
        double ruleScore = 0.0;

        for (var category : categories) {
            for (var rule : category.rules()) {
                int count = countMatches(rule.pattern().matcher(content));
                if (count > 0) {
                    matches.add(new PatternMatch(category.name(), rule.id(), count));
                    ruleScore += (double) count * category.severity();
                    log.debug("Pattern {}/{} matched {} time(s)", category.name(), rule.id(), count);
                }
            }
        }

        double heuristic;
        try {
            heuristic = scorer.score(content);
        } catch (RuntimeException e) {
            throw new ClassificationException("scorer " + scorer.getClass().getSimpleName() + " failed", e);
        }
        if (Double.isNaN(heuristic) || heuristic < 0 || heuristic > 10) {
            throw new ClassificationException("scorer returned out-of-range value " + heuristic, null);
        }

        double composite = ruleScore * ruleWeight + heuristic * heuristicWeight;
        boolean critical = matches.stream()
                .anyMatch(m -> SensitivityRules.CRITICAL_SECRETS.equals(m.category()));

        SensitivityLevel level;
        if (critical || composite >= HIGH_THRESHOLD) {
            level = SensitivityLevel.HIGH;
        } else if (composite >= MEDIUM_THRESHOLD) {
            level = SensitivityLevel.MEDIUM;
        } else {
            level = SensitivityLevel.LOW;
        }

        return new SensitivityReport(level, composite, ruleScore, heuristic, matches,
                recommendations(level, matches), false);
    }

    private static int countMatches(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static List<String> recommendations(SensitivityLevel level, List<PatternMatch> matches) {
        Set<String> advice = new LinkedHashSet<>();
        switch (level) {
            case HIGH -> advice.add("Process locally only; do not send this content to remote services");
            case MEDIUM -> advice.add("Anonymize identifiers before any remote processing");
            case LOW -> advice.add("No sensitive content detected; any venue is acceptable");
        }
        for (var match : matches) {
            switch (match.category()) {
                case SensitivityRules.CRITICAL_SECRETS ->
                        advice.add("Move credentials out of the content and into a secret store");
                case SensitivityRules.PERSONAL_DATA ->
                        advice.add("Mask personal data such as emails and phone numbers");
                case SensitivityRules.INFRASTRUCTURE ->
                        advice.add("Replace host addresses and connection URLs with placeholders");
                case SensitivityRules.BUSINESS_SECRETS ->
                        advice.add("Confirm that business-confidential material may be shared");
                default -> { }
            }
        }
        return List.copyOf(advice);
    }
}
