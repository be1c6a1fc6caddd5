package com.smartroute.core.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordDensityScorerTest {

    private final KeywordDensityScorer scorer = new KeywordDensityScorer();

    @Test
    @DisplayName("empty content scores zero")
    void emptyScoresZero() {
        assertEquals(0.0, scorer.score(""));
        assertEquals(0.0, scorer.score(null));
    }

    @Test
    @DisplayName("short content with one word scores five")
    void oneWordShortContent() {
        assertEquals(5.0, scorer.score("this is private"), 1e-9);
    }

    @Test
    @DisplayName("score is capped at ten")
    void capped() {
        assertEquals(10.0, scorer.score("secret private token"), 1e-9);
    }

    @Test
    @DisplayName("long content dilutes the score")
    void longContentDilutes() {
        String content = "private " + "x".repeat(392);
        assertEquals(400, content.length());
        assertEquals(1.25, scorer.score(content), 1e-9);
    }

    @Test
    @DisplayName("matching is case-insensitive")
    void caseInsensitive() {
        assertEquals(scorer.score("CONFIDENTIAL"), scorer.score("confidential"));
    }
}
