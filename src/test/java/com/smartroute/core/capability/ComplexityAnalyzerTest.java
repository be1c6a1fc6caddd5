package com.smartroute.core.capability;

import com.smartroute.core.model.ComplexityClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    @Test
    @DisplayName("lint requests are SIMPLE")
    void lintIsSimple() {
        assertEquals(ComplexityClass.SIMPLE, analyzer.analyze("Please lint this file"));
    }

    @Test
    @DisplayName("keyword prefixes match at a word start")
    void prefixMatch() {
        assertEquals(ComplexityClass.SIMPLE, analyzer.analyze("fix the formatting"));
        assertEquals(ComplexityClass.MEDIUM, analyzer.analyze("optimize the loop"));
    }

    @Test
    @DisplayName("keywords inside other words do not match")
    void noMidWordMatch() {
        assertEquals(ComplexityClass.COMPLEX,
                analyzer.analyze("Design a microservices architecture for e-commerce platform"));
    }

    @Test
    @DisplayName("ultra complex keywords")
    void ultraComplex() {
        assertEquals(ComplexityClass.ULTRA_COMPLEX, analyzer.analyze("Build a scalable service"));
    }

    @Test
    @DisplayName("a simple keyword is ignored once the content exceeds its size limit")
    void sizeLimitOverridesKeyword() {
        String content = "lint this\n" + "x = 1\n".repeat(60);
        assertEquals(ComplexityClass.MEDIUM, analyzer.analyze(content));
    }

    @Test
    @DisplayName("size alone decides when no keyword matches")
    void sizeOnly() {
        assertEquals(ComplexityClass.SIMPLE, ComplexityAnalyzer.bySize(10, 1));
        assertEquals(ComplexityClass.MEDIUM, ComplexityAnalyzer.bySize(60, 0));
        assertEquals(ComplexityClass.COMPLEX, ComplexityAnalyzer.bySize(100, 12));
        assertEquals(ComplexityClass.ULTRA_COMPLEX, ComplexityAnalyzer.bySize(600, 0));
    }

    @Test
    @DisplayName("function definitions count toward the size limit")
    void functionsCount() {
        String content = "def a(): pass\ndef b(): pass\ndef c(): pass\ndef d(): pass";
        assertEquals(ComplexityClass.MEDIUM, analyzer.analyze(content));
    }
}
