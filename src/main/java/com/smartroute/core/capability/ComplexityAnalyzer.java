package com.smartroute.core.capability;

import com.smartroute.core.model.ComplexityClass;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Infers complexity from the content itself: keyword hints first, checked from
 * simplest to most complex and each bounded by a size limit, then size alone.
 */
public class ComplexityAnalyzer {

    private record Indicator(ComplexityClass complexity, Pattern keywords, int maxLines, int maxFunctions) {}

    private static final Pattern FUNCTION_DEF = Pattern.compile("def\\s+\\w+");

    private static final List<Indicator> INDICATORS = List.of(
            new Indicator(ComplexityClass.SIMPLE,
                    hints("syntax", "format", "lint", "style", "rename", "comment"), 50, 3),
            new Indicator(ComplexityClass.MEDIUM,
                    hints("refactor", "optimiz", "debug", "test", "implement"), 200, 10),
            new Indicator(ComplexityClass.COMPLEX,
                    hints("design", "architecture", "algorithm", "pattern", "framework"), 500, 25),
            new Indicator(ComplexityClass.ULTRA_COMPLEX,
                    hints("system", "distributed", "microservice", "scalable", "enterprise"),
                    Integer.MAX_VALUE, Integer.MAX_VALUE)
    );

    public ComplexityClass analyze(String content) {
        String text = content == null ? "" : content;
        int lines = text.split("\n", -1).length;
        int functions = countFunctions(text);

        for (var indicator : INDICATORS) {
            if (indicator.keywords().matcher(text).find()
                    && lines <= indicator.maxLines()
                    && functions <= indicator.maxFunctions()) {
                return indicator.complexity();
            }
        }
        return bySize(lines, functions);
    }

    static ComplexityClass bySize(int lines, int functions) {
        for (var indicator : INDICATORS) {
            if (lines <= indicator.maxLines() && functions <= indicator.maxFunctions()) {
                return indicator.complexity();
            }
        }
        return ComplexityClass.ULTRA_COMPLEX;
    }

    private static int countFunctions(String text) {
        var matcher = FUNCTION_DEF.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    // Prefix match at a word start, so "format" hits "formatting" but not "platform".
    private static Pattern hints(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")", Pattern.CASE_INSENSITIVE);
    }
}
