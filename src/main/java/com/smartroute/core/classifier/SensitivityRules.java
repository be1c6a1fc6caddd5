package com.smartroute.core.classifier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered catalogue of sensitive-content categories and their patterns.
 */
public final class SensitivityRules {

    public static final String CRITICAL_SECRETS = "critical_secrets";
    public static final String PERSONAL_DATA = "personal_data";
    public static final String INFRASTRUCTURE = "infrastructure";
    public static final String BUSINESS_SECRETS = "business_secrets";

    public record Rule(String id, Pattern pattern) {}

    public record Category(String name, int severity, List<Rule> rules) {}

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Category> DEFAULT_CATEGORIES = List.of(
            new Category(CRITICAL_SECRETS, 10, List.of(
                    rule("api_key", "api[_-]?key"),
                    rule("secret_key", "secret[_-]?key"),
                    rule("access_token", "access[_-]?token"),
                    rule("bearer_token", "bearer\\s+[a-zA-Z0-9._-]+"),
                    rule("sk_key", "sk-[a-zA-Z0-9]+"),
                    rule("password", "(?:password|passwd|pwd)\\s*[:=]\\s*[\"']?[^\"'\\s]+"),
                    rule("private_key", "-----BEGIN[A-Z ]*PRIVATE KEY-----"),
                    rule("credential_url", "[a-z][a-z0-9+.-]*://[^\\s:/@]+:[^\\s@/]+@"))),
            new Category(PERSONAL_DATA, 8, List.of(
                    rule("email", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
                    rule("phone", "\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"),
                    rule("credit_card", "\\b\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}\\b"),
                    rule("ssn", "\\b\\d{3}-\\d{2}-\\d{4}\\b"))),
            new Category(INFRASTRUCTURE, 6, List.of(
                    rule("ip_address", "\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"),
                    rule("database_url", "(?:mongodb|mysql|postgresql|redis)://"))),
            new Category(BUSINESS_SECRETS, 4, List.of(
                    rule("proprietary", "proprietary"),
                    rule("confidential", "confidential"),
                    rule("trade_secret", "trade\\s+secret"),
                    rule("internal_only", "internal\\s+only"),
                    rule("classified", "classified")))
    );

    private SensitivityRules() {} // utility class

    public static List<Category> defaults() {
        return DEFAULT_CATEGORIES;
    }

    private static Rule rule(String id, String regex) {
        return new Rule(id, Pattern.compile(regex, FLAGS));
    }
}
