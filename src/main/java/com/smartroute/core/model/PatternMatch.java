package com.smartroute.core.model;

/**
 * One sensitive pattern found in classified content.
 *
 * @param category   category name (e.g. "critical_secrets")
 * @param patternId  identifier of the pattern within its category
 * @param matchCount number of non-overlapping matches
 */
public record PatternMatch(String category, String patternId, int matchCount) {}
