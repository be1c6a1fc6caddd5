package com.smartroute.core.anonymize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Anonymized text plus the placeholder-to-original mapping needed to restore
 * it. The mapping belongs to one request and is discarded after restore.
 *
 * @param text    text with identifiers and literals replaced
 * @param mapping placeholder to original value, injective
 */
public record AnonymizationResult(String text, Map<String, String> mapping) {

    public AnonymizationResult {
        mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }
}
