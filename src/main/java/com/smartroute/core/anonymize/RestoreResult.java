package com.smartroute.core.anonymize;

import java.util.List;

/**
 * Restored text and any placeholders that could not be mapped back.
 */
public record RestoreResult(String text, List<String> warnings) {

    public RestoreResult {
        warnings = List.copyOf(warnings);
    }

    public boolean clean() {
        return warnings.isEmpty();
    }
}
