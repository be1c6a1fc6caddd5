package com.smartroute.core.execution;

/**
 * Output of one backend call.
 *
 * @param output       generated text
 * @param qualityScore backend's own quality estimate in [0,1]
 */
public record BackendResponse(String output, double qualityScore) {

    public BackendResponse {
        output = output == null ? "" : output;
        qualityScore = Double.isNaN(qualityScore) ? 0.0 : Math.max(0.0, Math.min(1.0, qualityScore));
    }
}
