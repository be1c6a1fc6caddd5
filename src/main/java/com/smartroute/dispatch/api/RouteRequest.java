package com.smartroute.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/route and /api/v1/route/execute.
 *
 * @param content     text to route
 * @param taskType    task type (e.g. "syntax_checking"); nullable, defaults to "general"
 * @param preferences per-request overrides: privacy_mode, cost_priority, quality_threshold,
 *                    anonymization_enabled, max_cloud_cost_per_request; nullable
 */
public record RouteRequest(
    String content,
    @JsonProperty("task_type") String taskType,
    Map<String, Object> preferences
) {}
