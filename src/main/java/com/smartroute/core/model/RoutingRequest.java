package com.smartroute.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work submitted for routing. Immutable for the lifetime of one
 * routing and execution cycle.
 *
 * @param id          request identifier, used for MDC, events and accounting
 * @param content     the text to classify and execute
 * @param taskType    task type key used by the capability table (e.g. "syntax_checking")
 * @param preferences per-request overrides of the routing policy (see {@link RoutingPreferences})
 */
public record RoutingRequest(
    String id,
    String content,
    String taskType,
    Map<String, Object> preferences
) {

    public static final String DEFAULT_TASK_TYPE = "general";

    public RoutingRequest {
        Objects.requireNonNull(id, "id");
        content = content == null ? "" : content;
        taskType = taskType == null || taskType.isBlank() ? DEFAULT_TASK_TYPE : taskType.trim();
        preferences = preferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
    }

    public RoutingRequest(String id, String content, String taskType) {
        this(id, content, taskType, Map.of());
    }
}
