package com.sgr.runtime.common.service.tool;

import java.util.List;
import java.util.Map;

/**
 * Displayable view of a resolved tool config. Secret parameter values are
 * replaced with {@link #REDACTED}; nothing in here is sensitive.
 */
public record ToolSnapshot(
        String id,
        String provider,
        String serverReference,
        List<String> tools,
        Map<String, String> parameters) {

    public static final String REDACTED = "***";

    public ToolSnapshot {
        tools = tools == null ? List.of() : List.copyOf(tools);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
