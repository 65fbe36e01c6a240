package com.sgr.runtime.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// One capability attached to a role
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolConfig(
        String id,
        String provider, // "builtin" or "external" ("mcp")
        Boolean active,

        @JsonProperty("server_reference") String serverReference, // MCP endpoint for external tools

        List<String> tools, // explicitly configured subset, external only

        Map<String, ToolParameter> parameters) {

    public ToolConfig {
        tools = tools == null ? List.of() : tools.stream().filter(Objects::nonNull).toList();
        // keep declaration order for header emission
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ToolConfig builtin(String id) {
        return new ToolConfig(id, "builtin", true, null, null, null);
    }

    public boolean isActive() {
        return active == null || active;
    }

    public ToolProvider providerKind() {
        return ToolProvider.fromValue(provider);
    }
}
