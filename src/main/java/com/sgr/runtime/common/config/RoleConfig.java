package com.sgr.runtime.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// One named role within a topology
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoleConfig(
        String name,
        String model, // "gpt-4o-mini" or "anthropic:claude-3-5-sonnet-20240620"
        Double temperature,

        @JsonProperty("prompt_inline") String promptInline,

        @JsonProperty("external_prompt_id") String externalPromptId,

        @JsonProperty("prompt_ref") String promptRef, // logical name

        @JsonProperty("max_turns") Integer maxTurns,

        List<ToolConfig> tools,

        // Variables for {{placeholders}} in the resolved prompt
        Map<String, Object> metadata) {

    public RoleConfig {
        tools = tools == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tools));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RoleConfig named(String name, String model) {
        return new RoleConfig(name, model, null, null, null, null, null, null, null);
    }

    public RoleConfig withPromptInline(String text) {
        return new RoleConfig(name, model, temperature, text, externalPromptId, promptRef, maxTurns, tools, metadata);
    }

    public RoleConfig withTools(List<ToolConfig> newTools) {
        return new RoleConfig(name, model, temperature, promptInline, externalPromptId, promptRef, maxTurns, newTools,
                metadata);
    }
}
