package com.sgr.runtime.graph;

import com.sgr.runtime.common.service.tool.ToolSnapshot;

import java.util.List;

/**
 * Display information about a built role. Holds no instruction text and no secret values.
 */
public record RoleDescriptor(
        String name,
        String model,
        String promptSource,
        String promptOrigin,
        List<String> degradations,
        List<ToolSnapshot> tools) {

    public RoleDescriptor {
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
