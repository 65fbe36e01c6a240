package com.sgr.runtime.graph;

import com.sgr.runtime.common.config.ExecutionType;

import java.util.List;

/**
 * The composed, immutable result of building one runtime config.
 */
public record ExecutionGraph(
        String name,
        String description,
        ExecutionType executionType,
        GraphNode root,
        List<RoleDescriptor> roles) {

    public ExecutionGraph {
        roles = List.copyOf(roles);
    }
}
