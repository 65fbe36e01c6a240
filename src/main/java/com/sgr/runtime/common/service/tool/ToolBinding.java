package com.sgr.runtime.common.service.tool;

import com.sgr.runtime.common.config.ToolProvider;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.service.tool.ToolExecutor;

/**
 * One callable tool as seen by a role's model: what to advertise and how to run it.
 */
public record ToolBinding(String toolId, ToolProvider provider, ToolSpecification specification,
        ToolExecutor executor) {

    public String name() {
        return specification.name();
    }
}
