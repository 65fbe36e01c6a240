package com.sgr.runtime.common.service.tool;

import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * An initialized session with one tool server.
 */
public interface ToolServerConnection {

    String serverReference();

    List<McpSchema.Tool> listTools();

    /**
     * Invokes a tool with JSON-encoded arguments and returns its text output.
     *
     * @throws ToolServerException on transport failure or when the tool reports an error
     */
    String callTool(String toolName, String argumentsJson);
}
