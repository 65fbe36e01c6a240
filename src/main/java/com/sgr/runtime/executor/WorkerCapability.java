package com.sgr.runtime.executor;

import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * Something a coordinator can call like a tool: a worker role, exposed under its own name.
 */
public interface WorkerCapability {

    String name();

    ToolSpecification specification();

    /**
     * Runs the worker on {@code request} within the calling task.
     *
     * @return the worker output, or its failure marker
     */
    String invoke(String request, TaskContext context);
}
