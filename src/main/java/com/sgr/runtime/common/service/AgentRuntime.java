package com.sgr.runtime.common.service;

import com.sgr.runtime.common.config.RuntimeConfig;
import com.sgr.runtime.graph.ExecutionGraph;

/**
 * A built agent: its immutable config and the graph assembled from it.
 */
public record AgentRuntime(String agentId, RuntimeConfig config, ExecutionGraph graph) {
}
