package com.sgr.runtime.common.service;

import com.sgr.runtime.common.config.RoleConfig;
import com.sgr.runtime.common.config.RuntimeConfig;
import com.sgr.runtime.common.config.RuntimeConfigValidator;
import com.sgr.runtime.common.service.prompt.PromptResolution;
import com.sgr.runtime.common.service.prompt.PromptResolver;
import com.sgr.runtime.common.service.tool.ToolResolution;
import com.sgr.runtime.common.service.tool.ToolResolver;
import com.sgr.runtime.common.store.ConfigStore;
import com.sgr.runtime.graph.ExecutionGraph;
import com.sgr.runtime.graph.GraphBuilder;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages the lifecycle of agent runtimes: fetch config, resolve prompts and
 * tools, build the graph, cache the result per agent id.
 */
@Service
public class AgentRuntimeRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntimeRegistry.class);

    private final Map<String, AgentRuntime> runtimeCache = new ConcurrentHashMap<>();
    private final ConfigStore configStore;
    private final RuntimeConfigValidator validator;
    private final PromptResolver promptResolver;
    private final ToolResolver toolResolver;
    private final GraphBuilder graphBuilder;
    private final List<String> eagerAgentIds;

    public AgentRuntimeRegistry(ConfigStore configStore,
            RuntimeConfigValidator validator,
            PromptResolver promptResolver,
            ToolResolver toolResolver,
            GraphBuilder graphBuilder,
            @Value("${runtime.agent-ids:}") List<String> eagerAgentIds) {
        this.configStore = configStore;
        this.validator = validator;
        this.promptResolver = promptResolver;
        this.toolResolver = toolResolver;
        this.graphBuilder = graphBuilder;
        this.eagerAgentIds = eagerAgentIds.stream().map(String::trim).filter(id -> !id.isEmpty()).toList();
    }

    /**
     * Builds the configured agents up front. Any failure aborts startup.
     */
    @PostConstruct
    public void init() {
        log.info("Initializing Agent Runtime Registry. Eager agents: {}", eagerAgentIds);
        for (String agentId : eagerAgentIds) {
            getRuntime(agentId);
        }
    }

    /**
     * Returns the cached runtime, building it on first use. Concurrent callers
     * for the same id share one build; a failed build is not cached.
     */
    public AgentRuntime getRuntime(String agentId) {
        return runtimeCache.computeIfAbsent(agentId, this::build);
    }

    public List<AgentRuntime> getAllRuntimes() {
        return List.copyOf(runtimeCache.values());
    }

    private AgentRuntime build(String agentId) {
        RuntimeConfig config = configStore.fetch(agentId).withDisplayInfo(agentId, null);
        validator.validate(config);

        Map<String, PromptResolution> prompts = new LinkedHashMap<>();
        Map<String, ToolResolution> tools = new LinkedHashMap<>();
        for (RoleConfig role : config.roles()) {
            prompts.put(role.name(), promptResolver.resolve(role));
            tools.put(role.name(), toolResolver.resolve(role));
        }

        ExecutionGraph graph = graphBuilder.build(config, prompts, tools);
        log.info("Built agent [{}] ({}, {} role(s))", agentId, graph.executionType().value(), config.roles().size());
        return new AgentRuntime(agentId, config, graph);
    }
}
