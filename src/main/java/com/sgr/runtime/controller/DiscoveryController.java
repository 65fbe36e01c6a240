package com.sgr.runtime.controller;

import com.sgr.runtime.common.service.AgentRuntime;
import com.sgr.runtime.common.service.AgentRuntimeRegistry;
import com.sgr.runtime.graph.ExecutionGraph;
import com.sgr.runtime.graph.RoleDescriptor;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {

    private final AgentRuntimeRegistry registry;

    public DiscoveryController(AgentRuntimeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Lists the agents built so far.
     */
    @GetMapping("/agents")
    public ResponseEntity<List<AgentCardDto>> getAvailableAgents() {
        List<AgentCardDto> agents = registry.getAllRuntimes().stream()
                .map(this::mapToAgentCard)
                .collect(Collectors.toList());

        return ResponseEntity.ok(agents);
    }

    /**
     * Describes one agent, building it if needed.
     */
    @GetMapping("/agents/{agentId}")
    public ResponseEntity<AgentCardDto> getAgent(@PathVariable String agentId) {
        return ResponseEntity.ok(mapToAgentCard(registry.getRuntime(agentId)));
    }

    // Instruction text and secret values never leave the process
    private AgentCardDto mapToAgentCard(AgentRuntime runtime) {
        ExecutionGraph graph = runtime.graph();
        return new AgentCardDto(
                runtime.agentId(),
                graph.name(),
                graph.description(),
                graph.executionType().value(),
                graph.roles());
    }

    public record AgentCardDto(
            String id,
            String name,
            String description,
            String executionType,
            List<RoleDescriptor> roles) {
    }
}
