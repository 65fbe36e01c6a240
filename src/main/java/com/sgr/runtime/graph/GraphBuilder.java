package com.sgr.runtime.graph;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.config.ExecutionType;
import com.sgr.runtime.common.config.RoleConfig;
import com.sgr.runtime.common.config.RoutingRule;
import com.sgr.runtime.common.config.RuntimeConfig;
import com.sgr.runtime.common.config.RuntimeConfigValidator;
import com.sgr.runtime.common.config.UnmatchedRoutePolicy;
import com.sgr.runtime.common.service.ModelSpec;
import com.sgr.runtime.common.service.prompt.PromptResolution;
import com.sgr.runtime.common.service.tool.ToolBinding;
import com.sgr.runtime.common.service.tool.ToolResolution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Composes a validated runtime config, with its resolved prompts and tools,
 * into an {@link ExecutionGraph}.
 */
@Component
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public static final String AGGREGATOR_PREAMBLE = "Aggregate and synthesize these results:";

    private final RuntimeConfigValidator validator;
    private final int defaultMaxTurns;
    private final String defaultModel;
    private final String defaultProvider;

    @Autowired
    public GraphBuilder(RuntimeConfigValidator validator,
            @Value("${runtime.executor.default-max-turns:10}") int defaultMaxTurns,
            @Value("${runtime.model.default-name:gpt-4o-mini}") String defaultModel,
            @Value("${runtime.model.default-provider:litellm}") String defaultProvider) {
        this.validator = validator;
        this.defaultMaxTurns = defaultMaxTurns;
        this.defaultModel = defaultModel;
        this.defaultProvider = defaultProvider;
    }

    public ExecutionGraph build(RuntimeConfig config, Map<String, PromptResolution> prompts,
            Map<String, ToolResolution> tools) {
        ExecutionType type = validator.validate(config);
        List<RoleConfig> roles = config.roles();

        GraphNode root;
        switch (type) {
            case SINGLE:
                if (roles.size() > 1) {
                    log.warn("Agent [{}] is single but declares {} roles; only [{}] is used", config.name(),
                            roles.size(), roles.get(0).name());
                }
                root = leaf(roles.get(0), prompts, tools);
                break;
            case SEQUENTIAL:
                root = new SequentialNode(leaves(roles, null, prompts, tools));
                break;
            case PARALLEL:
                root = parallel(config, prompts, tools);
                break;
            case COORDINATOR:
                root = coordinator(config, prompts, tools);
                break;
            case HUB_SPOKE:
                root = hub(config, prompts, tools);
                break;
            default:
                throw new RuntimeConfigException(Reason.UNSUPPORTED_EXECUTION_TYPE,
                        "Unsupported execution_type: " + type);
        }

        List<RoleDescriptor> descriptors = new ArrayList<>();
        for (RoleConfig role : roles) {
            PromptResolution prompt = prompts.get(role.name());
            if (prompt == null) {
                throw new RuntimeConfigException(Reason.INSTRUCTION_UNRESOLVED,
                        "Role [" + role.name() + "] has no resolved instructions");
            }
            descriptors.add(new RoleDescriptor(role.name(), modelOf(role).provider() + ":" + modelOf(role).name(),
                    prompt.source().value(), prompt.origin(), prompt.degradations(),
                    tools.getOrDefault(role.name(), ToolResolution.EMPTY).snapshots()));
        }

        log.info("Built {} graph for agent [{}]: {}", type.value(), config.name(), root.label());
        return new ExecutionGraph(config.name(), config.description(), type, root, descriptors);
    }

    private GraphNode parallel(RuntimeConfig config, Map<String, PromptResolution> prompts,
            Map<String, ToolResolution> tools) {
        String aggregator = config.aggregatorRole();
        List<GraphNode> branches = leaves(config.roles(), aggregator, prompts, tools);
        if (branches.isEmpty()) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Parallel agent has no roles besides the aggregator");
        }
        ParallelNode fanOut = new ParallelNode(branches);
        if (aggregator == null) {
            return fanOut;
        }
        LeafNode aggregatorLeaf = leaf(config.findRole(aggregator).orElseThrow(), prompts, tools)
                .withInputPreamble(AGGREGATOR_PREAMBLE);
        return new SequentialNode(List.of(fanOut, aggregatorLeaf));
    }

    private GraphNode coordinator(RuntimeConfig config, Map<String, PromptResolution> prompts,
            Map<String, ToolResolution> tools) {
        RoleConfig coordinatorRole = primary(config, config.coordinatorRole());
        LeafNode coordinator = leaf(coordinatorRole, prompts, tools);
        List<LeafNode> workers = new ArrayList<>();
        for (GraphNode node : leaves(config.roles(), coordinatorRole.name(), prompts, tools)) {
            LeafNode worker = (LeafNode) node;
            for (ToolBinding binding : coordinator.tools()) {
                if (binding.name().equals(worker.role())) {
                    throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Coordinator tool [" + binding.name()
                            + "] clashes with worker role of the same name");
                }
            }
            workers.add(worker);
        }
        return new CoordinatorNode(coordinator, workers);
    }

    private GraphNode hub(RuntimeConfig config, Map<String, PromptResolution> prompts,
            Map<String, ToolResolution> tools) {
        RoleConfig hubRole = primary(config, config.hubRole());
        for (RoutingRule rule : config.routingRules()) {
            if (rule.spoke().equals(hubRole.name())) {
                throw new RuntimeConfigException(Reason.INVALID_CONFIG,
                        "Routing rule targets the hub role itself: " + hubRole.name());
            }
        }
        List<LeafNode> spokes = new ArrayList<>();
        for (GraphNode node : leaves(config.roles(), hubRole.name(), prompts, tools)) {
            spokes.add((LeafNode) node);
        }
        if (spokes.isEmpty()) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Hub agent declares no spoke roles");
        }
        return new HubNode(leaf(hubRole, prompts, tools), spokes, config.routingRules(),
                UnmatchedRoutePolicy.fromValue(config.unmatchedRoute()));
    }

    // explicit reference if set, first role otherwise
    private RoleConfig primary(RuntimeConfig config, String reference) {
        return reference == null ? config.roles().get(0) : config.findRole(reference).orElseThrow();
    }

    private List<GraphNode> leaves(List<RoleConfig> roles, String excluded, Map<String, PromptResolution> prompts,
            Map<String, ToolResolution> tools) {
        List<GraphNode> nodes = new ArrayList<>();
        for (RoleConfig role : roles) {
            if (!role.name().equals(excluded)) {
                nodes.add(leaf(role, prompts, tools));
            }
        }
        return nodes;
    }

    private LeafNode leaf(RoleConfig role, Map<String, PromptResolution> prompts, Map<String, ToolResolution> tools) {
        PromptResolution prompt = prompts.get(role.name());
        if (prompt == null || !StringUtils.hasText(prompt.text())) {
            throw new RuntimeConfigException(Reason.INSTRUCTION_UNRESOLVED,
                    "Role [" + role.name() + "] has no resolved instructions");
        }
        int maxTurns = role.maxTurns() != null && role.maxTurns() > 0 ? role.maxTurns() : defaultMaxTurns;
        return new LeafNode(role.name(), modelOf(role), prompt.text(), maxTurns,
                tools.getOrDefault(role.name(), ToolResolution.EMPTY).bindings(), null);
    }

    private ModelSpec modelOf(RoleConfig role) {
        String model = StringUtils.hasText(role.model()) ? role.model() : defaultModel;
        return ModelSpec.parse(model, role.temperature(), defaultProvider);
    }
}
