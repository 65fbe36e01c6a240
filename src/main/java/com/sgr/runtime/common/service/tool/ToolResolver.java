package com.sgr.runtime.common.service.tool;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.StoreUnavailableException;
import com.sgr.runtime.common.config.ParameterKind;
import com.sgr.runtime.common.config.RoleConfig;
import com.sgr.runtime.common.config.ToolConfig;
import com.sgr.runtime.common.config.ToolParameter;
import com.sgr.runtime.common.config.ToolProvider;
import com.sgr.runtime.common.service.tool.BuiltinToolRegistry.BuiltinTool;
import com.sgr.runtime.common.store.SecretStore;

import dev.langchain4j.agent.tool.ToolSpecification;

import io.modelcontextprotocol.spec.McpSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a role's tool configs into callable bindings. Inactive tools are
 * dropped. Builtin ids must exist in the registry. External tools get their
 * secret parameters resolved before the server is contacted, then expose the
 * configured tool names plus whatever the server lists.
 */
@Service
public class ToolResolver {

    private static final Logger log = LoggerFactory.getLogger(ToolResolver.class);

    private final BuiltinToolRegistry builtinRegistry;
    private final ToolServerConnector connector;
    private final SecretStore secretStore;

    public ToolResolver(BuiltinToolRegistry builtinRegistry, ToolServerConnector connector, SecretStore secretStore) {
        this.builtinRegistry = builtinRegistry;
        this.connector = connector;
        this.secretStore = secretStore;
    }

    public ToolResolution resolve(RoleConfig role) {
        List<ToolBinding> bindings = new ArrayList<>();
        List<ToolSnapshot> snapshots = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();

        for (ToolConfig tool : role.tools()) {
            if (!tool.isActive()) {
                log.debug("Role [{}]: tool [{}] inactive, skipped", role.name(), tool.id());
                continue;
            }
            List<ToolBinding> resolved = tool.providerKind() == ToolProvider.BUILTIN
                    ? List.of(resolveBuiltin(role, tool))
                    : resolveExternal(role, tool);

            for (ToolBinding binding : resolved) {
                if (names.add(binding.name())) {
                    bindings.add(binding);
                } else {
                    log.warn("Role [{}]: duplicate tool name [{}] from [{}] dropped", role.name(), binding.name(),
                            tool.id());
                }
            }
            snapshots.add(snapshot(tool, resolved));
        }

        if (!bindings.isEmpty()) {
            log.info("Role [{}] resolved tools: {}", role.name(), names);
        }
        return new ToolResolution(bindings, snapshots);
    }

    private ToolBinding resolveBuiltin(RoleConfig role, ToolConfig tool) {
        BuiltinTool builtin = builtinRegistry.find(tool.id())
                .orElseThrow(() -> new RuntimeConfigException(Reason.UNKNOWN_BUILTIN_TOOL,
                        "Role [" + role.name() + "] references unknown builtin tool [" + tool.id() + "]; known: "
                                + builtinRegistry.names()));
        return new ToolBinding(tool.id(), ToolProvider.BUILTIN, builtin.specification(), builtin.executor());
    }

    private List<ToolBinding> resolveExternal(RoleConfig role, ToolConfig tool) {
        Map<String, String> headers = resolveParameters(role, tool);

        ToolServerConnection connection;
        List<McpSchema.Tool> discovered;
        try {
            connection = connector.connect(tool.serverReference(), headers);
            discovered = connection.listTools();
        } catch (ToolServerException e) {
            throw new RuntimeConfigException(Reason.TOOL_SERVER_UNAVAILABLE,
                    "Role [" + role.name() + "]: tool server for [" + tool.id() + "] unavailable: " + e.getMessage(),
                    e);
        }

        Map<String, ToolSpecification> specifications = new LinkedHashMap<>();
        for (String configured : tool.tools()) {
            specifications.put(configured, ToolSpecification.builder()
                    .name(configured)
                    .description("Tool provided by " + tool.id())
                    .build());
        }
        for (McpSchema.Tool found : discovered) {
            // the server's own description and schema win over a bare configured name
            specifications.put(found.name(), McpToolSpecifications.from(found, "Tool provided by " + tool.id()));
        }
        log.info("Role [{}]: tool server [{}] exposes {} tool(s)", role.name(), tool.id(), specifications.size());

        List<ToolBinding> bindings = new ArrayList<>();
        for (ToolSpecification specification : specifications.values()) {
            String toolName = specification.name();
            bindings.add(new ToolBinding(tool.id(), ToolProvider.EXTERNAL, specification,
                    (request, memoryId) -> connection.callTool(toolName, request.arguments())));
        }
        return bindings;
    }

    private Map<String, String> resolveParameters(RoleConfig role, ToolConfig tool) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ToolParameter> entry : tool.parameters().entrySet()) {
            ToolParameter parameter = entry.getValue();
            if (parameter.parameterKind() == ParameterKind.TEXT) {
                resolved.put(entry.getKey(), parameter.value() == null ? "" : parameter.value());
                continue;
            }
            Optional<String> secret;
            try {
                secret = secretStore.fetch(parameter.value());
            } catch (StoreUnavailableException e) {
                throw new RuntimeConfigException(Reason.SECRET_RESOLUTION_FAILED,
                        "Role [" + role.name() + "]: secret parameter [" + entry.getKey() + "] of tool [" + tool.id()
                                + "] could not be resolved: " + e.getMessage(),
                        e);
            }
            resolved.put(entry.getKey(), secret.orElseThrow(() -> new RuntimeConfigException(
                    Reason.SECRET_RESOLUTION_FAILED,
                    "Role [" + role.name() + "]: secret parameter [" + entry.getKey() + "] of tool [" + tool.id()
                            + "] not found")));
        }
        return resolved;
    }

    private ToolSnapshot snapshot(ToolConfig tool, List<ToolBinding> bindings) {
        Map<String, String> parameters = new LinkedHashMap<>();
        tool.parameters().forEach((name, parameter) -> parameters.put(name,
                parameter.parameterKind() == ParameterKind.SECRET ? ToolSnapshot.REDACTED
                        : String.valueOf(parameter.value())));
        return new ToolSnapshot(tool.id(), tool.providerKind().value(), tool.serverReference(),
                bindings.stream().map(ToolBinding::name).toList(), parameters);
    }
}
