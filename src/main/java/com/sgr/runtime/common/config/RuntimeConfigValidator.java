package com.sgr.runtime.common.config;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural checks performed before any store is contacted. Everything rejected
 * here is a configuration error and surfaces at build time, never during a task.
 */
@Component
public class RuntimeConfigValidator {

    public ExecutionType validate(RuntimeConfig config) {
        if (config == null) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Runtime config is missing");
        }
        ExecutionType type = ExecutionType.fromValue(config.executionType());

        if (config.roles().isEmpty()) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Runtime config declares no roles");
        }

        Set<String> names = new HashSet<>();
        for (RoleConfig role : config.roles()) {
            if (role == null || !StringUtils.hasText(role.name())) {
                throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Every role needs a name");
            }
            if (!names.add(role.name())) {
                throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Duplicate role name: " + role.name());
            }
            for (ToolConfig tool : role.tools()) {
                validateTool(role, tool);
            }
        }

        requireRole(config, "aggregator_role", config.aggregatorRole());
        requireRole(config, "coordinator_role", config.coordinatorRole());
        requireRole(config, "hub_role", config.hubRole());

        UnmatchedRoutePolicy.fromValue(config.unmatchedRoute());
        for (RoutingRule rule : config.routingRules()) {
            validateRule(config, rule);
        }
        return type;
    }

    private void requireRole(RuntimeConfig config, String field, String roleName) {
        if (roleName != null && config.findRole(roleName).isEmpty()) {
            throw new RuntimeConfigException(Reason.DANGLING_ROLE_REFERENCE,
                    field + " references unknown role: " + roleName);
        }
    }

    private void validateTool(RoleConfig role, ToolConfig tool) {
        if (tool == null || !StringUtils.hasText(tool.id())) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Tool without id in role: " + role.name());
        }
        ToolProvider provider = tool.providerKind();
        if (provider == ToolProvider.EXTERNAL && tool.isActive() && !StringUtils.hasText(tool.serverReference())) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG,
                    "External tool [" + tool.id() + "] in role [" + role.name() + "] has no server_reference");
        }
        for (ToolParameter parameter : tool.parameters().values()) {
            if (parameter == null) {
                throw new RuntimeConfigException(Reason.INVALID_CONFIG,
                        "Null parameter on tool [" + tool.id() + "] in role [" + role.name() + "]");
            }
            parameter.parameterKind();
        }
    }

    private void validateRule(RuntimeConfig config, RoutingRule rule) {
        if (rule == null || !StringUtils.hasText(rule.spoke())) {
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Routing rule without spoke");
        }
        if (config.findRole(rule.spoke()).isEmpty()) {
            throw new RuntimeConfigException(Reason.DANGLING_ROLE_REFERENCE,
                    "routing_rules references unknown spoke: " + rule.spoke());
        }
        if (rule.pattern() != null) {
            try {
                Pattern.compile(rule.pattern());
            } catch (PatternSyntaxException e) {
                throw new RuntimeConfigException(Reason.INVALID_CONFIG,
                        "Invalid routing pattern for spoke " + rule.spoke() + ": " + rule.pattern(), e);
            }
        }
    }
}
