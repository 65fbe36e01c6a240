package com.sgr.runtime.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

// Raw agent behaviour as served by the registry ("runtime_config") or a local YAML file
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuntimeConfig(
        String name,
        String description,

        @JsonProperty("execution_type") String executionType, // single, sequential, parallel, coordinator, hub_spoke

        List<RoleConfig> roles,

        @JsonProperty("aggregator_role") String aggregatorRole, // parallel

        @JsonProperty("coordinator_role") String coordinatorRole, // coordinator

        @JsonProperty("hub_role") String hubRole, // hub_spoke

        @JsonProperty("routing_rules") List<RoutingRule> routingRules, // hub_spoke

        @JsonProperty("unmatched_route") String unmatchedRoute) { // none, broadcast, hub

    public RuntimeConfig {
        // null entries survive so validation can reject them as config errors
        roles = roles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roles));
        routingRules = routingRules == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(routingRules));
    }

    public Optional<RoleConfig> findRole(String roleName) {
        return roles.stream().filter(r -> r != null && roleName.equals(r.name())).findFirst();
    }

    public RuntimeConfig withDisplayInfo(String fallbackName, String fallbackDescription) {
        return new RuntimeConfig(
                name != null ? name : fallbackName,
                description != null ? description : fallbackDescription,
                executionType, roles, aggregatorRole, coordinatorRole, hubRole, routingRules, unmatchedRoute);
    }
}
