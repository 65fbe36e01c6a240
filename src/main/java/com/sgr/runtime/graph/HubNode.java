package com.sgr.runtime.graph;

import com.sgr.runtime.common.config.RoutingRule;
import com.sgr.runtime.common.config.UnmatchedRoutePolicy;

import java.util.List;
import java.util.Optional;

/**
 * A hub with named spokes. Static rules pick one spoke for an input; the
 * unmatched policy decides what happens when none applies.
 */
public record HubNode(
        LeafNode hub,
        List<LeafNode> spokes,
        List<RoutingRule> rules,
        UnmatchedRoutePolicy unmatchedPolicy) implements GraphNode {

    public HubNode {
        spokes = List.copyOf(spokes);
        rules = List.copyOf(rules);
    }

    public Optional<LeafNode> spoke(String role) {
        return spokes.stream().filter(s -> s.role().equals(role)).findFirst();
    }

    @Override
    public String label() {
        return "hub(" + hub.role() + ")";
    }

    @Override
    public <R> R accept(GraphVisitor<R> visitor) {
        return visitor.visitHub(this);
    }
}
