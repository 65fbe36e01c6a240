package com.sgr.runtime.executor;

import com.sgr.runtime.common.config.RoutingRule;
import com.sgr.runtime.graph.HubNode;

import java.util.Optional;

/**
 * Static routing: the first rule matching the input names the spoke.
 */
final class HubRouter {

    private HubRouter() {
    }

    static Optional<String> route(HubNode hub, String input) {
        for (RoutingRule rule : hub.rules()) {
            if (rule.matches(input)) {
                return Optional.of(rule.spoke());
            }
        }
        return Optional.empty();
    }
}
