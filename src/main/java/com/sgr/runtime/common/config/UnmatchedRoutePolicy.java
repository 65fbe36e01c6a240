package com.sgr.runtime.common.config;

import com.sgr.runtime.common.RuntimeConfigException;

import java.util.Locale;

/**
 * What a hub does with input that matches none of its routing rules.
 */
public enum UnmatchedRoutePolicy {
    /** Report ROUTING_NO_MATCH, invoke nothing. */
    NONE,
    /** Fan out to every spoke and concatenate in spoke order. */
    BROADCAST,
    /** Let the hub role answer the input itself. */
    HUB;

    public static UnmatchedRoutePolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuntimeConfigException(RuntimeConfigException.Reason.INVALID_CONFIG,
                    "Unsupported unmatched_route policy: " + value, e);
        }
    }
}
