package com.sgr.runtime.common.config;

import com.sgr.runtime.common.RuntimeConfigException;

import java.util.Locale;

public enum ExecutionType {
    SINGLE,
    SEQUENTIAL,
    PARALLEL,
    COORDINATOR,
    HUB_SPOKE;

    public static ExecutionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SINGLE;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ExecutionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new RuntimeConfigException(RuntimeConfigException.Reason.UNSUPPORTED_EXECUTION_TYPE,
                "Unsupported execution_type: " + value);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
