package com.sgr.runtime.common.config;

import com.sgr.runtime.common.RuntimeConfigException;

import java.util.Locale;

public enum ToolProvider {
    BUILTIN,
    EXTERNAL;

    public static ToolProvider fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BUILTIN;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "builtin":
                return BUILTIN;
            case "external":
            case "mcp":
                return EXTERNAL;
            default:
                throw new RuntimeConfigException(RuntimeConfigException.Reason.INVALID_CONFIG,
                        "Unsupported tool provider: " + value);
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
