package com.sgr.runtime.common.config;

import com.sgr.runtime.common.RuntimeConfigException;

import java.util.Locale;

public enum ParameterKind {
    TEXT,
    SECRET;

    public static ParameterKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuntimeConfigException(RuntimeConfigException.Reason.INVALID_CONFIG,
                    "Unsupported tool parameter kind: " + value, e);
        }
    }
}
