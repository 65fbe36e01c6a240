package com.sgr.runtime.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A named tool-server parameter. {@code text} values are literal; {@code secret}
 * values are references into the secret store and are resolved at graph-build time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolParameter(String kind, String value) {

    public static ToolParameter text(String value) {
        return new ToolParameter("text", value);
    }

    public static ToolParameter secret(String reference) {
        return new ToolParameter("secret", reference);
    }

    public ParameterKind parameterKind() {
        return ParameterKind.fromValue(kind);
    }

    @Override
    public String toString() {
        // never print the reference of a secret, it may itself be sensitive
        return parameterKind() == ParameterKind.SECRET ? "ToolParameter[secret]" : "ToolParameter[text=" + value + "]";
    }
}
