package com.sgr.runtime.common.service;

import java.util.Locale;
import java.util.Set;

/**
 * Provider, model name and temperature for one role. A role's {@code model}
 * may carry a provider prefix ({@code anthropic:claude-3-5-sonnet-20240620});
 * without one, the default provider is used.
 */
public record ModelSpec(String provider, String name, Double temperature) {

    static final Set<String> KNOWN_PROVIDERS = Set.of(
            "litellm", "openai", "gemini", "google", "anthropic", "claude", "ollama", "deepseek", "groq", "azure",
            "azure-openai");

    public static ModelSpec parse(String model, Double temperature, String defaultProvider) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model name is required");
        }
        String trimmed = model.trim();
        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            String prefix = trimmed.substring(0, colon).toLowerCase(Locale.ROOT);
            if (KNOWN_PROVIDERS.contains(prefix)) {
                return new ModelSpec(prefix, trimmed.substring(colon + 1), temperature);
            }
        }
        return new ModelSpec(defaultProvider.toLowerCase(Locale.ROOT), trimmed, temperature);
    }

    public String cacheKey() {
        return String.format("%s:%s:%s", provider, name, temperature);
    }
}
