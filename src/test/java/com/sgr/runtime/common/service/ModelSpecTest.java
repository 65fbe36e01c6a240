package com.sgr.runtime.common.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelSpecTest {

    @Test
    void bareNameUsesDefaultProvider() {
        ModelSpec spec = ModelSpec.parse("gpt-4o-mini", 0.2, "LiteLLM");

        assertEquals("litellm", spec.provider());
        assertEquals("gpt-4o-mini", spec.name());
        assertEquals(0.2, spec.temperature());
    }

    @Test
    void knownPrefixSelectsProvider() {
        ModelSpec spec = ModelSpec.parse("Anthropic:claude-3-5-sonnet-20240620", null, "litellm");

        assertEquals("anthropic", spec.provider());
        assertEquals("claude-3-5-sonnet-20240620", spec.name());
    }

    @Test
    void unknownPrefixStaysPartOfTheName() {
        // ollama style tags contain a colon too
        ModelSpec spec = ModelSpec.parse("llama3:8b", null, "ollama");

        assertEquals("ollama", spec.provider());
        assertEquals("llama3:8b", spec.name());
    }

    @Test
    void blankModelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ModelSpec.parse(" ", null, "litellm"));
    }

    @Test
    void cacheKeyDistinguishesTemperature() {
        assertNotEquals(ModelSpec.parse("m", 0.1, "openai").cacheKey(), ModelSpec.parse("m", 0.7, "openai").cacheKey());
        assertEquals(ModelSpec.parse("m", null, "openai").cacheKey(), ModelSpec.parse("openai:m", null, "x").cacheKey());
    }
}
