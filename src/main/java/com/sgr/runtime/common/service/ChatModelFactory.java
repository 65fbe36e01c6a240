package com.sgr.runtime.common.service;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.azure.AzureOpenAiChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class ChatModelFactory implements ChatModelProvider {

    // --- Inject Global Keys from application.yml ---
    @Value("${runtime.litellm.url:http://localhost:4000}")
    private String liteLlmUrl;

    @Value("${runtime.litellm.api-key:}")
    private String liteLlmKey;

    @Value("${langchain4j.open-ai.api-key:}")
    private String defaultOpenAiKey;

    @Value("${langchain4j.google-ai.api-key:}")
    private String defaultGeminiKey;

    @Value("${langchain4j.anthropic.api-key:}")
    private String defaultAnthropicKey;

    @Value("${langchain4j.ollama.base-url:http://localhost:11434}")
    private String defaultOllamaUrl;

    @Value("${langchain4j.deepseek.api-key:}")
    private String defaultDeepSeekKey;

    @Value("${langchain4j.groq.api-key:}")
    private String defaultGroqKey;

    @Value("${langchain4j.azure-open-ai.endpoint:}")
    private String defaultAzureEndpoint;

    @Value("${langchain4j.azure-open-ai.api-key:}")
    private String defaultAzureKey;

    @Value("${runtime.model.timeout-seconds:60}")
    private long timeoutSeconds;

    // Cache: provider:modelName:temperature -> Model Instance
    private final Map<String, ChatModel> modelCache = new ConcurrentHashMap<>();

    @Override
    public ChatModel getModel(ModelSpec spec) {
        return modelCache.computeIfAbsent(spec.cacheKey(), k -> buildModel(spec));
    }

    private ChatModel buildModel(ModelSpec spec) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);

        switch (spec.provider()) {
            // LiteLLM proxy, OpenAI-compatible; the default route for every role
            case "litellm":
                return OpenAiChatModel.builder()
                        // a proxy without auth still expects some bearer token
                        .apiKey(StringUtils.hasText(liteLlmKey) ? liteLlmKey : "no-key")
                        .baseUrl(liteLlmUrl)
                        .modelName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "openai":
                return OpenAiChatModel.builder()
                        .apiKey(resolveKey(spec, defaultOpenAiKey))
                        .modelName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "gemini":
            case "google":
                return GoogleAiGeminiChatModel.builder()
                        .apiKey(resolveKey(spec, defaultGeminiKey))
                        .modelName(spec.name()) // e.g., "gemini-1.5-flash"
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "anthropic":
            case "claude":
                return AnthropicChatModel.builder()
                        .apiKey(resolveKey(spec, defaultAnthropicKey))
                        .modelName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "ollama":
                return OllamaChatModel.builder()
                        .baseUrl(defaultOllamaUrl)
                        .modelName(spec.name()) // e.g., "llama3"
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            // OpenAI-compatible providers behind their own base URL
            case "deepseek":
                return OpenAiChatModel.builder()
                        .apiKey(resolveKey(spec, defaultDeepSeekKey))
                        .baseUrl("https://api.deepseek.com")
                        .modelName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "groq":
                return OpenAiChatModel.builder()
                        .apiKey(resolveKey(spec, defaultGroqKey))
                        .baseUrl("https://api.groq.com/openai/v1")
                        .modelName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            case "azure":
            case "azure-openai":
                return AzureOpenAiChatModel.builder()
                        .endpoint(defaultAzureEndpoint)
                        .apiKey(resolveKey(spec, defaultAzureKey))
                        // In Azure, 'modelName' refers to the deployment name
                        .deploymentName(spec.name())
                        .temperature(spec.temperature())
                        .timeout(timeout)
                        .build();

            default:
                throw new IllegalArgumentException("Unsupported provider: " + spec.provider());
        }
    }

    private String resolveKey(ModelSpec spec, String defaultKey) {
        if (!StringUtils.hasText(defaultKey)) {
            throw new IllegalStateException("Missing API Key for provider: " + spec.provider());
        }
        return defaultKey;
    }
}
