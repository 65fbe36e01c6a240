package com.sgr.runtime.common.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.config.RuntimeConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches agent configuration from the Registry API: {@code GET /agents/{id}}.
 */
@Service
@ConditionalOnProperty(name = "runtime.config-store", havingValue = "registry", matchIfMissing = true)
public class RegistryConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfigStore.class);

    private final RestClient restClient;
    private final String apiKey;
    private final int attempts;
    private final long retryDelayMs;

    public RegistryConfigStore(RestClient.Builder restClientBuilder,
            @Value("${runtime.registry.url}") String registryUrl,
            @Value("${runtime.registry.api-key:}") String apiKey,
            @Value("${runtime.registry.attempts:3}") int attempts,
            @Value("${runtime.registry.retry-delay-ms:2000}") long retryDelayMs) {
        this.restClient = restClientBuilder.baseUrl(registryUrl).build();
        this.apiKey = apiKey;
        this.attempts = Math.max(1, attempts);
        this.retryDelayMs = retryDelayMs;
    }

    @Override
    public RuntimeConfig fetch(String agentId) {
        RestClientException lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                AgentRecord record = restClient.get()
                        .uri("/agents/{agentId}", agentId)
                        .headers(this::authorize)
                        .retrieve()
                        .body(AgentRecord.class);

                if (record == null || record.runtimeConfig() == null) {
                    throw new RuntimeConfigException(Reason.CONFIG_NOT_FOUND,
                            "Agent [" + agentId + "] has no runtime_config in the registry");
                }
                log.info("Loaded runtime config for agent [{}] from registry", agentId);
                return record.runtimeConfig().withDisplayInfo(record.name(), record.description());

            } catch (HttpClientErrorException.NotFound e) {
                throw new RuntimeConfigException(Reason.CONFIG_NOT_FOUND,
                        "Agent [" + agentId + "] not found in registry", e);
            } catch (RestClientException e) {
                if (e.getCause() instanceof HttpMessageNotReadableException) {
                    // the registry answered; retrying returns the same malformed record
                    throw new RuntimeConfigException(Reason.INVALID_CONFIG,
                            "Registry record for agent [" + agentId + "] is malformed: " + e.getMessage(), e);
                }
                lastError = e;
                log.warn("Registry attempt {}/{} for agent [{}] failed: {}", attempt, attempts, agentId,
                        e.getMessage());
                if (attempt < attempts) {
                    pause();
                }
            }
        }

        throw new RuntimeConfigException(Reason.CONFIG_UNREACHABLE,
                "Registry unreachable while loading agent [" + agentId + "]", lastError);
    }

    private void authorize(HttpHeaders headers) {
        if (StringUtils.hasText(apiKey)) {
            headers.setBearerAuth(apiKey);
        }
    }

    private void pause() {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeConfigException(Reason.CONFIG_UNREACHABLE, "Interrupted while waiting for registry", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AgentRecord(
            String name,
            String description,
            @JsonProperty("runtime_config") RuntimeConfig runtimeConfig) {
    }
}
