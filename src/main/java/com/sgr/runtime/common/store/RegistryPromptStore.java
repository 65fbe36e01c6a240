package com.sgr.runtime.common.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.sgr.runtime.common.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * Registry prompt templates: {@code GET /prompts/{name}}.
 */
@Service
public class RegistryPromptStore implements PromptStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryPromptStore.class);

    private final RestClient restClient;
    private final boolean enabled;

    public RegistryPromptStore(RestClient.Builder restClientBuilder,
            @Value("${runtime.registry.url:}") String registryUrl) {
        this.enabled = StringUtils.hasText(registryUrl);
        this.restClient = enabled ? restClientBuilder.baseUrl(registryUrl).build() : null;
    }

    @Override
    public String name() {
        return "registry";
    }

    @Override
    public Optional<String> fetch(String promptName) {
        if (!enabled) {
            return Optional.empty();
        }

        JsonNode body;
        try {
            body = restClient.get()
                    .uri("/prompts/{name}", promptName)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            throw new StoreUnavailableException(name(), "Registry prompt [" + promptName + "] unavailable: "
                    + e.getMessage(), e);
        }

        if (body == null) {
            return Optional.empty();
        }
        for (String field : new String[] { "template", "prompt", "text" }) {
            String value = body.path(field).asText("");
            if (StringUtils.hasText(value)) {
                log.info("Prompt [{}] loaded from registry", promptName);
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
