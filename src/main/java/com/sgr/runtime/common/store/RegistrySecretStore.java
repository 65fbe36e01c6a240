package com.sgr.runtime.common.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.sgr.runtime.common.StoreUnavailableException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Optional;

/**
 * Secret lookups against the registry: {@code GET /secrets/{reference}} returning {@code {"value": ...}}.
 */
@Service
@ConditionalOnProperty(name = "runtime.secrets.store", havingValue = "registry")
public class RegistrySecretStore implements SecretStore {

    private final RestClient restClient;
    private final String apiKey;

    public RegistrySecretStore(RestClient.Builder restClientBuilder,
            @Value("${runtime.registry.url}") String registryUrl,
            @Value("${runtime.registry.api-key:}") String apiKey) {
        this.restClient = restClientBuilder.baseUrl(registryUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    public Optional<String> fetch(String reference) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri("/secrets/{reference}", reference)
                    .headers(h -> {
                        if (StringUtils.hasText(apiKey)) {
                            h.setBearerAuth(apiKey);
                        }
                    })
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return Optional.empty();
            }
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw new StoreUnavailableException("secrets", "Unauthorized for secret reference", e);
            }
            throw new StoreUnavailableException("secrets", "Secret lookup rejected: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new StoreUnavailableException("secrets", "Secret store unreachable: " + e.getMessage(), e);
        }

        String value = body == null ? "" : body.path("value").asText("");
        return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
    }
}
