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
 * LiteLLM Prompt Management: {@code GET /prompts/{id}/info}.
 * The prompt lives in {@code prompt_spec.litellm_params.dotprompt_content};
 * only the body after the YAML front matter is returned.
 */
@Service
public class LiteLlmPromptStore implements PromptStore {

    private static final Logger log = LoggerFactory.getLogger(LiteLlmPromptStore.class);

    private final RestClient restClient;
    private final String apiKey;

    public LiteLlmPromptStore(RestClient.Builder restClientBuilder,
            @Value("${runtime.litellm.url}") String litellmUrl,
            @Value("${runtime.litellm.api-key:}") String apiKey) {
        this.restClient = restClientBuilder.baseUrl(litellmUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "litellm";
    }

    @Override
    public Optional<String> fetch(String promptId) {
        if (!StringUtils.hasText(apiKey)) {
            log.debug("LiteLLM api key not set, skipping prompt [{}]", promptId);
            return Optional.empty();
        }

        JsonNode info;
        try {
            info = restClient.get()
                    .uri("/prompts/{promptId}/info", promptId)
                    .headers(h -> h.setBearerAuth(apiKey))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("LiteLLM prompt [{}] not found", promptId);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new StoreUnavailableException(name(), "LiteLLM prompt [" + promptId + "] unavailable: "
                    + e.getMessage(), e);
        }

        if (info == null) {
            return Optional.empty();
        }
        String dotprompt = info.path("prompt_spec").path("litellm_params").path("dotprompt_content").asText("");
        String body = parseDotpromptBody(dotprompt);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        log.info("Prompt [{}] loaded from LiteLLM ({} chars)", promptId, body.length());
        return Optional.of(body);
    }

    static String parseDotpromptBody(String content) {
        if (content == null) {
            return "";
        }
        if (!content.startsWith("---")) {
            return content.strip();
        }
        String[] lines = content.split("\n", -1);
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].strip().equals("---")) {
                StringBuilder body = new StringBuilder();
                for (int j = i + 1; j < lines.length; j++) {
                    if (j > i + 1) {
                        body.append('\n');
                    }
                    body.append(lines[j]);
                }
                return body.toString().strip();
            }
        }
        // unterminated front matter
        return content.strip();
    }
}
