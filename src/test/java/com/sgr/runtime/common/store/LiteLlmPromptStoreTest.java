package com.sgr.runtime.common.store;

import com.sgr.runtime.common.StoreUnavailableException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LiteLlmPromptStoreTest {

    private MockRestServiceServer server;
    private LiteLlmPromptStore store;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        store = new LiteLlmPromptStore(builder, "http://litellm", "sk-test");
    }

    @Test
    void returnsDotpromptBodyWithoutFrontMatter() {
        server.expect(requestTo("http://litellm/prompts/analyst/info"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andRespond(withSuccess("""
                        {"prompt_spec": {"litellm_params": {"dotprompt_content":
                          "---\\nmodel: gpt-4o\\n---\\nYou are an analyst."}}}
                        """, MediaType.APPLICATION_JSON));

        assertEquals(Optional.of("You are an analyst."), store.fetch("analyst"));
        server.verify();
    }

    @Test
    void notFoundIsEmpty() {
        server.expect(requestTo("http://litellm/prompts/missing/info")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(store.fetch("missing").isEmpty());
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo("http://litellm/prompts/analyst/info")).andRespond(withServerError());

        assertThrows(StoreUnavailableException.class, () -> store.fetch("analyst"));
    }

    @Test
    void withoutApiKeyTheStoreIsSkipped() {
        LiteLlmPromptStore keyless = new LiteLlmPromptStore(RestClient.builder(), "http://litellm", "");

        assertTrue(keyless.fetch("analyst").isEmpty());
    }

    @Test
    void parsesBodyAfterFrontMatter() {
        assertEquals("Body", LiteLlmPromptStore.parseDotpromptBody("---\nmodel: x\n---\n\nBody\n"));
        assertEquals("No front matter", LiteLlmPromptStore.parseDotpromptBody("No front matter"));
        assertEquals("", LiteLlmPromptStore.parseDotpromptBody(null));
    }
}
