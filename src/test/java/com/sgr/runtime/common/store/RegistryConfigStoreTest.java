package com.sgr.runtime.common.store;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.config.RuntimeConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RegistryConfigStoreTest {

    private MockRestServiceServer server;
    private RegistryConfigStore store;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        store = new RegistryConfigStore(builder, "http://registry", "reg-key", 2, 1);
    }

    @Test
    void fetchesRuntimeConfigFromAgentRecord() {
        server.expect(requestTo("http://registry/agents/devops"))
                .andExpect(header("Authorization", "Bearer reg-key"))
                .andRespond(withSuccess("""
                        {"name": "DevOps", "description": "Ops helper", "owner": "team-a",
                         "runtime_config": {"execution_type": "sequential",
                           "roles": [{"name": "plan", "prompt_inline": "p"}, {"name": "act", "model": "gpt-4o"}]}}
                        """, MediaType.APPLICATION_JSON));

        RuntimeConfig config = store.fetch("devops");

        assertEquals("DevOps", config.name());
        assertEquals("Ops helper", config.description());
        assertEquals("sequential", config.executionType());
        assertEquals(2, config.roles().size());
        assertEquals("gpt-4o", config.roles().get(1).model());
        server.verify();
    }

    @Test
    void notFoundIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo("http://registry/agents/ghost"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class, () -> store.fetch("ghost"));

        assertEquals(Reason.CONFIG_NOT_FOUND, e.getReason());
        server.verify();
    }

    @Test
    void recordWithoutRuntimeConfigIsNotFound() {
        server.expect(requestTo("http://registry/agents/bare"))
                .andRespond(withSuccess("{\"name\": \"bare\"}", MediaType.APPLICATION_JSON));

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class, () -> store.fetch("bare"));

        assertEquals(Reason.CONFIG_NOT_FOUND, e.getReason());
    }

    @Test
    void serverErrorsAreRetriedThenUnreachable() {
        server.expect(ExpectedCount.times(2), requestTo("http://registry/agents/devops"))
                .andRespond(withServerError());

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class, () -> store.fetch("devops"));

        assertEquals(Reason.CONFIG_UNREACHABLE, e.getReason());
        server.verify();
    }

    @Test
    void nullRoleEntryIsReturnedForValidation() {
        server.expect(ExpectedCount.once(), requestTo("http://registry/agents/devops"))
                .andRespond(withSuccess("{\"runtime_config\": {\"execution_type\": \"single\", \"roles\": [null]}}",
                        MediaType.APPLICATION_JSON));

        RuntimeConfig config = store.fetch("devops");

        assertEquals(1, config.roles().size());
        assertNull(config.roles().get(0));
        server.verify();
    }

    @Test
    void malformedRecordIsInvalidAndNotRetried() {
        server.expect(ExpectedCount.once(), requestTo("http://registry/agents/devops"))
                .andRespond(withSuccess("{\"runtime_config\": {\"roles\": \"not-a-list\"}}",
                        MediaType.APPLICATION_JSON));

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class, () -> store.fetch("devops"));

        assertEquals(Reason.INVALID_CONFIG, e.getReason());
        server.verify();
    }
}
