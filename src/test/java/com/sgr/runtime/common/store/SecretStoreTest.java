package com.sgr.runtime.common.store;

import com.sgr.runtime.common.StoreUnavailableException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SecretStoreTest {

    @Test
    void environmentStoreReadsProperties() {
        MockEnvironment environment = new MockEnvironment().withProperty("JIRA_TOKEN", "s3cret");
        EnvironmentSecretStore store = new EnvironmentSecretStore(environment);

        assertEquals(Optional.of("s3cret"), store.fetch("JIRA_TOKEN"));
        assertTrue(store.fetch("MISSING_TOKEN").isEmpty());
    }

    @Test
    void registryStoreMapsStatuses() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RegistrySecretStore store = new RegistrySecretStore(builder, "http://registry", "");

        server.expect(requestTo("http://registry/secrets/JIRA_TOKEN"))
                .andRespond(withSuccess("{\"value\": \"s3cret\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://registry/secrets/GONE"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo("http://registry/secrets/LOCKED"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertEquals(Optional.of("s3cret"), store.fetch("JIRA_TOKEN"));
        assertTrue(store.fetch("GONE").isEmpty());
        assertThrows(StoreUnavailableException.class, () -> store.fetch("LOCKED"));
        server.verify();
    }
}
