package com.sgr.runtime.common.http;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.StoreUnavailableException;
import com.sgr.runtime.common.store.LiteLlmPromptStore;
import com.sgr.runtime.common.store.RegistryConfigStore;
import com.sgr.runtime.tools.FunctionTools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpClientConfigTest {

    private static final Duration LIMIT = Duration.ofSeconds(5);

    // accepts connections into the backlog and never answers
    private ServerSocket silentServer;
    private String baseUrl;
    private final HttpClientConfig config = new HttpClientConfig(1000, 300);

    @BeforeEach
    void setUp() throws IOException {
        silentServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        baseUrl = "http://127.0.0.1:" + silentServer.getLocalPort();
    }

    @AfterEach
    void tearDown() throws IOException {
        silentServer.close();
    }

    @Test
    void propertiesAreApplied() {
        assertEquals(Duration.ofSeconds(1), config.getConnectTimeout());
        assertEquals(Duration.ofMillis(300), config.getReadTimeout());
        assertEquals(Duration.ofSeconds(1), config.httpClient().connectTimeout().orElseThrow());
    }

    @Test
    void silentPromptStoreFailsAsUnavailable() {
        LiteLlmPromptStore store = new LiteLlmPromptStore(customized(), baseUrl, "sk-test");

        StoreUnavailableException e = assertTimeoutPreemptively(LIMIT,
                () -> assertThrows(StoreUnavailableException.class, () -> store.fetch("analyst")));

        assertEquals("litellm", e.getStore());
    }

    @Test
    void silentRegistryIsReportedUnreachable() {
        RegistryConfigStore store = new RegistryConfigStore(customized(), baseUrl, "", 1, 0);

        RuntimeConfigException e = assertTimeoutPreemptively(LIMIT,
                () -> assertThrows(RuntimeConfigException.class, () -> store.fetch("agent-1")));

        assertEquals(Reason.CONFIG_UNREACHABLE, e.getReason());
    }

    @Test
    void silentHttpToolTimesOut() {
        FunctionTools tools = new FunctionTools(customized());

        assertTimeoutPreemptively(LIMIT,
                () -> assertThrows(ResourceAccessException.class,
                        () -> tools.httpRequest(baseUrl + "/slow", "GET", null)));
    }

    private RestClient.Builder customized() {
        RestClient.Builder builder = RestClient.builder();
        config.timeoutRestClientCustomizer().customize(builder);
        return builder;
    }
}
