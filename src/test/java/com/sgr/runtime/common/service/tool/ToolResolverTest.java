package com.sgr.runtime.common.service.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.StoreUnavailableException;
import com.sgr.runtime.common.config.RoleConfig;
import com.sgr.runtime.common.config.ToolConfig;
import com.sgr.runtime.common.config.ToolParameter;
import com.sgr.runtime.common.config.ToolProvider;
import com.sgr.runtime.common.store.SecretStore;
import com.sgr.runtime.tools.FunctionTools;

import dev.langchain4j.agent.tool.ToolExecutionRequest;

import io.modelcontextprotocol.spec.McpSchema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolResolverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BuiltinToolRegistry registry = new BuiltinToolRegistry(List.of(new FunctionTools(RestClient.builder())));

    private SecretStore secretStore;
    private FakeServer server;
    private ToolResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        secretStore = mock(SecretStore.class);
        server = new FakeServer(List.of(
                tool("""
                        {"name": "search_issues", "description": "Searches issues",
                         "inputSchema": {"type": "object",
                                         "properties": {"jql": {"type": "string"}, "limit": {"type": "integer"}},
                                         "required": ["jql"]}}
                        """),
                tool("{\"name\": \"get_issue\"}")));
        resolver = new ToolResolver(registry, server, secretStore);
    }

    @Test
    void inactiveToolsAreDroppedSilently() {
        RoleConfig role = RoleConfig.named("r1", null).withTools(List.of(
                ToolConfig.builtin("get_date_time"),
                new ToolConfig("http_request", "builtin", false, null, null, null)));

        ToolResolution resolution = resolver.resolve(role);

        assertEquals(List.of("get_date_time"), names(resolution));
        assertEquals(1, resolution.snapshots().size());
    }

    @Test
    void unknownBuiltinIsFatal() {
        RoleConfig role = RoleConfig.named("r1", null).withTools(List.of(ToolConfig.builtin("teleport")));

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class, () -> resolver.resolve(role));

        assertEquals(Reason.UNKNOWN_BUILTIN_TOOL, e.getReason());
    }

    @Test
    void externalToolsMergeConfiguredAndDiscovered() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.of("s3cret"));
        RoleConfig role = RoleConfig.named("r1", null).withTools(List.of(jira(List.of("create_issue", "get_issue"))));

        ToolResolution resolution = resolver.resolve(role);

        assertEquals(List.of("create_issue", "get_issue", "search_issues"), names(resolution));
        ToolBinding search = resolution.bindings().get(2);
        assertEquals(ToolProvider.EXTERNAL, search.provider());
        assertEquals("Searches issues", search.specification().description());
        assertEquals(List.of("jql"), search.specification().parameters().required());
        assertEquals(Map.of("X-Jira-Url", "https://jira.test", "Authorization", "s3cret"), server.headers);
    }

    @Test
    void externalBindingsCallTheServer() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.of("s3cret"));
        ToolBinding search = resolver.resolve(RoleConfig.named("r1", null).withTools(List.of(jira(List.of()))))
                .bindings().stream().filter(b -> b.name().equals("search_issues")).findFirst().orElseThrow();

        String result = search.executor().execute(ToolExecutionRequest.builder()
                .id("1").name("search_issues").arguments("{\"jql\":\"project=OPS\"}").build(), "r1");

        assertEquals("search_issues({\"jql\":\"project=OPS\"})", result);
    }

    @Test
    void snapshotsRedactSecrets() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.of("s3cret"));

        ToolSnapshot snapshot = resolver.resolve(RoleConfig.named("r1", null).withTools(List.of(jira(List.of()))))
                .snapshots().get(0);

        assertEquals("***", snapshot.parameters().get("Authorization"));
        assertEquals("https://jira.test", snapshot.parameters().get("X-Jira-Url"));
        assertFalse(snapshot.toString().contains("s3cret"));
        assertFalse(snapshot.toString().contains("JIRA_TOKEN"));
    }

    @Test
    void missingSecretIsFatalAndServerIsNotContacted() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.empty());

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> resolver.resolve(RoleConfig.named("r1", null).withTools(List.of(jira(List.of())))));

        assertEquals(Reason.SECRET_RESOLUTION_FAILED, e.getReason());
        assertEquals(0, server.connections);
    }

    @Test
    void unreachableSecretStoreIsFatal() {
        when(secretStore.fetch("JIRA_TOKEN")).thenThrow(new StoreUnavailableException("secrets", "Unauthorized"));

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> resolver.resolve(RoleConfig.named("r1", null).withTools(List.of(jira(List.of())))));

        assertEquals(Reason.SECRET_RESOLUTION_FAILED, e.getReason());
    }

    @Test
    void unreachableToolServerIsFatal() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.of("s3cret"));
        server.down = true;

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> resolver.resolve(RoleConfig.named("r1", null).withTools(List.of(jira(List.of())))));

        assertEquals(Reason.TOOL_SERVER_UNAVAILABLE, e.getReason());
    }

    @Test
    void duplicateToolNamesKeepTheFirst() {
        when(secretStore.fetch("JIRA_TOKEN")).thenReturn(Optional.of("s3cret"));
        RoleConfig role = RoleConfig.named("r1", null).withTools(List.of(jira(List.of()), jira(List.of())));

        assertEquals(List.of("search_issues", "get_issue"), names(resolver.resolve(role)));
    }

    private static ToolConfig jira(List<String> configured) {
        Map<String, ToolParameter> parameters = new LinkedHashMap<>();
        parameters.put("X-Jira-Url", ToolParameter.text("https://jira.test"));
        parameters.put("Authorization", ToolParameter.secret("JIRA_TOKEN"));
        return new ToolConfig("jira", "external", true, "http://tools.test/mcp", configured, parameters);
    }

    private static List<String> names(ToolResolution resolution) {
        List<String> names = new ArrayList<>();
        resolution.bindings().forEach(b -> names.add(b.name()));
        return names;
    }

    private McpSchema.Tool tool(String json) throws Exception {
        return objectMapper.readValue(json, McpSchema.Tool.class);
    }

    private static final class FakeServer implements ToolServerConnector {

        private final List<McpSchema.Tool> tools;
        private Map<String, String> headers;
        private int connections;
        private boolean down;

        FakeServer(List<McpSchema.Tool> tools) {
            this.tools = tools;
        }

        @Override
        public ToolServerConnection connect(String serverReference, Map<String, String> headers) {
            if (down) {
                throw new ToolServerException("connection refused");
            }
            connections++;
            this.headers = headers;
            return new ToolServerConnection() {
                @Override
                public String serverReference() {
                    return serverReference;
                }

                @Override
                public List<McpSchema.Tool> listTools() {
                    return tools;
                }

                @Override
                public String callTool(String toolName, String argumentsJson) {
                    return toolName + "(" + argumentsJson + ")";
                }
            };
        }
    }
}
