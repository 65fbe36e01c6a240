package com.sgr.runtime.common.service.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sgr.runtime.common.http.HttpClientConfig;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Tool server connector backed by the MCP Java SDK over streamable HTTP.
 * Resolved parameters travel as request headers. Sessions stay open until
 * shutdown.
 */
@Component
public class McpToolServerClient implements ToolServerConnector {

    private static final Logger log = LoggerFactory.getLogger(McpToolServerClient.class);

    private static final McpSchema.Implementation CLIENT_INFO =
            new McpSchema.Implementation("sgr-agent-runtime", "1.0.0");
    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
    };

    private final HttpClientConfig httpClientConfig;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<McpSyncClient> openClients = new CopyOnWriteArrayList<>();

    public McpToolServerClient(HttpClientConfig httpClientConfig) {
        this.httpClientConfig = httpClientConfig;
    }

    @Override
    public ToolServerConnection connect(String serverReference, Map<String, String> headers) {
        McpSyncClient client = open(serverReference, headers);
        try {
            client.initialize();
        } catch (RuntimeException e) {
            client.close();
            throw new ToolServerException("Tool server [" + serverReference + "] failed to initialize: "
                    + describe(e), e);
        }
        openClients.add(client);
        log.info("Connected to tool server [{}]", serverReference);
        return new Session(serverReference, client);
    }

    @PreDestroy
    public void closeAll() {
        for (McpSyncClient client : openClients) {
            try {
                client.closeGracefully();
            } catch (RuntimeException e) {
                log.warn("Tool server session did not close cleanly: {}", e.getMessage());
            }
        }
        openClients.clear();
    }

    private McpSyncClient open(String serverReference, Map<String, String> headers) {
        URI uri;
        try {
            uri = URI.create(serverReference);
        } catch (IllegalArgumentException e) {
            throw new ToolServerException("Invalid tool server reference [" + serverReference + "]", e);
        }
        // resolved parameters, secrets included; never logged
        Map<String, String> requestHeaders = new LinkedHashMap<>(headers);

        HttpClientStreamableHttpTransport transport = HttpClientStreamableHttpTransport.builder(baseUri(uri))
                .endpoint(endpoint(uri))
                .customizeClient(c -> c.connectTimeout(httpClientConfig.getConnectTimeout()))
                .customizeRequest(r -> requestHeaders.forEach(r::header))
                .build();

        return McpClient.sync(transport)
                .clientInfo(CLIENT_INFO)
                .requestTimeout(httpClientConfig.getReadTimeout())
                .initializationTimeout(httpClientConfig.getReadTimeout())
                .build();
    }

    static String baseUri(URI uri) {
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new ToolServerException("Tool server reference [" + uri + "] is not an absolute URL");
        }
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }

    static String endpoint(URI uri) {
        String path = StringUtils.hasText(uri.getRawPath()) ? uri.getRawPath() : "/";
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? String.valueOf(e.getMessage()) : e.getMessage() + " (" + root + ")";
    }

    private final class Session implements ToolServerConnection {

        private final String serverReference;
        private final McpSyncClient client;

        Session(String serverReference, McpSyncClient client) {
            this.serverReference = serverReference;
            this.client = client;
        }

        @Override
        public String serverReference() {
            return serverReference;
        }

        @Override
        public List<McpSchema.Tool> listTools() {
            List<McpSchema.Tool> tools = new ArrayList<>();
            try {
                McpSchema.ListToolsResult page = client.listTools();
                tools.addAll(page.tools());
                while (StringUtils.hasText(page.nextCursor())) {
                    page = client.listTools(page.nextCursor());
                    tools.addAll(page.tools());
                }
            } catch (RuntimeException e) {
                throw new ToolServerException("Tool server [" + serverReference + "] failed on tools/list: "
                        + describe(e), e);
            }
            return tools;
        }

        @Override
        public String callTool(String toolName, String argumentsJson) {
            McpSchema.CallToolResult result;
            try {
                result = client.callTool(new McpSchema.CallToolRequest(toolName, readArguments(argumentsJson)));
            } catch (ToolServerException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ToolServerException("Tool server [" + serverReference + "] failed on tool [" + toolName
                        + "]: " + describe(e), e);
            }
            String text = textOf(result);
            if (Boolean.TRUE.equals(result.isError())) {
                throw new ToolServerException("Tool [" + toolName + "] reported an error: " + text);
            }
            return text;
        }

        private Map<String, Object> readArguments(String argumentsJson) {
            if (!StringUtils.hasText(argumentsJson)) {
                return Map.of();
            }
            try {
                return objectMapper.readValue(argumentsJson, ARGUMENTS);
            } catch (JsonProcessingException e) {
                throw new ToolServerException("Invalid tool arguments: " + e.getOriginalMessage(), e);
            }
        }
    }

    static String textOf(McpSchema.CallToolResult result) {
        if (result.content() == null) {
            return "";
        }
        return result.content().stream()
                .filter(McpSchema.TextContent.class::isInstance)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"));
    }
}
