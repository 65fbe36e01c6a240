package com.sgr.runtime.common.service.tool;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import io.modelcontextprotocol.spec.McpSchema;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class McpToolSpecificationsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsListedToolSchema() throws Exception {
        McpSchema.Tool tool = objectMapper.readValue("""
                {"name": "search_issues", "description": "Searches issues",
                 "inputSchema": {"type": "object", "required": ["jql"], "properties": {
                    "jql": {"type": "string", "description": "Query"},
                    "limit": {"type": "integer"},
                    "order": {"type": "string", "enum": ["asc", "desc"]},
                    "labels": {"type": "array", "items": {"type": "string"}},
                    "filter": {"type": "object", "properties": {"owner": {"type": "string"}}}}}}
                """, McpSchema.Tool.class);

        ToolSpecification specification = McpToolSpecifications.from(tool, "fallback");
        JsonObjectSchema parameters = specification.parameters();

        assertEquals("search_issues", specification.name());
        assertEquals("Searches issues", specification.description());
        assertEquals(List.of("jql"), parameters.required());
        assertEquals("Query", ((JsonStringSchema) parameters.properties().get("jql")).description());
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("limit"));
        assertEquals(List.of("asc", "desc"), ((JsonEnumSchema) parameters.properties().get("order")).enumValues());
        assertInstanceOf(JsonStringSchema.class, ((JsonArraySchema) parameters.properties().get("labels")).items());
        assertTrue(((JsonObjectSchema) parameters.properties().get("filter")).properties().containsKey("owner"));
    }

    @Test
    void missingSchemaAndDescriptionFallBack() throws Exception {
        McpSchema.Tool tool = objectMapper.readValue("{\"name\": \"get_issue\"}", McpSchema.Tool.class);

        ToolSpecification specification = McpToolSpecifications.from(tool, "Tool provided by jira");

        assertEquals("Tool provided by jira", specification.description());
        assertTrue(specification.parameters().properties().isEmpty());
    }

    @Test
    void untypedPropertyDegradesToString() throws Exception {
        McpSchema.Tool tool = objectMapper.readValue("""
                {"name": "echo", "inputSchema": {"type": "object", "properties": {"value": {}}}}
                """, McpSchema.Tool.class);

        assertInstanceOf(JsonStringSchema.class,
                McpToolSpecifications.from(tool, "x").parameters().properties().get("value"));
    }
}
