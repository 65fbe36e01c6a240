package com.sgr.runtime.common.service.tool;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import io.modelcontextprotocol.spec.McpSchema;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Maps tools listed by an MCP server onto langchain4j tool specifications.
 * Unknown or missing property types degrade to string.
 */
final class McpToolSpecifications {

    private McpToolSpecifications() {
    }

    static ToolSpecification from(McpSchema.Tool tool, String fallbackDescription) {
        return ToolSpecification.builder()
                .name(tool.name())
                .description(tool.description() != null ? tool.description() : fallbackDescription)
                .parameters(parameters(tool.inputSchema()))
                .build();
    }

    static JsonObjectSchema parameters(McpSchema.JsonSchema inputSchema) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (inputSchema == null) {
            return builder.build();
        }
        addProperties(builder, inputSchema.properties());
        if (inputSchema.required() != null && !inputSchema.required().isEmpty()) {
            builder.required(inputSchema.required());
        }
        return builder.build();
    }

    private static void addProperties(JsonObjectSchema.Builder builder, Map<String, Object> properties) {
        if (properties == null) {
            return;
        }
        properties.forEach((name, schema) -> builder.addProperty(name, element(schema)));
    }

    @SuppressWarnings("unchecked")
    private static JsonSchemaElement element(Object schema) {
        if (!(schema instanceof Map)) {
            return JsonStringSchema.builder().build();
        }
        Map<String, Object> node = (Map<String, Object>) schema;
        String description = node.get("description") instanceof String ? (String) node.get("description") : null;

        if (node.get("enum") instanceof Collection) {
            List<String> values = ((Collection<Object>) node.get("enum")).stream().map(String::valueOf).toList();
            return JsonEnumSchema.builder().enumValues(values).description(description).build();
        }
        String type = node.get("type") instanceof String ? (String) node.get("type") : "string";
        switch (type) {
            case "integer":
                return JsonIntegerSchema.builder().description(description).build();
            case "number":
                return JsonNumberSchema.builder().description(description).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            case "array":
                return JsonArraySchema.builder().description(description).items(element(node.get("items"))).build();
            case "object":
                JsonObjectSchema.Builder object = JsonObjectSchema.builder().description(description);
                if (node.get("properties") instanceof Map) {
                    addProperties(object, (Map<String, Object>) node.get("properties"));
                }
                if (node.get("required") instanceof Collection) {
                    object.required(((Collection<Object>) node.get("required")).stream().map(String::valueOf).toList());
                }
                return object.build();
            default:
                return JsonStringSchema.builder().description(description).build();
        }
    }
}
