package com.sgr.runtime.common.service.tool;

import com.sgr.runtime.tools.FunctionTools;

import dev.langchain4j.agent.tool.ToolExecutionRequest;

import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinToolRegistryTest {

    private final BuiltinToolRegistry registry =
            new BuiltinToolRegistry(List.of(new FunctionTools(RestClient.builder())));

    @Test
    void registersAnnotatedMethodsByToolName() {
        assertEquals(Set.of("get_date_time", "search_knowledge_base", "http_request"), registry.names());
        assertTrue(registry.find("nope").isEmpty());
    }

    @Test
    void specificationDescribesParameters() {
        BuiltinToolRegistry.BuiltinTool search = registry.find("search_knowledge_base").orElseThrow();

        assertEquals(1, search.specification().parameters().properties().size());
        assertEquals(List.of(search.specification().parameters().properties().keySet().iterator().next()),
                search.specification().parameters().required());
    }

    @Test
    void executorInvokesTheMethod() {
        BuiltinToolRegistry.BuiltinTool search = registry.find("search_knowledge_base").orElseThrow();
        String argument = search.specification().parameters().properties().keySet().iterator().next();

        String result = search.executor().execute(ToolExecutionRequest.builder()
                .id("1")
                .name("search_knowledge_base")
                .arguments("{\"" + argument + "\": \"vpn\"}")
                .build(), "r1");

        assertTrue(result.contains("vpn"));
    }
}
