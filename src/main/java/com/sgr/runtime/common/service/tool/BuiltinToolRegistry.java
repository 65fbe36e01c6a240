package com.sgr.runtime.common.service.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sgr.runtime.tools.BuiltinToolSet;

import dev.langchain4j.agent.tool.Tool;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.agent.tool.ToolSpecifications;
import dev.langchain4j.service.tool.ToolExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide table of statically available tools, built once from the
 * {@link Tool} methods of every {@link BuiltinToolSet} bean and read-only afterwards.
 * <p>
 * Executors invoke the method directly and rethrow whatever it throws, so a
 * failing builtin surfaces as a tool failure instead of as result text.
 */
@Component
public class BuiltinToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(BuiltinToolRegistry.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, BuiltinTool> tools;

    public BuiltinToolRegistry(List<BuiltinToolSet> toolSets) {
        Map<String, BuiltinTool> found = new LinkedHashMap<>();
        for (BuiltinToolSet toolSet : toolSets) {
            for (Method method : toolSet.getClass().getMethods()) {
                if (!method.isAnnotationPresent(Tool.class)) {
                    continue;
                }
                ToolSpecification specification = ToolSpecifications.toolSpecificationFrom(method);
                if (found.containsKey(specification.name())) {
                    throw new IllegalStateException("Duplicate builtin tool name: " + specification.name());
                }
                found.put(specification.name(),
                        new BuiltinTool(specification, new MethodToolExecutor(toolSet, method, specification)));
            }
        }
        this.tools = Collections.unmodifiableMap(found);
        log.info("Registered builtin tools: {}", tools.keySet());
    }

    public Optional<BuiltinTool> find(String id) {
        return Optional.ofNullable(tools.get(id));
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public record BuiltinTool(ToolSpecification specification, ToolExecutor executor) {
    }

    /**
     * Binds JSON arguments to the method's parameters by position, in the
     * order the specification lists its properties.
     */
    static final class MethodToolExecutor implements ToolExecutor {

        private final Object target;
        private final Method method;
        private final List<String> argumentNames;

        MethodToolExecutor(Object target, Method method, ToolSpecification specification) {
            this.target = target;
            this.method = method;
            this.argumentNames = specification.parameters() == null
                    ? List.of()
                    : new ArrayList<>(specification.parameters().properties().keySet());
        }

        @Override
        public String execute(ToolExecutionRequest request, Object memoryId) {
            Object[] arguments = bind(request.arguments());
            Object result;
            try {
                result = method.invoke(target, arguments);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException(String.valueOf(cause.getMessage()), cause);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Tool method not accessible: " + method.getName(), e);
            }
            return result == null ? "" : result.toString();
        }

        private Object[] bind(String argumentsJson) {
            JsonNode node;
            try {
                node = StringUtils.hasText(argumentsJson) ? objectMapper.readTree(argumentsJson)
                        : objectMapper.createObjectNode();
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid tool arguments: " + e.getOriginalMessage(), e);
            }

            Class<?>[] types = method.getParameterTypes();
            Object[] arguments = new Object[types.length];
            for (int i = 0; i < types.length; i++) {
                JsonNode value = i < argumentNames.size() ? node.get(argumentNames.get(i)) : null;
                arguments[i] = value == null || value.isNull() ? null : convert(value, types[i]);
            }
            return arguments;
        }

        private static Object convert(JsonNode value, Class<?> type) {
            // models sometimes send an object where a JSON string body is expected
            if (type == String.class && !value.isValueNode()) {
                return value.toString();
            }
            return objectMapper.convertValue(value, type);
        }
    }
}
