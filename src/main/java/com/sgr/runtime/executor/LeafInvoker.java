package com.sgr.runtime.executor;

import com.sgr.runtime.common.AgentExecutionException;
import com.sgr.runtime.common.service.ChatModelProvider;
import com.sgr.runtime.common.service.tool.ToolBinding;
import com.sgr.runtime.graph.LeafNode;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one leaf: a model call with the role's instructions, repeated while the
 * model asks for tools, up to the leaf's turn limit.
 */
@Component
public class LeafInvoker {

    private static final Logger log = LoggerFactory.getLogger(LeafInvoker.class);

    private final ChatModelProvider models;
    private final ExecutorService executorService;
    private final int providerAttempts;
    private final long retryBackoffMs;

    public LeafInvoker(ChatModelProvider models,
            @Qualifier("graphExecutorService") ExecutorService executorService,
            @Value("${runtime.executor.provider-attempts:2}") int providerAttempts,
            @Value("${runtime.executor.retry-backoff-ms:500}") long retryBackoffMs) {
        this.models = models;
        this.executorService = executorService;
        this.providerAttempts = Math.max(1, providerAttempts);
        this.retryBackoffMs = retryBackoffMs;
    }

    public NodeOutput invoke(LeafNode leaf, String input, TaskContext context) {
        return invoke(leaf, input, context, List.of());
    }

    /**
     * @param workers capabilities offered to the model next to the leaf's own tools
     */
    public NodeOutput invoke(LeafNode leaf, String input, TaskContext context, List<WorkerCapability> workers) {
        Map<String, ToolCall> tools = new LinkedHashMap<>();
        List<ToolSpecification> specifications = new ArrayList<>();
        for (ToolBinding binding : leaf.tools()) {
            tools.put(binding.name(), request -> binding.executor().execute(request, leaf.role()));
            specifications.add(binding.specification());
        }
        for (WorkerCapability worker : workers) {
            tools.put(worker.name(), request -> worker.invoke(request.arguments(), context));
            specifications.add(worker.specification());
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(leaf.instructions()));
        messages.add(UserMessage.from(leaf.userMessage(input)));

        ChatModel model;
        try {
            model = models.getModel(leaf.model());
        } catch (RuntimeException e) {
            log.error("Role [{}] has no usable model: {}", leaf.role(), e.getMessage());
            return NodeOutput.failed(context.recordFailure(leaf.role(), FailureKind.PROVIDER_ERROR, e.getMessage()));
        }

        log.debug("Role [{}] started", leaf.role());
        for (int turn = 1; turn <= leaf.maxTurns(); turn++) {
            context.throwIfCancelled();

            ChatRequest.Builder request = ChatRequest.builder().messages(messages);
            if (!specifications.isEmpty()) {
                request.toolSpecifications(specifications);
            }

            AiMessage reply;
            try {
                reply = chatWithRetry(model, request.build(), leaf.role(), context).aiMessage();
            } catch (AgentExecutionException e) {
                return NodeOutput.failed(context.recordFailure(leaf.role(), FailureKind.PROVIDER_ERROR,
                        "HTTP " + e.getStatusCode() + ": " + e.getMessage()));
            }
            messages.add(reply);

            if (!reply.hasToolExecutionRequests()) {
                String text = cleanMarkdown(reply.text());
                context.recordOutput(leaf.role(), text);
                log.debug("Role [{}] finished after {} turn(s)", leaf.role(), turn);
                return NodeOutput.ok(text);
            }
            messages.addAll(runTools(leaf.role(), reply.toolExecutionRequests(), tools, context));
        }

        log.warn("Role [{}] hit max_turns={} without a final answer", leaf.role(), leaf.maxTurns());
        return NodeOutput.failed(context.recordFailure(leaf.role(), FailureKind.MAX_TURNS_EXCEEDED,
                "No final answer within " + leaf.maxTurns() + " turns"));
    }

    // Calls from one model turn run concurrently; results keep request order.
    private List<ToolExecutionResultMessage> runTools(String role, List<ToolExecutionRequest> requests,
            Map<String, ToolCall> tools, TaskContext context) {
        List<ToolExecutionResultMessage> results = new ArrayList<>();
        if (requests.size() == 1) {
            ToolExecutionRequest request = requests.get(0);
            results.add(ToolExecutionResultMessage.from(request, runTool(role, request, tools, context)));
            return results;
        }

        List<Future<String>> futures = new ArrayList<>();
        for (ToolExecutionRequest request : requests) {
            futures.add(context.register(executorService.submit(() -> runTool(role, request, tools, context))));
        }
        for (int i = 0; i < requests.size(); i++) {
            Future<String> future = futures.get(i);
            String text;
            try {
                text = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException("Interrupted while waiting for tools of role " + role);
            } catch (CancellationException e) {
                throw new TaskCancelledException("Tool call cancelled for role " + role);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof TaskCancelledException) {
                    throw (TaskCancelledException) e.getCause();
                }
                text = "Error: " + e.getCause().getMessage();
            } finally {
                context.unregister(future);
            }
            results.add(ToolExecutionResultMessage.from(requests.get(i), text));
        }
        return results;
    }

    private String runTool(String role, ToolExecutionRequest request, Map<String, ToolCall> tools,
            TaskContext context) {
        context.throwIfCancelled();
        ToolCall tool = tools.get(request.name());
        if (tool == null) {
            context.recordFailure(role + "/" + request.name(), FailureKind.TOOL_EXECUTION_ERROR, "Unknown tool");
            return "Error: unknown tool '" + request.name() + "'";
        }
        try {
            String result = tool.call(request);
            return result == null ? "" : result;
        } catch (TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Role [{}]: tool [{}] failed: {}", role, request.name(), e.getMessage());
            context.recordFailure(role + "/" + request.name(), FailureKind.TOOL_EXECUTION_ERROR,
                    String.valueOf(e.getMessage()));
            return "Error: tool '" + request.name() + "' failed: " + e.getMessage();
        }
    }

    private ChatResponse chatWithRetry(ChatModel model, ChatRequest request, String role, TaskContext context) {
        AgentExecutionException last = null;
        for (int attempt = 1; attempt <= providerAttempts; attempt++) {
            context.throwIfCancelled();
            try {
                return model.chat(request);
            } catch (RuntimeException e) {
                if (context.isCancelled() || Thread.currentThread().isInterrupted()) {
                    throw new TaskCancelledException("Model call for role " + role + " cancelled");
                }
                last = mapProviderError(role, e);
                if (!last.isRetryable() || attempt == providerAttempts) {
                    break;
                }
                log.warn("Role [{}] attempt {}/{} failed, retrying: {}", role, attempt, providerAttempts,
                        last.getMessage());
                pause(retryBackoffMs * attempt, role);
            }
        }
        throw last;
    }

    /**
     * Maps provider failures onto status codes the way the model factory's
     * callers expect them.
     */
    static AgentExecutionException mapProviderError(String role, RuntimeException e) {
        HttpException http = findCause(e, HttpException.class);
        if (http != null) {
            int code = http.statusCode();
            String errorMsg;
            boolean retryable = false;

            switch (code) {
                case 404:
                    errorMsg = "Model not found. Check config (provider/model name).";
                    break;
                case 408:
                    errorMsg = "AI didn't respond in time.";
                    retryable = true;
                    break;
                case 429:
                    errorMsg = "Rate limit exceeded (Quota full).";
                    retryable = true;
                    break;
                case 401:
                    errorMsg = "Invalid API Key. Contact Administrator.";
                    break;
                case 500:
                case 503:
                    errorMsg = "AI Provider is currently down.";
                    retryable = true;
                    break;
                default:
                    errorMsg = "AI Provider Error: " + http.getMessage();
            }

            log.error("Role [{}] failed with HTTP {}: {}", role, code, errorMsg);
            return new AgentExecutionException(errorMsg, code, retryable, e);
        }

        if (findCause(e, SocketTimeoutException.class) != null) {
            log.error("Role [{}] timed out.", role);
            return new AgentExecutionException("AI didn't respond in time.", 408, true, e);
        }

        log.error("Role [{}] crashed unexpectedly.", role, e);
        return new AgentExecutionException("Internal Agent Error: " + e.getMessage(), 500, false, e);
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private void pause(long millis, String role) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while retrying role " + role);
        }
    }

    /**
     * Removes ```json ... ``` wrapper from model output.
     */
    static String cleanMarkdown(String text) {
        if (text == null)
            return "";
        String trimmed = text.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            return trimmed.replaceFirst("^```[a-zA-Z]*", "").replaceFirst("```$", "").trim();
        }
        return trimmed;
    }

    @FunctionalInterface
    private interface ToolCall {
        String call(ToolExecutionRequest request);
    }
}
