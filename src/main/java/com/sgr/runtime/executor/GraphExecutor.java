package com.sgr.runtime.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sgr.runtime.graph.CoordinatorNode;
import com.sgr.runtime.graph.ExecutionGraph;
import com.sgr.runtime.graph.GraphNode;
import com.sgr.runtime.graph.GraphVisitor;
import com.sgr.runtime.graph.HubNode;
import com.sgr.runtime.graph.LeafNode;
import com.sgr.runtime.graph.ParallelNode;
import com.sgr.runtime.graph.SequentialNode;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes an {@link ExecutionGraph} against one input within a deadline.
 */
@Service
public class GraphExecutor {

    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final LeafInvoker leafInvoker;
    private final ExecutorService executorService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GraphExecutor(LeafInvoker leafInvoker,
            @Qualifier("graphExecutorService") ExecutorService executorService) {
        this.leafInvoker = leafInvoker;
        this.executorService = executorService;
    }

    public ExecutionResult execute(ExecutionGraph graph, String input, Duration timeout) {
        TaskContext context = new TaskContext(input, timeout);
        log.info("Task started on agent [{}] ({}), timeout {}s", graph.name(), graph.executionType().value(),
                timeout.toSeconds());

        Future<NodeOutput> root = context.register(executorService.submit(() -> run(graph.root(), input, context)));
        NodeOutput output;
        boolean deadlineExceeded = false;
        try {
            output = root.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            deadlineExceeded = true;
            output = expire(graph, context, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            deadlineExceeded = true;
            output = NodeOutput.failed(context.recordFailure(graph.root().label(), FailureKind.DEADLINE_EXCEEDED,
                    "Task interrupted"));
        } catch (CancellationException e) {
            deadlineExceeded = true;
            output = expire(graph, context, timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TaskCancelledException) {
                deadlineExceeded = true;
                output = expire(graph, context, timeout);
            } else {
                log.error("Task on agent [{}] crashed", graph.name(), e.getCause());
                output = NodeOutput.failed(context.recordFailure(graph.root().label(), FailureKind.PROVIDER_ERROR,
                        String.valueOf(e.getCause().getMessage())));
            }
        } finally {
            context.unregister(root);
        }

        TaskStatus status = status(context, output, deadlineExceeded);
        Duration duration = Duration.between(context.started(), Instant.now());
        log.info("Task finished on agent [{}]: {} in {} ms, {} failure(s)", graph.name(), status,
                duration.toMillis(), context.failures().size());
        return new ExecutionResult(status, output.text(), context.outputsSnapshot(), context.failures(),
                context.notes(), duration);
    }

    private NodeOutput expire(ExecutionGraph graph, TaskContext context, Duration timeout) {
        context.cancel();
        log.warn("Task on agent [{}] exceeded its deadline of {} ms", graph.name(), timeout.toMillis());
        return NodeOutput.failed(context.recordFailure(graph.root().label(), FailureKind.DEADLINE_EXCEEDED,
                "Deadline of " + timeout.toMillis() + " ms exceeded"));
    }

    static TaskStatus status(TaskContext context, NodeOutput output, boolean deadlineExceeded) {
        if (deadlineExceeded) {
            return TaskStatus.DEADLINE_EXCEEDED;
        }
        if (context.isRoutingNoMatch()) {
            return TaskStatus.ROUTING_NO_MATCH;
        }
        if (output.failed()) {
            return TaskStatus.FAILED;
        }
        return context.failures().isEmpty() ? TaskStatus.COMPLETED : TaskStatus.PARTIAL;
    }

    NodeOutput run(GraphNode node, String input, TaskContext context) {
        context.throwIfCancelled();
        return node.accept(new NodeRun(input, context));
    }

    private final class NodeRun implements GraphVisitor<NodeOutput> {

        private final String input;
        private final TaskContext context;

        NodeRun(String input, TaskContext context) {
            this.input = input;
            this.context = context;
        }

        @Override
        public NodeOutput visitLeaf(LeafNode node) {
            return leafInvoker.invoke(node, input, context);
        }

        @Override
        public NodeOutput visitSequential(SequentialNode node) {
            String current = input;
            NodeOutput last = NodeOutput.ok(current);
            List<GraphNode> children = node.children();
            for (int i = 0; i < children.size(); i++) {
                last = run(children.get(i), current, context);
                if (last.failed()) {
                    for (GraphNode skipped : children.subList(i + 1, children.size())) {
                        for (String role : roles(skipped)) {
                            context.recordFailure(role, FailureKind.DEPENDENCY_FAILED,
                                    "Upstream " + children.get(i).label() + " failed");
                        }
                    }
                    return last;
                }
                current = last.text();
            }
            return last;
        }

        @Override
        public NodeOutput visitParallel(ParallelNode node) {
            return fanOut(node.children(), input, context);
        }

        @Override
        public NodeOutput visitCoordinator(CoordinatorNode node) {
            List<WorkerCapability> workers = new ArrayList<>();
            for (LeafNode worker : node.workers()) {
                workers.add(new LeafWorker(worker));
            }
            return leafInvoker.invoke(node.coordinator(), input, context, workers);
        }

        @Override
        public NodeOutput visitHub(HubNode node) {
            Optional<String> target = HubRouter.route(node, input);
            if (target.isPresent()) {
                log.info("Hub [{}] routed input to spoke [{}]", node.hub().role(), target.get());
                return leafInvoker.invoke(node.spoke(target.get()).orElseThrow(), input, context);
            }
            switch (node.unmatchedPolicy()) {
                case BROADCAST:
                    log.info("Hub [{}]: no rule matched, broadcasting to {} spokes", node.hub().role(),
                            node.spokes().size());
                    context.recordNote("routing_no_match: hub [" + node.hub().role()
                            + "] matched no rule, broadcast to all spokes");
                    return fanOut(new ArrayList<GraphNode>(node.spokes()), input, context);
                case HUB:
                    log.info("Hub [{}]: no rule matched, answering directly", node.hub().role());
                    context.recordNote("routing_no_match: hub [" + node.hub().role()
                            + "] matched no rule, answered directly");
                    return leafInvoker.invoke(node.hub(), input, context);
                case NONE:
                default:
                    log.warn("Hub [{}]: no routing rule matched the input", node.hub().role());
                    context.markRoutingNoMatch();
                    return NodeOutput.failed(context.recordFailure(node.hub().role(), FailureKind.ROUTING_NO_MATCH,
                            "No routing rule matched the input"));
            }
        }
    }

    // All children start together; the join waits for every one of them.
    private NodeOutput fanOut(List<GraphNode> children, String input, TaskContext context) {
        List<Future<NodeOutput>> futures = new ArrayList<>();
        for (GraphNode child : children) {
            futures.add(context.register(executorService.submit(() -> run(child, input, context))));
        }

        StringBuilder combined = new StringBuilder();
        int failedChildren = 0;
        for (int i = 0; i < children.size(); i++) {
            GraphNode child = children.get(i);
            Future<NodeOutput> future = futures.get(i);
            NodeOutput output;
            try {
                output = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException("Interrupted while joining " + child.label());
            } catch (CancellationException e) {
                throw new TaskCancelledException("Branch " + child.label() + " cancelled");
            } catch (ExecutionException e) {
                if (e.getCause() instanceof TaskCancelledException) {
                    throw (TaskCancelledException) e.getCause();
                }
                log.error("Branch [{}] crashed", child.label(), e.getCause());
                output = NodeOutput.failed(context.recordFailure(child.label(), FailureKind.PROVIDER_ERROR,
                        String.valueOf(e.getCause().getMessage())));
            } finally {
                context.unregister(future);
            }
            if (output.failed()) {
                failedChildren++;
            }
            if (combined.length() > 0) {
                combined.append("\n\n");
            }
            combined.append("=== ").append(child.label()).append(" ===\n").append(output.text());
        }

        String text = combined.toString();
        return failedChildren == children.size() ? NodeOutput.failed(text) : NodeOutput.ok(text);
    }

    private final class LeafWorker implements WorkerCapability {

        private final LeafNode worker;

        LeafWorker(LeafNode worker) {
            this.worker = worker;
        }

        @Override
        public String name() {
            return worker.role();
        }

        @Override
        public ToolSpecification specification() {
            return ToolSpecification.builder()
                    .name(worker.role())
                    .description("Delegates a request to the '" + worker.role() + "' worker and returns its answer")
                    .parameters(JsonObjectSchema.builder()
                            .addStringProperty("request", "What the worker should do")
                            .required(List.of("request"))
                            .build())
                    .build();
        }

        @Override
        public String invoke(String request, TaskContext context) {
            log.info("Coordinator delegating to worker [{}]", worker.role());
            return leafInvoker.invoke(worker, requestText(request), context).text();
        }
    }

    private String requestText(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(arguments);
            if (node.hasNonNull("request")) {
                return node.get("request").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Worker arguments are not JSON, passing them through: {}", e.getOriginalMessage());
        }
        return arguments;
    }

    static List<String> roles(GraphNode node) {
        return node.accept(new GraphVisitor<List<String>>() {
            @Override
            public List<String> visitLeaf(LeafNode leaf) {
                return List.of(leaf.role());
            }

            @Override
            public List<String> visitSequential(SequentialNode sequential) {
                List<String> roles = new ArrayList<>();
                sequential.children().forEach(c -> roles.addAll(roles(c)));
                return roles;
            }

            @Override
            public List<String> visitParallel(ParallelNode parallel) {
                List<String> roles = new ArrayList<>();
                parallel.children().forEach(c -> roles.addAll(roles(c)));
                return roles;
            }

            @Override
            public List<String> visitCoordinator(CoordinatorNode coordinator) {
                return List.of(coordinator.coordinator().role());
            }

            @Override
            public List<String> visitHub(HubNode hub) {
                return List.of(hub.hub().role());
            }
        });
    }
}
