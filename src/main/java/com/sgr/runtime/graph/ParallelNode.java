package com.sgr.runtime.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Children run concurrently on the same input; outputs are combined in child order.
 */
public record ParallelNode(List<GraphNode> children) implements GraphNode {

    public ParallelNode {
        children = List.copyOf(children);
    }

    @Override
    public String label() {
        return children.stream().map(GraphNode::label).collect(Collectors.joining(", ", "parallel(", ")"));
    }

    @Override
    public <R> R accept(GraphVisitor<R> visitor) {
        return visitor.visitParallel(this);
    }
}
