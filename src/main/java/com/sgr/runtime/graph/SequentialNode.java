package com.sgr.runtime.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Children run strictly in order, each one fed the previous output.
 */
public record SequentialNode(List<GraphNode> children) implements GraphNode {

    public SequentialNode {
        children = List.copyOf(children);
    }

    @Override
    public String label() {
        return children.stream().map(GraphNode::label).collect(Collectors.joining(" -> ", "sequential(", ")"));
    }

    @Override
    public <R> R accept(GraphVisitor<R> visitor) {
        return visitor.visitSequential(this);
    }
}
