package com.sgr.runtime.graph;

import java.util.List;

/**
 * A decision leaf that may call its workers as tools, any number of times.
 */
public record CoordinatorNode(LeafNode coordinator, List<LeafNode> workers) implements GraphNode {

    public CoordinatorNode {
        workers = List.copyOf(workers);
    }

    @Override
    public String label() {
        return "coordinator(" + coordinator.role() + ")";
    }

    @Override
    public <R> R accept(GraphVisitor<R> visitor) {
        return visitor.visitCoordinator(this);
    }
}
