package com.sgr.runtime.graph;

/**
 * A node of an execution graph. Nodes are immutable and shared by concurrent tasks.
 */
public interface GraphNode {

    /** Role name for leaves, a composite description otherwise. */
    String label();

    <R> R accept(GraphVisitor<R> visitor);
}
