package com.sgr.runtime.graph;

import com.sgr.runtime.common.service.ModelSpec;
import com.sgr.runtime.common.service.tool.ToolBinding;

import java.util.List;

/**
 * One role-bound model invocation.
 *
 * @param inputPreamble text placed before the incoming message, or null
 */
public record LeafNode(
        String role,
        ModelSpec model,
        String instructions,
        int maxTurns,
        List<ToolBinding> tools,
        String inputPreamble) implements GraphNode {

    public LeafNode {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public LeafNode withInputPreamble(String preamble) {
        return new LeafNode(role, model, instructions, maxTurns, tools, preamble);
    }

    public String userMessage(String input) {
        return inputPreamble == null ? input : inputPreamble + "\n\n" + input;
    }

    @Override
    public String label() {
        return role;
    }

    @Override
    public <R> R accept(GraphVisitor<R> visitor) {
        return visitor.visitLeaf(this);
    }
}
