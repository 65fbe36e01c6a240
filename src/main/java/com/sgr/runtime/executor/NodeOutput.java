package com.sgr.runtime.executor;

/**
 * Output of one node. A failed node still carries text: its failure marker.
 */
public record NodeOutput(String text, boolean failed) {

    public static NodeOutput ok(String text) {
        return new NodeOutput(text == null ? "" : text, false);
    }

    public static NodeOutput failed(String marker) {
        return new NodeOutput(marker, true);
    }
}
