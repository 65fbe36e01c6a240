package com.sgr.runtime.tools;

/**
 * Marker for beans whose {@link dev.langchain4j.agent.tool.Tool} methods are
 * registered as builtin tools at startup.
 */
public interface BuiltinToolSet {
}
