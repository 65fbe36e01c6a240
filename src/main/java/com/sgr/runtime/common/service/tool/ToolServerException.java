package com.sgr.runtime.common.service.tool;

/**
 * A tool server could not be reached, or answered with a protocol error.
 */
public class ToolServerException extends RuntimeException {

    public ToolServerException(String message) {
        super(message);
    }

    public ToolServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
