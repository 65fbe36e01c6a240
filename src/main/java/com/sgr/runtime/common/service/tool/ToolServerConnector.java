package com.sgr.runtime.common.service.tool;

import java.util.Map;

/**
 * Opens sessions with external tool servers.
 */
public interface ToolServerConnector {

    /**
     * Connects to {@code serverReference}, sending {@code headers} with every request.
     *
     * @throws ToolServerException when the server is unreachable or the handshake fails
     */
    ToolServerConnection connect(String serverReference, Map<String, String> headers);
}
