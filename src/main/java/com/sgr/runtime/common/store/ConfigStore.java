package com.sgr.runtime.common.store;

import com.sgr.runtime.common.config.RuntimeConfig;

/**
 * Serves the runtime configuration of one agent identifier.
 * Implementations throw {@link com.sgr.runtime.common.RuntimeConfigException}
 * with {@code CONFIG_NOT_FOUND} or {@code CONFIG_UNREACHABLE}.
 */
public interface ConfigStore {

    RuntimeConfig fetch(String agentId);
}
