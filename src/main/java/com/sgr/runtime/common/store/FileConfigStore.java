package com.sgr.runtime.common.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.config.RuntimeConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads agent configuration from {@code <base-path>/agents/<agentId>.yaml}.
 * Used for local development and tests instead of the registry.
 */
@Service
@ConditionalOnProperty(name = "runtime.config-store", havingValue = "file")
public class FileConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(FileConfigStore.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final Path agentsDirectory;

    public FileConfigStore(@Value("${runtime.base-path}") String basePath) {
        this.agentsDirectory = Paths.get(basePath, "agents").toAbsolutePath().normalize();
    }

    @Override
    public RuntimeConfig fetch(String agentId) {
        Path file = agentsDirectory.resolve(agentId + ".yaml").normalize();
        if (!file.startsWith(agentsDirectory)) {
            throw new RuntimeConfigException(Reason.CONFIG_NOT_FOUND, "Invalid agent id: " + agentId);
        }
        if (!Files.isRegularFile(file)) {
            throw new RuntimeConfigException(Reason.CONFIG_NOT_FOUND, "No config file for agent: " + file);
        }

        try {
            RuntimeConfig config = yamlMapper.readValue(file.toFile(), RuntimeConfig.class);
            log.info("Loaded runtime config for agent [{}] from {}", agentId, file);
            return config.withDisplayInfo(agentId, "");
        } catch (IOException e) {
            log.error("Invalid runtime config YAML: " + file, e);
            throw new RuntimeConfigException(Reason.INVALID_CONFIG, "Unreadable config for agent: " + agentId, e);
        }
    }
}
