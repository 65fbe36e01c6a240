package com.sgr.runtime.common.store;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.RuntimeConfigException.Reason;
import com.sgr.runtime.common.config.RuntimeConfig;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileConfigStoreTest {

    @TempDir
    Path basePath;

    @Test
    void readsYamlAndDefaultsNameToAgentId() throws IOException {
        Files.createDirectories(basePath.resolve("agents"));
        Files.writeString(basePath.resolve("agents/helper.yaml"), """
                execution_type: single
                roles:
                  - name: main
                    prompt_inline: Help.
                """);

        RuntimeConfig config = new FileConfigStore(basePath.toString()).fetch("helper");

        assertEquals("helper", config.name());
        assertEquals("main", config.roles().get(0).name());
    }

    @Test
    void missingFileIsNotFound() {
        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> new FileConfigStore(basePath.toString()).fetch("nobody"));

        assertEquals(Reason.CONFIG_NOT_FOUND, e.getReason());
    }

    @Test
    void pathTraversalIsRejected() {
        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> new FileConfigStore(basePath.toString()).fetch("../secrets"));

        assertEquals(Reason.CONFIG_NOT_FOUND, e.getReason());
    }

    @Test
    void malformedYamlIsInvalidConfig() throws IOException {
        Files.createDirectories(basePath.resolve("agents"));
        Files.writeString(basePath.resolve("agents/broken.yaml"), "roles: [unclosed");

        RuntimeConfigException e = assertThrows(RuntimeConfigException.class,
                () -> new FileConfigStore(basePath.toString()).fetch("broken"));

        assertEquals(Reason.INVALID_CONFIG, e.getReason());
    }
}
