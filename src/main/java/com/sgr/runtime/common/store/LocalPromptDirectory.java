package com.sgr.runtime.common.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Last link of the prompt chain: plain-text files keyed by role name,
 * {@code <role>.txt}, then {@code <role>.md}, then {@code default.txt}.
 */
@Component
public class LocalPromptDirectory {

    private static final Logger log = LoggerFactory.getLogger(LocalPromptDirectory.class);

    private final Path directory;

    public LocalPromptDirectory(@Value("${runtime.prompts.directory:prompts}") String directory) {
        this(Paths.get(directory));
    }

    public LocalPromptDirectory(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    public Optional<LocalPrompt> read(String roleName) {
        for (String fileName : List.of(roleName + ".txt", roleName + ".md", "default.txt")) {
            Path file = directory.resolve(fileName).normalize();
            if (!file.startsWith(directory) || !Files.isRegularFile(file)) {
                continue;
            }
            try {
                String content = Files.readString(file).strip();
                if (!content.isEmpty()) {
                    return Optional.of(new LocalPrompt(fileName, content));
                }
            } catch (IOException e) {
                log.warn("Could not read prompt file {}: {}", file, e.getMessage());
            }
        }
        return Optional.empty();
    }

    public Path getDirectory() {
        return directory;
    }

    public record LocalPrompt(String fileName, String text) {
    }
}
