package com.sgr.runtime.common.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Resolves secret references against the Spring environment, so a reference
 * such as {@code JIRA_TOKEN} is read from an environment variable or any
 * configured property source.
 */
@Service
@ConditionalOnProperty(name = "runtime.secrets.store", havingValue = "env", matchIfMissing = true)
public class EnvironmentSecretStore implements SecretStore {

    private final Environment environment;

    public EnvironmentSecretStore(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<String> fetch(String reference) {
        if (!StringUtils.hasText(reference)) {
            return Optional.empty();
        }
        String value = environment.getProperty(reference);
        return StringUtils.hasText(value) ? Optional.of(value) : Optional.empty();
    }
}
