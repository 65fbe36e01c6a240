package com.sgr.runtime.common.store;

import java.util.Optional;

/**
 * A remote source of instruction text.
 */
public interface PromptStore {

    String name();

    /**
     * @return the prompt text, or empty when the store does not know the key
     * @throws com.sgr.runtime.common.StoreUnavailableException when the store cannot be reached
     */
    Optional<String> fetch(String key);
}
