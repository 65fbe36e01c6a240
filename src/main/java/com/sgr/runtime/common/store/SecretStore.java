package com.sgr.runtime.common.store;

import java.util.Optional;

public interface SecretStore {

    /**
     * @return the secret value, or empty when the reference is unknown
     * @throws com.sgr.runtime.common.StoreUnavailableException when the store is unreachable or denies access
     */
    Optional<String> fetch(String reference);
}
