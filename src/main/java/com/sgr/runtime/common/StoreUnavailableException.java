package com.sgr.runtime.common;

/**
 * An external store (registry, prompt management, secret store) could not be
 * reached or refused the request. Distinct from "not found", which stores
 * report as an empty result.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String store;

    public StoreUnavailableException(String store, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
    }

    public StoreUnavailableException(String store, String message) {
        this(store, message, null);
    }

    public String getStore() {
        return store;
    }
}
