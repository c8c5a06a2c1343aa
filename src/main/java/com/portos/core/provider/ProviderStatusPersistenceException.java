package com.portos.core.provider;

/**
 * Thrown when the provider status snapshot cannot be written.
 */
public class ProviderStatusPersistenceException extends RuntimeException {

    public ProviderStatusPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
