package com.faceregistry.exception;

/**
 * Internal contract violation inside the registry. The request that hit it made no changes and
 * may be retried by the caller.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public boolean isRetryable() {
        return true;
    }
}
