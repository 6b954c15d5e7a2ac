package com.storage.manager.core.exception;

/**
 * Thrown when a registration is rejected at write time: unknown algorithm,
 * missing or malformed parameter, or a path escaping its volume root.
 */
public class ValidationException extends StorageManagerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
