package com.storage.manager.core.exception;

/**
 * Base type for all storage manager failures.
 * Subclasses encode how a failure propagates: synchronously to the caller,
 * into a cleanup result, or as a refusal to start.
 */
public abstract class StorageManagerException extends RuntimeException {

    protected StorageManagerException(String message) {
        super(message);
    }

    protected StorageManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
