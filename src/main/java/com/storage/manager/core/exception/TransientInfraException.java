package com.storage.manager.core.exception;

/**
 * Infrastructure failure expected to clear on its own: the container runtime
 * is unreachable, or a mount is temporarily unreadable. Runs hitting it are
 * recorded as failed and retried on the next tick.
 */
public class TransientInfraException extends StorageManagerException {

    public TransientInfraException(String message) {
        super(message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
