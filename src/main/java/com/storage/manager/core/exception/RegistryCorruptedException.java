package com.storage.manager.core.exception;

/**
 * Fatal: the persisted registry could not be read at startup.
 * The process must refuse to start rather than run with a partial registry.
 */
public class RegistryCorruptedException extends StorageManagerException {

    public RegistryCorruptedException(String message) {
        super(message);
    }

    public RegistryCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
