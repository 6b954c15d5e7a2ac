package com.storage.manager.core.exception;

/**
 * Thrown for operations on an unknown registration key or an unknown volume.
 */
public class NotFoundException extends StorageManagerException {

    public NotFoundException(String message) {
        super(message);
    }
}
