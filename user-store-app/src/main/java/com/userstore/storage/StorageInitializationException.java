package com.userstore.storage;

/**
 * The storage location could not be opened or the users table could not be created.
 */
public class StorageInitializationException extends RuntimeException {

    public StorageInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
