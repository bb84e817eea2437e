package com.userstore.storage;

/**
 * An insert, update or delete statement failed in the backend.
 */
public class StorageWriteException extends RuntimeException {

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
