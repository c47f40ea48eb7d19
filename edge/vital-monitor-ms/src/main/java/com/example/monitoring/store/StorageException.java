package com.example.monitoring.store;

/** A local persistence operation failed; the caller decides whether to retry. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
