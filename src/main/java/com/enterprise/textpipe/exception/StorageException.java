package com.enterprise.textpipe.exception;

/**
 * Exception thrown when an underlying storage operation fails
 */
public class StorageException extends TextPipeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
