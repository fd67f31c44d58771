package com.enterprise.textpipe.exception;

/**
 * Base exception for queue related errors.
 * Unchecked so lazy claim sequences and bulk helpers can propagate it.
 */
public class TextPipeException extends RuntimeException {

    public TextPipeException(String message) {
        super(message);
    }

    public TextPipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
