package com.arkive.spi.exceptions;

/**
 * A store operation failed. Plain instances are never retried; {@link ContentionException} marks failures
 * that were retried until the retry budget ran out.
 */
public class StorageException extends ArkiveException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
