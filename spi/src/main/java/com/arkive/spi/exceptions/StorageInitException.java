package com.arkive.spi.exceptions;

/**
 * The store could not be opened or its schema could not be created. Fatal to startup.
 */
public class StorageInitException extends ArkiveException {

    public StorageInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
