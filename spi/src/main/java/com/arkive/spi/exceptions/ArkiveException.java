package com.arkive.spi.exceptions;

/**
 * Root of every failure raised by the store and its components.
 */
public class ArkiveException extends RuntimeException {

    public ArkiveException(String message) {
        super(message);
    }

    public ArkiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
