package com.arkive.spi.exceptions;

/**
 * An audit entry could not be committed. Nothing was recorded; the caller may re-attempt the append.
 */
public class AuditWriteException extends ArkiveException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
