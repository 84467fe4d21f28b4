package com.arkive.spi.exceptions;

public class DuplicateRecordException extends ArkiveException {

    public DuplicateRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
