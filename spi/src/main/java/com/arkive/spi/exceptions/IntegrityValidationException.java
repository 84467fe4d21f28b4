package com.arkive.spi.exceptions;

import lombok.Getter;

/**
 * A structural or cryptographic integrity check failed. Never corrected automatically.
 */
@Getter
public class IntegrityValidationException extends ArkiveException {

    private final ValidationFailure failure;

    public IntegrityValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public IntegrityValidationException(ValidationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
