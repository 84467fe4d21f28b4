package com.arkive.spi.exceptions;

import lombok.Getter;

/**
 * The store stayed busy or locked for the whole retry budget. Callers may retry at a higher level.
 */
@Getter
public class ContentionException extends StorageException {

    private final int attempts;

    public ContentionException(int attempts, Throwable cause) {
        super("store still busy after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }
}
