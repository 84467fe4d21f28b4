package com.arkive.spi.exceptions;

/**
 * A backup archive could not be written or read back because of an I/O or archive format failure.
 */
public class BackupException extends ArkiveException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
