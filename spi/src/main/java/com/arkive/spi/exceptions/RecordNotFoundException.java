package com.arkive.spi.exceptions;

public class RecordNotFoundException extends ArkiveException {

    public RecordNotFoundException(String type, String id) {
        super(type + " not found: " + id);
    }
}
