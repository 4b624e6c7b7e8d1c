package com.infra.whatif.controller;

/**
 * Request rejected because of one named field.
 */
public class InvalidRequestFieldException extends IllegalArgumentException {

    private final String field;

    public InvalidRequestFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
