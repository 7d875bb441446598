package com.calaccess.filings.service;

/**
 * A required field was absent; raised before anything is persisted.
 */
public class MissingFieldException extends IllegalArgumentException {

    private final String field;

    public MissingFieldException(String field) {
        super(field + " is required");
        this.field = field;
    }

    public String getField() {
        return field;
    }

    static <T> T require(T value, String field) {
        if (value == null) {
            throw new MissingFieldException(field);
        }
        return value;
    }
}
