package com.teachertraining.api.exception;

public class InvalidIdentifierException extends RuntimeException {
    public InvalidIdentifierException(String id) {
        super("'" + id + "' is not a valid ObjectId, it must be a 24-character hex string");
    }
}
