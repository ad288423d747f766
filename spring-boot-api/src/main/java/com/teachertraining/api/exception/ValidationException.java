package com.teachertraining.api.exception;

import lombok.Getter;

/**
 * Input rejected before any store access, for checks Bean Validation does not cover.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
