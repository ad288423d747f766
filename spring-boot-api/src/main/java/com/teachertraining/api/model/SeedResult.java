package com.teachertraining.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of POST /api/seed: either {@code inserted} or {@code message} + {@code count}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeedResult(String status, Integer inserted, String message, Long count) {

    public static SeedResult inserted(int inserted) {
        return new SeedResult("ok", inserted, null, null);
    }

    public static SeedResult alreadySeeded(long count) {
        return new SeedResult("ok", null, "Modules already exist", count);
    }
}
