package com.teachertraining.api.repository;

/**
 * MongoDB collection names. Each is the lowercase name of the record it holds.
 */
public final class CollectionNames {

    public static final String MODULE = "module";
    public static final String PROGRESS = "progress";
    public static final String NOTE = "note";

    private CollectionNames() {
    }
}
