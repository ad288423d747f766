package com.teachertraining.api.exception;

/**
 * A storage fault while fetching a single module by id. Reported to the
 * caller as a client error, like a malformed id on the same path.
 */
public class ModuleLookupException extends RuntimeException {
    public ModuleLookupException(String moduleId, StorageException cause) {
        super("Lookup of module " + moduleId + " failed: " + cause.getMessage(), cause);
    }
}
