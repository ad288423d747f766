package com.teachertraining.api.exception;

/**
 * Any failure reaching or operating on MongoDB. The message is cut to a
 * short diagnostic so driver internals do not end up in responses.
 */
public class StorageException extends RuntimeException {

    public StorageException(String operation, String collection, Throwable cause, int maxDetailLength) {
        super(truncate(operation + " on '" + collection + "' failed: " + cause.getMessage(), maxDetailLength), cause);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    static String truncate(String message, int maxLength) {
        if (message == null || maxLength <= 0 || message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }
}
