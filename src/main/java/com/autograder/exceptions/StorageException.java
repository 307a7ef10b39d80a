package com.autograder.exceptions;

/**
 * Blob storage read/write failure
 */
public class StorageException extends AutograderException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
