package com.techtrends.news.store;

/**
 * Storage operation failure. Fatal for the failing operation only.
 */
public class StorageException extends RuntimeException {

    private final StorageFailure failure;

    public StorageException(StorageFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public StorageFailure getFailure() {
        return failure;
    }
}
