package com.techtrends.news.store;

public enum StorageFailure {
    IO,                     // Database file unreadable, locked past the timeout, disk full
    CONSTRAINT_VIOLATION,   // A column constraint rejected the row
    CORRUPTION              // Malformed database image
}
