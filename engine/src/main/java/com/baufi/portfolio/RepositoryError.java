package com.baufi.portfolio;

public enum RepositoryError {
    NOT_FOUND,
    SERIALIZATION_ERROR,
    /** Backing store unavailable or rejected the write. */
    STORAGE_ERROR,
    /** Stored snapshot no longer passes domain validation. */
    INVALID_DATA
}
