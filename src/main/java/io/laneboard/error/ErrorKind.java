package io.laneboard.error;

public enum ErrorKind {
    NOT_FOUND,
    VALIDATION_ERROR,
    DEPENDENCY_UNRESOLVED,
    WIP_LIMIT_EXCEEDED,
    LOCK_TIMEOUT,
    CONFLICT_ON_WRITE;

    /**
     * Whether a caller may reasonably retry the same call unchanged.
     */
    public boolean retryable() {
        return this == LOCK_TIMEOUT || this == CONFLICT_ON_WRITE;
    }
}
