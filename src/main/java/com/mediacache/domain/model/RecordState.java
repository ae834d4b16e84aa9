package com.mediacache.domain.model;

/**
 * Lifecycle of a {@link CachedFileRecord}.
 *
 * <p>PENDING while a relocation is in flight, COMMITTED once both the filesystem
 * operation and the database write succeeded, FAILED when the operation was rolled back,
 * REMOVED once the cache copy has been reclaimed.
 */
public enum RecordState {
    PENDING,
    COMMITTED,
    FAILED,
    REMOVED;

    public boolean isLive() {
        return this == PENDING || this == COMMITTED;
    }
}
