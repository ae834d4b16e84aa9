package com.mediacache.application;

/**
 * Filesystem state of a record as observed by the integrity pass.
 */
public enum PathStatus {
    /** Filesystem matches the record. */
    OK,
    /** Record state has no filesystem expectation (FAILED, REMOVED). */
    NOT_CHECKED,
    CACHE_MISSING,
    ORIGIN_MISSING,
    /** Original is a symlink that does not point at the cached path. */
    LINK_BROKEN,
    /** Original no longer has the shape the relocation method left behind. */
    DIVERGED,
    SIZE_MISMATCH,
    /** PENDING with no relocation in flight, typically left by a crash before commit. */
    STALE_PENDING;

    public boolean isConsistent() {
        return this == OK || this == NOT_CHECKED;
    }
}
