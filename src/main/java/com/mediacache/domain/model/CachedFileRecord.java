package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One row per file known to the cache.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code originalPath} and {@code cachedPath} are canonical, allow-listed and distinct</li>
 *   <li>{@code sizeBytes} lies in {@code [0, MAX_SIZE_BYTES]}</li>
 *   <li>At most one live (PENDING or COMMITTED) record exists per {@code originalPath}</li>
 *   <li>{@code checksum} is the HMAC of the canonical fields; only {@code lastVerifiedAt}
 *       may change without recomputing it</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class CachedFileRecord {

    public static final long MAX_SIZE_BYTES = 1_000_000_000_000L;

    String id;
    Path originalPath;
    Path cachedPath;
    String filename;
    RelocationMethod method;
    long sizeBytes;
    String checksum;
    RecordState state;
    TriggerReason triggerReason;
    String addedBy;
    Instant createdAt;
    Instant updatedAt;
    Instant lastVerifiedAt;
    String failureReason;

    /**
     * Checks the structural invariants that do not need the filesystem.
     *
     * @throws IllegalArgumentException when one is violated
     */
    public CachedFileRecord checkInvariants() {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(originalPath, "originalPath");
        Objects.requireNonNull(cachedPath, "cachedPath");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(state, "state");
        if (originalPath.equals(cachedPath)) {
            throw new IllegalArgumentException("originalPath and cachedPath must differ: " + originalPath);
        }
        if (sizeBytes < 0 || sizeBytes > MAX_SIZE_BYTES) {
            throw new IllegalArgumentException("sizeBytes out of range: " + sizeBytes);
        }
        return this;
    }

    public boolean isLive() {
        return state != null && state.isLive();
    }
}
