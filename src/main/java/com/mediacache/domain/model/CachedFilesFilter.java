package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Listing filter for cached-file records. Every field is optional; values are bound as
 * query parameters, never spliced into SQL.
 */
@Value
@Builder
public class CachedFilesFilter {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;
    public static final int MAX_OFFSET = 100_000;

    String search;
    String addedBy;
    RecordState state;
    TriggerReason triggerReason;
    Long sizeMin;
    Long sizeMax;
    Instant createdSince;
    @Builder.Default
    int limit = DEFAULT_LIMIT;
    @Builder.Default
    int offset = 0;

    public static CachedFilesFilter all() {
        return CachedFilesFilter.builder().build();
    }
}
