package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SecurityEventFilter {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    String eventType;
    String userId;
    Boolean success;
    Instant since;
    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public static SecurityEventFilter all() {
        return SecurityEventFilter.builder().build();
    }
}
