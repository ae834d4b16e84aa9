package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record. Never updated or deleted by the engine.
 */
@Value
@Builder
public class SecurityEvent {
    String id;
    String eventType;
    String userId;
    String resource;
    String action;
    boolean success;
    @Singular("detail")
    Map<String, Object> details;
    String sourceIp;
    Instant timestamp;
}
