package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable caller identity for a single request.
 *
 * <p>Built per call from the external authentication source and never stored. The
 * effective permission set is derived from the role at construction time.
 */
@Value
public class UserContext {

    /** Identity used for the scheduler's own passes. */
    public static final String SYSTEM_USER = "system";

    UUID requestId;
    String userId;
    Role role;
    Set<Permission> permissions;
    String sourceIp;
    Instant requestedAt;

    @Builder
    private UserContext(UUID requestId, String userId, Role role, String sourceIp, Instant requestedAt) {
        this.requestId = requestId != null ? requestId : UUID.randomUUID();
        this.userId = userId;
        this.role = role;
        this.permissions = role != null
            ? Collections.unmodifiableSet(EnumSet.copyOf(role.getPermissions()))
            : Collections.emptySet();
        this.sourceIp = sourceIp;
        this.requestedAt = requestedAt != null ? requestedAt : Instant.now();
    }

    public static UserContext of(String userId, Role role) {
        return UserContext.builder().userId(userId).role(role).build();
    }

    public static UserContext system() {
        return of(SYSTEM_USER, Role.ADMIN);
    }
}
