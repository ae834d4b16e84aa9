package com.mediacache.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Caller roles and the fixed permission set each one carries.
 *
 * <p>Roles never inherit from one another; the table below is the complete policy.
 * <ul>
 *   <li>{@code ADMIN}: every permission, including audit-log read and orphan cleanup</li>
 *   <li>{@code USER}: read and write (request caching)</li>
 *   <li>{@code PUBLIC}: read only (status, listing, statistics)</li>
 * </ul>
 */
public enum Role {
    ADMIN(EnumSet.allOf(Permission.class)),
    USER(EnumSet.of(Permission.READ, Permission.WRITE)),
    PUBLIC(EnumSet.of(Permission.READ));

    private final Set<Permission> permissions;

    Role(EnumSet<Permission> permissions) {
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }
}
