package com.mediacache.infrastructure.security;

import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.Role;
import com.mediacache.domain.model.UserContext;

/**
 * Central authorization enforcement point.
 *
 * <p>Every public entry point of the repository and the relocator calls
 * {@link #authorize} as its first step.
 */
public interface AuthorizationManager {

    /**
     * Pure policy lookup. A missing role or permission is a denial.
     */
    boolean isPermitted(Role role, Permission permission);

    /**
     * Enforce a permission for a caller.
     *
     * @param context caller identity
     * @param permission required permission
     * @param operation operation name, for the audit trail
     * @throws com.mediacache.application.exceptions.AuthorizationException on denial
     */
    void authorize(UserContext context, Permission permission, String operation);
}
