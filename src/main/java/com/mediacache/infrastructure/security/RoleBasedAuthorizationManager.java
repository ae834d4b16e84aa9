package com.mediacache.infrastructure.security;

import com.mediacache.application.exceptions.AuthorizationException;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.Role;
import com.mediacache.domain.model.UserContext;
import com.mediacache.infrastructure.audit.AuditEventTypes;
import com.mediacache.infrastructure.audit.AuditLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role-based authorization over the fixed {@link Role} table.
 *
 * Security properties guaranteed here:
 * 1. Default deny: a null context, a null role or a role without the permission is denied
 * 2. No dynamic inheritance: the decision is a pure function of (role, permission)
 * 3. Every denial is audited
 *
 * This class is security-critical; changes need review.
 */
@RequiredArgsConstructor
@Slf4j
public class RoleBasedAuthorizationManager implements AuthorizationManager {

    private final AuditLogger auditLogger;

    @Override
    public boolean isPermitted(Role role, Permission permission) {
        if (role == null || permission == null) {
            return false;
        }
        return role.getPermissions().contains(permission);
    }

    @Override
    public void authorize(UserContext context, Permission permission, String operation) {
        if (context == null || context.getUserId() == null || context.getUserId().isBlank()) {
            log.warn("AUTHORIZATION DENIED: missing caller identity - operation={}", operation);
            auditDenial(context, permission, operation, "MISSING_IDENTITY");
            throw new AuthorizationException("Access denied: caller identity is required");
        }

        if (!isPermitted(context.getRole(), permission)) {
            log.warn("AUTHORIZATION DENIED [{}]: principal={}, role={}, operation={}, required={}",
                context.getRequestId(), Encode.forJava(context.getUserId()), context.getRole(),
                operation, permission);
            auditDenial(context, permission, operation, "INSUFFICIENT_ROLE");
            throw new AuthorizationException(
                "Access denied: role " + context.getRole() + " lacks " + permission + " for " + operation);
        }

        log.debug("AUTHORIZATION GRANTED [{}]: principal={}, operation={}",
            context.getRequestId(), Encode.forJava(context.getUserId()), operation);
    }

    private void auditDenial(UserContext context, Permission permission, String operation, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", String.valueOf(permission));
        details.put("role", context != null ? String.valueOf(context.getRole()) : "none");
        details.put("reason", reason);
        auditLogger.failure(AuditEventTypes.AUTHORIZATION_FAILURE, context, operation, operation, details);
    }
}
