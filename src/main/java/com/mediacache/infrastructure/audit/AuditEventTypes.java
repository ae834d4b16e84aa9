package com.mediacache.infrastructure.audit;

/**
 * Event type names written to the security event log.
 */
public final class AuditEventTypes {

    public static final String AUTHORIZATION_FAILURE = "authorization_failure";
    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String VALIDATION_FAILURE = "validation_failure";
    public static final String RELOCATION_COMMITTED = "relocation_committed";
    public static final String RELOCATION_FAILED = "relocation_failed";
    public static final String RELOCATION_NOOP = "relocation_noop";
    public static final String RELOCATION_CANCELLED = "relocation_cancelled";
    public static final String RELEASE_COMPLETED = "release_completed";
    public static final String RELEASE_FAILED = "release_failed";
    public static final String INTEGRITY_FAILURE = "integrity_failure";
    public static final String INTEGRITY_VERIFICATION = "integrity_verification";
    public static final String ORPHAN_CLEANUP = "orphan_cleanup";
    public static final String OPERATION_FAILURE = "operation_failure";

    private AuditEventTypes() {}
}
