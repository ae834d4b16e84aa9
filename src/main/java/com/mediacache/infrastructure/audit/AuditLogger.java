package com.mediacache.infrastructure.audit;

import com.mediacache.domain.model.UserContext;

import java.util.Map;

/**
 * Records security-relevant and relocation events.
 *
 * <p>Writes are fire-and-forget for the caller: a failed write is logged but never
 * propagated, so auditing cannot fail the operation it describes.
 */
public interface AuditLogger {

    void record(String eventType, UserContext context, String resource, String action,
                boolean success, Map<String, Object> details);

    default void success(String eventType, UserContext context, String resource, String action,
                         Map<String, Object> details) {
        record(eventType, context, resource, action, true, details);
    }

    default void failure(String eventType, UserContext context, String resource, String action,
                         Map<String, Object> details) {
        record(eventType, context, resource, action, false, details);
    }
}
