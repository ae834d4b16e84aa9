package com.mediacache.infrastructure.audit;

import com.mediacache.domain.model.SecurityEvent;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.SecurityEventRepository;
import lombok.RequiredArgsConstructor;
import org.owasp.encoder.Encode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit logger backed by the security event table, mirrored to the {@code security.audit}
 * log.
 */
@RequiredArgsConstructor
public class DefaultAuditLogger implements AuditLogger {

    private static final Logger log = LoggerFactory.getLogger("security.audit");

    private final SecurityEventRepository repository;
    private final Clock clock;

    @Override
    public void record(String eventType, UserContext context, String resource, String action,
                       boolean success, Map<String, Object> details) {
        String userId = context != null ? context.getUserId() : null;
        if (success) {
            log.info("AUDIT event={} action={} resource={} user={} success=true details={}",
                eventType, action, Encode.forJava(String.valueOf(resource)),
                Encode.forJava(String.valueOf(userId)), Encode.forJava(String.valueOf(details)));
        } else {
            log.warn("AUDIT event={} action={} resource={} user={} success=false details={}",
                eventType, action, Encode.forJava(String.valueOf(resource)),
                Encode.forJava(String.valueOf(userId)), Encode.forJava(String.valueOf(details)));
        }
        try {
            SecurityEvent event = SecurityEvent.builder()
                .id(UUID.randomUUID().toString())
                .eventType(eventType)
                .userId(userId)
                .resource(resource == null ? "" : resource)
                .action(action)
                .success(success)
                .details(details == null ? Map.of() : details)
                .sourceIp(context != null ? context.getSourceIp() : null)
                .timestamp(Instant.now(clock))
                .build();
            repository.append(event);
        } catch (RuntimeException e) {
            // audit persistence must never fail the operation being audited
            log.error("Failed to persist audit event {} for resource {}: {}",
                eventType, Encode.forJava(String.valueOf(resource)), e.getMessage(), e);
        }
    }
}
