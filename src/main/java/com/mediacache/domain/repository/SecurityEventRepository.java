package com.mediacache.domain.repository;

import com.mediacache.domain.model.SecurityEvent;
import com.mediacache.domain.model.SecurityEventFilter;
import com.mediacache.domain.model.UserContext;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store for {@link SecurityEvent}s. There is no update or delete.
 */
public interface SecurityEventRepository {

    /**
     * Append an event. Internal to the engine, so no caller context is required.
     */
    void append(SecurityEvent event);

    /**
     * Query events, newest first.
     *
     * @param context caller, needs ADMIN
     */
    List<SecurityEvent> find(SecurityEventFilter filter, UserContext context);

    long countSince(Instant since);
}
