package com.mediacache.domain.model;

import java.util.Arrays;

/**
 * Why a relocation was requested.
 */
public enum TriggerReason {
    WATCHLIST("watchlist"),
    ONDECK("ondeck"),
    TRAKT("trakt"),
    MANUAL("manual"),
    CONTINUE_WATCHING("continue_watching"),
    REAL_TIME_WATCH("real_time_watch"),
    ACTIVE_WATCHING("active_watching"),
    SYSTEM_MAINTENANCE("system_maintenance");

    private final String dbValue;

    TriggerReason(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    /**
     * A file that is being streamed right now must not be re-linked underneath the reader.
     */
    public boolean requiresSecureCopy() {
        return this == ACTIVE_WATCHING || this == REAL_TIME_WATCH;
    }

    public static TriggerReason fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(r -> r.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown trigger reason: " + value));
    }
}
