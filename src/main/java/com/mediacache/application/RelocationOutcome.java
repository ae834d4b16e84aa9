package com.mediacache.application;

import com.mediacache.domain.model.CachedFileRecord;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Successful end state of a cache or release request.
 */
@Value
@Builder
public class RelocationOutcome {

    public enum Kind {
        CACHE,
        RELEASE
    }

    Kind kind;
    Path originalPath;
    RelocationPhase phase;
    /** Null when the request was cancelled before staging. */
    CachedFileRecord record;
    /** True when the path was already cached and nothing was done. */
    boolean noop;

    public boolean isCancelled() {
        return phase == RelocationPhase.CANCELLED;
    }

    static RelocationOutcome cancelled(Kind kind, Path originalPath) {
        return RelocationOutcome.builder()
            .kind(kind)
            .originalPath(originalPath)
            .phase(RelocationPhase.CANCELLED)
            .build();
    }
}
