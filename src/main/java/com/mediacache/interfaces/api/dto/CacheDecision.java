package com.mediacache.interfaces.api.dto;

import com.mediacache.domain.model.TriggerReason;
import lombok.Builder;
import lombok.Value;

/**
 * One catalog decision. The engine executes it without interpreting watch status.
 */
@Value
@Builder
public class CacheDecision {
    String originalPath;
    DesiredState desiredState;
    @Builder.Default
    TriggerReason reason = TriggerReason.MANUAL;

    public static CacheDecision cache(String originalPath, TriggerReason reason) {
        return CacheDecision.builder().originalPath(originalPath).desiredState(DesiredState.CACHED).reason(reason).build();
    }

    public static CacheDecision release(String originalPath) {
        return CacheDecision.builder().originalPath(originalPath).desiredState(DesiredState.RELEASED).build();
    }
}
