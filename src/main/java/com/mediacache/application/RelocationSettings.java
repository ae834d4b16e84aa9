package com.mediacache.application;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RelocationSettings {
    @Builder.Default
    Duration lockTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration operationTimeout = Duration.ofMinutes(30);
    @Builder.Default
    int copyBufferSize = 1024 * 1024;
    @Builder.Default
    boolean hardlinkEnabled = true;
    @Builder.Default
    boolean symlinkEnabled = true;
    @Builder.Default
    boolean mountPreservation = false;
    /** Batch decisions also apply to the subtitle sidecars of each media file. */
    @Builder.Default
    boolean includeSubtitles = true;
}
