package com.mediacache.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class CacheStatistics {
    long totalFiles;
    long totalSizeBytes;
    String totalSizeReadable;
    Map<RecordState, Long> filesByState;
    long usersCount;
    Instant oldestCreatedAt;
    long securityEventsLastWeek;

    public long countIn(RecordState state) {
        return filesByState.getOrDefault(state, 0L);
    }

    /**
     * Formats a byte count the way the dashboard shows it ({@code 0 B}, {@code 512 B},
     * {@code 1.5 GB}).
     */
    public static String formatBytes(long sizeBytes) {
        if (sizeBytes <= 0) {
            return "0 B";
        }
        String[] units = {"B", "KB", "MB", "GB", "TB"};
        int unit = 0;
        double size = sizeBytes;
        while (size >= 1024.0 && unit < units.length - 1) {
            size /= 1024.0;
            unit++;
        }
        return unit == 0
            ? String.format(java.util.Locale.ROOT, "%d %s", (long) size, units[unit])
            : String.format(java.util.Locale.ROOT, "%.1f %s", size, units[unit]);
    }
}
