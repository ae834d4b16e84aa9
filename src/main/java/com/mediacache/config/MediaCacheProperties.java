package com.mediacache.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from the {@code mediacache} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mediacache")
public class MediaCacheProperties {

    @Valid
    private Database database = new Database();

    @Valid
    private Paths paths = new Paths();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Security security = new Security();

    @Valid
    private Relocation relocation = new Relocation();

    @Valid
    private Integrity integrity = new Integrity();

    @Data
    public static class Database {
        @NotNull
        private Path path = Path.of("data", "media-cache.db");
        @Min(1)
        @Max(64)
        private int poolSize = 10;
        @NotNull
        private Duration connectionTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration busyTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Paths {
        @NotEmpty
        private List<Path> originRoots = new ArrayList<>();
        @NotNull
        private Path cacheRoot;
        private List<Path> additionalAllowedBases = new ArrayList<>();
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int maxRequests = 100;
        @NotNull
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Security {
        /** HMAC key for record checksums. */
        @NotNull
        @Size(min = 32)
        private String hmacKey;
    }

    @Data
    public static class Relocation {
        @Min(1)
        @Max(64)
        private int workerThreads = 4;
        @Min(1)
        private int queueCapacity = 256;
        @NotNull
        private Duration lockTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration operationTimeout = Duration.ofMinutes(30);
        private boolean hardlinkEnabled = true;
        private boolean symlinkEnabled = true;
        private boolean mountPreservation = false;
        private boolean includeSubtitles = true;
        @Min(4096)
        private int copyBufferSize = 1024 * 1024;
    }

    @Data
    public static class Integrity {
        private boolean scheduleEnabled = false;
        @NotNull
        private Duration interval = Duration.ofHours(6);
        @Min(1)
        @Max(1000)
        private int batchSize = 500;
    }
}
