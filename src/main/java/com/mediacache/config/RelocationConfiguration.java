package com.mediacache.config;

import com.mediacache.application.AtomicRelocator;
import com.mediacache.application.IntegrityChecker;
import com.mediacache.application.RelocationMetrics;
import com.mediacache.application.RelocationPolicy;
import com.mediacache.application.RelocationSettings;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.domain.repository.SecurityEventRepository;
import com.mediacache.infrastructure.audit.AuditLogger;
import com.mediacache.infrastructure.filesystem.CacheLayout;
import com.mediacache.infrastructure.filesystem.FilesystemOperations;
import com.mediacache.infrastructure.filesystem.FilesystemPathExistenceOracle;
import com.mediacache.infrastructure.filesystem.PathExistenceOracle;
import com.mediacache.infrastructure.filesystem.PathLockManager;
import com.mediacache.infrastructure.filesystem.SubtitleFinder;
import com.mediacache.infrastructure.security.AuthorizationManager;
import com.mediacache.infrastructure.security.PathValidator;
import com.mediacache.infrastructure.security.RateLimiter;
import com.mediacache.interfaces.api.CacheOperations;
import com.mediacache.interfaces.api.exception.ErrorTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Relocation engine: bounded worker pool, per-path locks, filesystem primitives and the
 * public operation surface.
 */
@Configuration
@Slf4j
public class RelocationConfiguration {

    /**
     * Bounded platform-thread pool for relocations. A full queue rejects new work instead
     * of blocking the caller.
     */
    @Bean(name = "relocationExecutor")
    public ThreadPoolTaskExecutor relocationExecutor(MediaCacheProperties properties) {
        MediaCacheProperties.Relocation relocation = properties.getRelocation();
        log.info("Configuring relocation pool: threads={}, queue={}",
            relocation.getWorkerThreads(), relocation.getQueueCapacity());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relocation.getWorkerThreads());
        executor.setMaxPoolSize(relocation.getWorkerThreads());
        executor.setQueueCapacity(relocation.getQueueCapacity());
        executor.setThreadNamePrefix("relocation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) Math.min(Integer.MAX_VALUE,
            relocation.getOperationTimeout().toSeconds()));
        return executor;
    }

    @Bean
    public RelocationSettings relocationSettings(MediaCacheProperties properties) {
        MediaCacheProperties.Relocation relocation = properties.getRelocation();
        return RelocationSettings.builder()
            .lockTimeout(relocation.getLockTimeout())
            .operationTimeout(relocation.getOperationTimeout())
            .copyBufferSize(relocation.getCopyBufferSize())
            .hardlinkEnabled(relocation.isHardlinkEnabled())
            .symlinkEnabled(relocation.isSymlinkEnabled())
            .mountPreservation(relocation.isMountPreservation())
            .includeSubtitles(relocation.isIncludeSubtitles())
            .build();
    }

    @Bean
    public RelocationPolicy relocationPolicy(RelocationSettings relocationSettings) {
        return new RelocationPolicy(relocationSettings);
    }

    @Bean
    public PathLockManager pathLockManager() {
        return new PathLockManager();
    }

    @Bean
    public FilesystemOperations filesystemOperations() {
        return new FilesystemOperations();
    }

    @Bean
    public SubtitleFinder subtitleFinder() {
        return new SubtitleFinder();
    }

    @Bean
    public PathExistenceOracle pathExistenceOracle() {
        return new FilesystemPathExistenceOracle();
    }

    @Bean
    public RelocationMetrics relocationMetrics(MeterRegistry meterRegistry) {
        return new RelocationMetrics(meterRegistry);
    }

    @Bean
    public AtomicRelocator atomicRelocator(CacheRepository cacheRepository,
                                           AuthorizationManager authorizationManager,
                                           PathValidator pathValidator,
                                           CacheLayout cacheLayout,
                                           FilesystemOperations filesystemOperations,
                                           PathLockManager pathLockManager,
                                           PathExistenceOracle pathExistenceOracle,
                                           RelocationPolicy relocationPolicy,
                                           RelocationSettings relocationSettings,
                                           AuditLogger auditLogger,
                                           RelocationMetrics relocationMetrics,
                                           @Qualifier("relocationExecutor") ThreadPoolTaskExecutor relocationExecutor,
                                           Clock clock) {
        return new AtomicRelocator(cacheRepository, authorizationManager, pathValidator, cacheLayout,
            filesystemOperations, pathLockManager, pathExistenceOracle, relocationPolicy, relocationSettings,
            auditLogger, relocationMetrics, relocationExecutor, clock);
    }

    @Bean
    public IntegrityChecker integrityChecker(CacheRepository cacheRepository,
                                             AuthorizationManager authorizationManager,
                                             FilesystemOperations filesystemOperations,
                                             PathLockManager pathLockManager,
                                             CacheLayout cacheLayout,
                                             AuditLogger auditLogger,
                                             RelocationMetrics relocationMetrics,
                                             MediaCacheProperties properties,
                                             Clock clock) {
        return new IntegrityChecker(cacheRepository, authorizationManager, filesystemOperations, pathLockManager,
            cacheLayout, auditLogger, relocationMetrics, clock, properties.getIntegrity().getBatchSize(),
            properties.getRelocation().getLockTimeout());
    }

    @Bean
    public ErrorTranslator errorTranslator(Clock clock) {
        return new ErrorTranslator(clock);
    }

    @Bean
    public CacheOperations cacheOperations(AtomicRelocator atomicRelocator,
                                           CacheRepository cacheRepository,
                                           SecurityEventRepository securityEventRepository,
                                           IntegrityChecker integrityChecker,
                                           AuthorizationManager authorizationManager,
                                           RateLimiter rateLimiter,
                                           PathExistenceOracle pathExistenceOracle,
                                           SubtitleFinder subtitleFinder,
                                           RelocationSettings relocationSettings,
                                           RelocationMetrics relocationMetrics,
                                           ErrorTranslator errorTranslator) {
        return new CacheOperations(atomicRelocator, cacheRepository, securityEventRepository, integrityChecker,
            authorizationManager, rateLimiter, pathExistenceOracle, subtitleFinder, relocationSettings,
            relocationMetrics, errorTranslator);
    }
}
