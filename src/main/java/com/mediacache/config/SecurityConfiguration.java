package com.mediacache.config;

import com.mediacache.domain.repository.SecurityEventRepository;
import com.mediacache.infrastructure.audit.AuditLogger;
import com.mediacache.infrastructure.audit.DefaultAuditLogger;
import com.mediacache.infrastructure.crypto.ChecksumService;
import com.mediacache.infrastructure.crypto.HmacChecksumService;
import com.mediacache.infrastructure.filesystem.CacheLayout;
import com.mediacache.infrastructure.security.AuthorizationManager;
import com.mediacache.infrastructure.security.PathCanonicalizer;
import com.mediacache.infrastructure.security.PathValidator;
import com.mediacache.infrastructure.security.RateLimiter;
import com.mediacache.infrastructure.security.RealPathCanonicalizer;
import com.mediacache.infrastructure.security.RoleBasedAuthorizationManager;
import com.mediacache.infrastructure.security.SlidingWindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Security components: audit trail, role-based authorization, path allow-list, rate limit
 * and record checksums.
 *
 * Defense-in-depth layers, outermost first:
 * 1. Role check (authorization decision)
 * 2. Per-user rate limit
 * 3. Path allow-list and filename rules
 * 4. Parameterized queries and schema CHECK constraints
 * 5. HMAC record checksums (tamper evidence)
 * 6. Audit logging (accountability)
 */
@Configuration
@Slf4j
public class SecurityConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuditLogger auditLogger(SecurityEventRepository securityEventRepository, Clock clock) {
        return new DefaultAuditLogger(securityEventRepository, clock);
    }

    @Bean
    public AuthorizationManager authorizationManager(AuditLogger auditLogger) {
        return new RoleBasedAuthorizationManager(auditLogger);
    }

    @Bean
    public PathCanonicalizer pathCanonicalizer() {
        return new RealPathCanonicalizer();
    }

    @Bean
    public PathValidator pathValidator(PathCanonicalizer pathCanonicalizer) {
        return new PathValidator(pathCanonicalizer);
    }

    @Bean
    public CacheLayout cacheLayout(MediaCacheProperties properties, PathCanonicalizer pathCanonicalizer) {
        MediaCacheProperties.Paths paths = properties.getPaths();
        CacheLayout layout = new CacheLayout(paths.getOriginRoots(), paths.getCacheRoot(),
            paths.getAdditionalAllowedBases(), pathCanonicalizer);
        log.info("Allowed bases: {}", layout.getAllowedBases());
        return layout;
    }

    @Bean
    public RateLimiter rateLimiter(MediaCacheProperties properties, Clock clock, AuditLogger auditLogger) {
        MediaCacheProperties.RateLimit rateLimit = properties.getRateLimit();
        return new SlidingWindowRateLimiter(rateLimit.getMaxRequests(), rateLimit.getWindow(), clock, auditLogger);
    }

    @Bean
    public ChecksumService checksumService(MediaCacheProperties properties) {
        return new HmacChecksumService(properties.getSecurity().getHmacKey());
    }
}
