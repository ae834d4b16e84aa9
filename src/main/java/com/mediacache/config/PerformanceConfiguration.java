package com.mediacache.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timing for repository and relocation operations.
 *
 * Security: paths and user ids are never used as tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        log.info("No meter registry present, using in-memory registry");
        return new SimpleMeterRegistry();
    }

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.mediacache.domain.repository.*Repository.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing relocation and integrity operations.
     */
    @Aspect
    @Component
    public static class RelocationPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RelocationPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.mediacache.application.AtomicRelocator.*(..))"
            + " || execution(public * com.mediacache.application.IntegrityChecker.*(..))")
        public Object timeRelocation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "relocation.operation", "Relocation operation timing", joinPoint);
        }
    }

    static Object timed(MeterRegistry meterRegistry, String name, String description,
                        ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description(description)
                .register(meterRegistry));
        }
    }
}
