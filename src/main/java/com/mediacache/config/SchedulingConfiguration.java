package com.mediacache.config;

import com.mediacache.application.IntegrityChecker;
import com.mediacache.application.IntegrityScheduler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Periodic integrity pass, off unless {@code mediacache.integrity.schedule-enabled=true}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "mediacache.integrity.schedule-enabled", havingValue = "true")
public class SchedulingConfiguration {

    @Bean
    public IntegrityScheduler integrityScheduler(IntegrityChecker integrityChecker, MediaCacheProperties properties) {
        return new IntegrityScheduler(integrityChecker, properties.getIntegrity().getInterval());
    }
}
