package com.mediacache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Secure cache-metadata store and atomic relocation engine.
 *
 * <ul>
 *   <li><strong>Relocation</strong>: hardlink, symlink or verified copy, staged under a
 *       temporary name and renamed into place, with journaled rollback</li>
 *   <li><strong>Metadata</strong>: SQLite with immediate-mode transactions and HMAC record
 *       checksums</li>
 *   <li><strong>Access control</strong>: fixed role table, per-user rate limit, path
 *       allow-list</li>
 *   <li><strong>Audit</strong>: append-only security event table</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class MediaCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaCacheApplication.class, args);
        log.info("Media cache engine started");
    }
}
