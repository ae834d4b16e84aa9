package com.mediacache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.domain.repository.SecurityEventRepository;
import com.mediacache.infrastructure.crypto.ChecksumService;
import com.mediacache.infrastructure.persistence.JdbcCacheRepository;
import com.mediacache.infrastructure.persistence.JdbcSecurityEventRepository;
import com.mediacache.infrastructure.persistence.SchemaInitializer;
import com.mediacache.infrastructure.persistence.SqliteConnectionPools;
import com.mediacache.infrastructure.security.AuthorizationManager;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * SQLite metadata store: bounded pool, immediate-mode transactions, schema, repositories.
 */
@Configuration
@Slf4j
public class PersistenceConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(MediaCacheProperties properties) {
        MediaCacheProperties.Database database = properties.getDatabase();
        return SqliteConnectionPools.create(database.getPath(), database.getPoolSize(),
            database.getConnectionTimeout(), database.getBusyTimeout());
    }

    @Bean(initMethod = "initialize")
    public SchemaInitializer schemaInitializer(DataSource dataSource) {
        return new SchemaInitializer(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    @DependsOn("schemaInitializer")
    public SecurityEventRepository securityEventRepository(NamedParameterJdbcTemplate jdbc,
                                                           ObjectMapper objectMapper) {
        return new JdbcSecurityEventRepository(jdbc, objectMapper);
    }

    @Bean
    @DependsOn("schemaInitializer")
    public CacheRepository cacheRepository(NamedParameterJdbcTemplate jdbc,
                                           TransactionTemplate transactionTemplate,
                                           AuthorizationManager authorizationManager,
                                           ChecksumService checksumService,
                                           SecurityEventRepository securityEventRepository,
                                           Clock clock) {
        return new JdbcCacheRepository(jdbc, transactionTemplate, authorizationManager, checksumService,
            securityEventRepository, clock);
    }
}
