package com.mediacache.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Applies {@code schema.sql}. Every statement is idempotent, so this runs on each start.
 */
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {

    public static final String SCHEMA_LOCATION = "schema.sql";

    private final DataSource dataSource;

    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.setContinueOnError(false);
        DatabasePopulatorUtils.execute(populator, dataSource);
        log.info("Metadata schema ready");
    }
}
