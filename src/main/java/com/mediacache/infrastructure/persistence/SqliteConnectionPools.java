package com.mediacache.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Builds the bounded connection pool over the SQLite metadata database.
 *
 * <p>Every connection opens write transactions with {@code BEGIN IMMEDIATE}, so a writer
 * takes the database write lock before its first read and concurrent writers serialize
 * instead of failing on lock upgrade. Journal mode is WAL, which lets readers proceed
 * alongside the single writer.
 */
@Slf4j
public final class SqliteConnectionPools {

    private SqliteConnectionPools() {
    }

    public static HikariDataSource create(Path databasePath, int poolSize,
                                          Duration connectionTimeout, Duration busyTimeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1: " + poolSize);
        }
        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create database directory " + parent, e);
            }
        }

        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout((int) busyTimeout.toMillis());
        sqlite.enforceForeignKeys(true);

        SQLiteDataSource sqliteDataSource = new SQLiteDataSource(sqlite);
        sqliteDataSource.setUrl("jdbc:sqlite:" + databasePath.toAbsolutePath());

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("media-cache-db");
        hikari.setDataSource(sqliteDataSource);
        hikari.setMaximumPoolSize(poolSize);
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(connectionTimeout.toMillis());
        hikari.setAutoCommit(true);

        log.info("Opening metadata database {} with pool size {}", databasePath.toAbsolutePath(), poolSize);
        return new HikariDataSource(hikari);
    }
}
