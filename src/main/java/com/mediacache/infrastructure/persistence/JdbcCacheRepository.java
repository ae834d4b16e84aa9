package com.mediacache.infrastructure.persistence;

import com.mediacache.application.exceptions.CacheEngineException;
import com.mediacache.application.exceptions.ConflictException;
import com.mediacache.application.exceptions.IntegrityException;
import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.domain.model.CacheStatistics;
import com.mediacache.domain.model.CachedFileRecord;
import com.mediacache.domain.model.CachedFilesFilter;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.RecordState;
import com.mediacache.domain.model.RelocationMethod;
import com.mediacache.domain.model.TriggerReason;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.CacheRepository;
import com.mediacache.domain.repository.SecurityEventRepository;
import com.mediacache.infrastructure.crypto.ChecksumService;
import com.mediacache.infrastructure.security.AuthorizationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * SQLite-backed {@link CacheRepository}.
 *
 * Every public method:
 * - authorizes the caller before a connection is checked out
 * - binds all values as named parameters
 * - runs multi-statement writes in one immediate-mode transaction
 * - recomputes the record checksum on every state transition
 *
 * A state transition first verifies the stored checksum, so a tampered row is never
 * re-signed.
 */
@RequiredArgsConstructor
@Slf4j
public class JdbcCacheRepository implements CacheRepository {

    static final int MAX_FAILURE_REASON = 500;
    private static final int VERIFY_CHUNK = 500;

    private static final String COLUMNS =
        "id, original_path, cached_path, filename, method, size_bytes, checksum, state, trigger_reason, "
            + "added_by, created_at, updated_at, last_verified_at, failure_reason";

    private static final RowMapper<CachedFileRecord> ROW_MAPPER = JdbcCacheRepository::mapRow;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final AuthorizationManager authorization;
    private final ChecksumService checksums;
    private final SecurityEventRepository securityEvents;
    private final Clock clock;

    @Override
    public CachedFileRecord insert(CachedFileRecord record, UserContext context) {
        authorization.authorize(context, Permission.WRITE, "cache.insert");
        if (record.getState() != RecordState.PENDING) {
            throw new ValidationException("New records must start PENDING, got " + record.getState());
        }
        if (record.getTriggerReason() == null) {
            throw new ValidationException("Trigger reason is required");
        }

        Instant now = now();
        CachedFileRecord unsigned = record.toBuilder()
            .id(record.getId() != null ? record.getId() : UUID.randomUUID().toString())
            .addedBy(context.getUserId())
            .createdAt(now)
            .updatedAt(now)
            .lastVerifiedAt(null)
            .failureReason(null)
            .checksum(null)
            .build();
        try {
            unsigned.checkInvariants();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException("Invalid record: " + e.getMessage(), e);
        }
        CachedFileRecord signed = unsigned.toBuilder().checksum(checksums.compute(unsigned)).build();

        execute("insert", () -> transactions.execute(status -> {
            jdbc.update("INSERT INTO cached_files (" + COLUMNS + ") VALUES (:id, :originalPath, :cachedPath, "
                    + ":filename, :method, :sizeBytes, :checksum, :state, :triggerReason, :addedBy, "
                    + ":createdAt, :updatedAt, :lastVerifiedAt, :failureReason)",
                parameters(signed));
            return null;
        }));

        log.debug("Record inserted: id={}, path={}", signed.getId(),
            Encode.forJava(signed.getOriginalPath().toString()));
        return signed;
    }

    @Override
    public CachedFileRecord markCommitted(String id, long sizeBytes, UserContext context) {
        authorization.authorize(context, Permission.WRITE, "cache.commit");
        if (sizeBytes < 0 || sizeBytes > CachedFileRecord.MAX_SIZE_BYTES) {
            throw new ValidationException("sizeBytes out of range: " + sizeBytes);
        }
        return execute("markCommitted", () -> transactions.execute(status -> {
            CachedFileRecord current = loadForTransition(id, RecordState.PENDING);
            CachedFileRecord committed = resign(current.toBuilder()
                .state(RecordState.COMMITTED)
                .sizeBytes(sizeBytes)
                .updatedAt(now())
                .failureReason(null));
            updateTransition(committed, RecordState.PENDING);
            int purged = jdbc.update(
                "DELETE FROM cached_files WHERE original_path = :originalPath AND state = 'FAILED' AND id <> :id",
                new MapSqlParameterSource()
                    .addValue("originalPath", committed.getOriginalPath().toString())
                    .addValue("id", id));
            if (purged > 0) {
                log.debug("Purged {} stale failed record(s) for {}", purged,
                    Encode.forJava(committed.getOriginalPath().toString()));
            }
            return committed;
        }));
    }

    @Override
    public CachedFileRecord markFailed(String id, String reason, UserContext context) {
        authorization.authorize(context, Permission.WRITE, "cache.fail");
        String truncated = reason == null ? "unknown" : reason;
        if (truncated.length() > MAX_FAILURE_REASON) {
            truncated = truncated.substring(0, MAX_FAILURE_REASON);
        }
        String failureReason = truncated;
        return execute("markFailed", () -> transactions.execute(status -> {
            CachedFileRecord current = loadForTransition(id, RecordState.PENDING);
            CachedFileRecord failed = resign(current.toBuilder()
                .state(RecordState.FAILED)
                .updatedAt(now())
                .failureReason(failureReason));
            updateTransition(failed, RecordState.PENDING);
            return failed;
        }));
    }

    @Override
    public CachedFileRecord remove(String id, UserContext context) {
        authorization.authorize(context, Permission.DELETE, "cache.remove");
        return execute("remove", () -> transactions.execute(status -> {
            CachedFileRecord current = selectById(id)
                .orElseThrow(() -> new ValidationException("No record with id " + id));
            if (current.getState() == RecordState.REMOVED) {
                return current;
            }
            if (current.getState() != RecordState.COMMITTED) {
                throw new ConflictException("Record " + id + " is " + current.getState() + ", not COMMITTED");
            }
            requireIntact(current);
            CachedFileRecord removed = resign(current.toBuilder()
                .state(RecordState.REMOVED)
                .updatedAt(now()));
            updateTransition(removed, RecordState.COMMITTED);
            return removed;
        }));
    }

    @Override
    public int purgeRemoved(Duration olderThan, UserContext context) {
        authorization.authorize(context, Permission.ADMIN, "cache.purgeRemoved");
        if (olderThan == null || olderThan.isNegative()) {
            throw new ValidationException("Retention must be zero or positive");
        }
        Instant cutoff = now().minus(olderThan);
        int purged = execute("purgeRemoved", () -> transactions.execute(status -> jdbc.update(
            "DELETE FROM cached_files WHERE state = 'REMOVED' AND updated_at < :cutoff",
            new MapSqlParameterSource("cutoff", cutoff.toEpochMilli()))));
        log.info("Purged {} removed record(s) last updated before {}", purged, cutoff);
        return purged;
    }

    @Override
    public List<CachedFileRecord> listByState(RecordState state, UserContext context) {
        authorization.authorize(context, Permission.READ, "cache.listByState");
        return execute("listByState", () -> jdbc.query(
            "SELECT " + COLUMNS + " FROM cached_files WHERE state = :state ORDER BY created_at",
            new MapSqlParameterSource("state", state.name()), ROW_MAPPER));
    }

    @Override
    public Optional<CachedFileRecord> findByOriginalPath(Path originalPath, UserContext context) {
        authorization.authorize(context, Permission.READ, "cache.findByOriginalPath");
        return execute("findByOriginalPath", () -> jdbc.query(
            "SELECT " + COLUMNS + " FROM cached_files WHERE original_path = :originalPath "
                + "ORDER BY CASE WHEN state IN ('PENDING', 'COMMITTED') THEN 0 ELSE 1 END, updated_at DESC LIMIT 1",
            new MapSqlParameterSource("originalPath", originalPath.toString()), ROW_MAPPER)
            .stream().findFirst());
    }

    @Override
    public Optional<CachedFileRecord> findById(String id, UserContext context) {
        authorization.authorize(context, Permission.READ, "cache.findById");
        return execute("findById", () -> selectById(id));
    }

    @Override
    public List<CachedFileRecord> search(CachedFilesFilter filter, UserContext context) {
        authorization.authorize(context, Permission.READ, "cache.search");
        CachedFilesFilter effective = filter != null ? filter : CachedFilesFilter.all();
        if (effective.getLimit() < 1 || effective.getLimit() > CachedFilesFilter.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + CachedFilesFilter.MAX_LIMIT);
        }
        if (effective.getOffset() < 0 || effective.getOffset() > CachedFilesFilter.MAX_OFFSET) {
            throw new ValidationException("offset must be between 0 and " + CachedFilesFilter.MAX_OFFSET);
        }

        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM cached_files WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (effective.getSearch() != null && !effective.getSearch().isBlank()) {
            sql.append(" AND (filename LIKE :search ESCAPE '\\' OR original_path LIKE :search ESCAPE '\\')");
            params.addValue("search", "%" + escapeLike(effective.getSearch().trim()) + "%");
        }
        if (effective.getAddedBy() != null) {
            sql.append(" AND added_by = :addedBy");
            params.addValue("addedBy", effective.getAddedBy());
        }
        if (effective.getState() != null) {
            sql.append(" AND state = :state");
            params.addValue("state", effective.getState().name());
        }
        if (effective.getTriggerReason() != null) {
            sql.append(" AND trigger_reason = :triggerReason");
            params.addValue("triggerReason", effective.getTriggerReason().getDbValue());
        }
        if (effective.getSizeMin() != null) {
            sql.append(" AND size_bytes >= :sizeMin");
            params.addValue("sizeMin", effective.getSizeMin());
        }
        if (effective.getSizeMax() != null) {
            sql.append(" AND size_bytes <= :sizeMax");
            params.addValue("sizeMax", effective.getSizeMax());
        }
        if (effective.getCreatedSince() != null) {
            sql.append(" AND created_at >= :createdSince");
            params.addValue("createdSince", effective.getCreatedSince().toEpochMilli());
        }
        sql.append(" ORDER BY created_at DESC LIMIT :limit OFFSET :offset");
        params.addValue("limit", effective.getLimit());
        params.addValue("offset", effective.getOffset());

        return execute("search", () -> jdbc.query(sql.toString(), params, ROW_MAPPER));
    }

    @Override
    public CacheStatistics statistics(UserContext context) {
        authorization.authorize(context, Permission.READ, "cache.statistics");
        return execute("statistics", () -> {
            Map<RecordState, Long> byState = new EnumMap<>(RecordState.class);
            jdbc.query("SELECT state, COUNT(*) AS n FROM cached_files GROUP BY state",
                new MapSqlParameterSource(),
                (RowCallbackHandler) rs -> byState.put(RecordState.valueOf(rs.getString("state")), rs.getLong("n")));

            Map<String, Object> committed = jdbc.queryForMap(
                "SELECT COUNT(*) AS files, COALESCE(SUM(size_bytes), 0) AS bytes, "
                    + "COUNT(DISTINCT added_by) AS users, MIN(created_at) AS oldest "
                    + "FROM cached_files WHERE state = 'COMMITTED'",
                new MapSqlParameterSource());

            long totalBytes = ((Number) committed.get("bytes")).longValue();
            Object oldest = committed.get("oldest");
            return CacheStatistics.builder()
                .totalFiles(((Number) committed.get("files")).longValue())
                .totalSizeBytes(totalBytes)
                .totalSizeReadable(CacheStatistics.formatBytes(totalBytes))
                .filesByState(byState)
                .usersCount(((Number) committed.get("users")).longValue())
                .oldestCreatedAt(oldest == null ? null : Instant.ofEpochMilli(((Number) oldest).longValue()))
                .securityEventsLastWeek(securityEvents.countSince(now().minus(Duration.ofDays(7))))
                .build();
        });
    }

    @Override
    public Map<String, Boolean> verifyIntegrity(Collection<String> ids, UserContext context) {
        authorization.authorize(context, Permission.ADMIN, "cache.verifyIntegrity");
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (ids == null || ids.isEmpty()) {
            return results;
        }
        List<String> all = new ArrayList<>(ids);
        for (int from = 0; from < all.size(); from += VERIFY_CHUNK) {
            List<String> chunk = all.subList(from, Math.min(all.size(), from + VERIFY_CHUNK));
            execute("verifyIntegrity", () -> transactions.execute(status -> {
                List<CachedFileRecord> rows = jdbc.query(
                    "SELECT " + COLUMNS + " FROM cached_files WHERE id IN (:ids)",
                    new MapSqlParameterSource("ids", chunk), ROW_MAPPER);
                for (CachedFileRecord row : rows) {
                    boolean valid = checksums.verify(row);
                    results.put(row.getId(), valid);
                    if (!valid) {
                        log.warn("Checksum mismatch for record {}", row.getId());
                    }
                }
                jdbc.update("UPDATE cached_files SET last_verified_at = :now WHERE id IN (:ids)",
                    new MapSqlParameterSource()
                        .addValue("now", now().toEpochMilli())
                        .addValue("ids", chunk));
                return null;
            }));
        }
        return results;
    }

    private CachedFileRecord loadForTransition(String id, RecordState expected) {
        CachedFileRecord current = selectById(id)
            .orElseThrow(() -> new ValidationException("No record with id " + id));
        if (current.getState() != expected) {
            throw new ConflictException("Record " + id + " is " + current.getState() + ", expected " + expected);
        }
        requireIntact(current);
        return current;
    }

    private void requireIntact(CachedFileRecord current) {
        if (!checksums.verify(current)) {
            log.error("Refusing state transition on tampered record {}", current.getId());
            throw new IntegrityException("Checksum mismatch on record " + current.getId());
        }
    }

    private CachedFileRecord resign(CachedFileRecord.CachedFileRecordBuilder builder) {
        CachedFileRecord unsigned = builder.checksum(null).build();
        return unsigned.toBuilder().checksum(checksums.compute(unsigned)).build();
    }

    private void updateTransition(CachedFileRecord next, RecordState from) {
        int updated = jdbc.update(
            "UPDATE cached_files SET state = :state, size_bytes = :sizeBytes, checksum = :checksum, "
                + "updated_at = :updatedAt, failure_reason = :failureReason "
                + "WHERE id = :id AND state = :fromState",
            parameters(next).addValue("fromState", from.name()));
        if (updated != 1) {
            throw new ConflictException("Record " + next.getId() + " changed concurrently");
        }
    }

    private Optional<CachedFileRecord> selectById(String id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM cached_files WHERE id = :id",
            new MapSqlParameterSource("id", id), ROW_MAPPER).stream().findFirst();
    }

    private <T> T execute(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (CacheEngineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e, operation);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static MapSqlParameterSource parameters(CachedFileRecord record) {
        return new MapSqlParameterSource()
            .addValue("id", record.getId())
            .addValue("originalPath", record.getOriginalPath().toString())
            .addValue("cachedPath", record.getCachedPath().toString())
            .addValue("filename", record.getFilename())
            .addValue("method", record.getMethod().getDbValue())
            .addValue("sizeBytes", record.getSizeBytes())
            .addValue("checksum", record.getChecksum())
            .addValue("state", record.getState().name())
            .addValue("triggerReason", record.getTriggerReason().getDbValue())
            .addValue("addedBy", record.getAddedBy())
            .addValue("createdAt", epochMillis(record.getCreatedAt()))
            .addValue("updatedAt", epochMillis(record.getUpdatedAt()))
            .addValue("lastVerifiedAt", epochMillis(record.getLastVerifiedAt()))
            .addValue("failureReason", record.getFailureReason());
    }

    private static Long epochMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static CachedFileRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return CachedFileRecord.builder()
            .id(rs.getString("id"))
            .originalPath(Path.of(rs.getString("original_path")))
            .cachedPath(Path.of(rs.getString("cached_path")))
            .filename(rs.getString("filename"))
            .method(RelocationMethod.fromDbValue(rs.getString("method")))
            .sizeBytes(rs.getLong("size_bytes"))
            .checksum(rs.getString("checksum"))
            .state(RecordState.valueOf(rs.getString("state")))
            .triggerReason(TriggerReason.fromDbValue(rs.getString("trigger_reason")))
            .addedBy(rs.getString("added_by"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .lastVerifiedAt(instant(rs, "last_verified_at"))
            .failureReason(rs.getString("failure_reason"))
            .build();
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
