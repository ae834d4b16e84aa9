package com.mediacache.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediacache.application.exceptions.AuthorizationException;
import com.mediacache.application.exceptions.ValidationException;
import com.mediacache.domain.model.Permission;
import com.mediacache.domain.model.SecurityEvent;
import com.mediacache.domain.model.SecurityEventFilter;
import com.mediacache.domain.model.UserContext;
import com.mediacache.domain.repository.SecurityEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * SQLite-backed append-only security event store. Details are stored as a JSON object.
 *
 * <p>Reads check the caller's permission set directly instead of going through the
 * {@code AuthorizationManager}, whose denials are themselves written to this store.
 */
@RequiredArgsConstructor
@Slf4j
public class JdbcSecurityEventRepository implements SecurityEventRepository {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() { };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public void append(SecurityEvent event) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", event.getId())
            .addValue("eventType", event.getEventType())
            .addValue("userId", event.getUserId())
            .addValue("resource", event.getResource() == null ? "" : event.getResource())
            .addValue("action", event.getAction())
            .addValue("success", event.isSuccess() ? 1 : 0)
            .addValue("details", writeDetails(event.getDetails()))
            .addValue("sourceIp", event.getSourceIp())
            .addValue("timestamp", event.getTimestamp().toEpochMilli());
        try {
            jdbc.update("INSERT INTO security_events (id, event_type, user_id, resource, action, success, "
                + "details, source_ip, timestamp) VALUES (:id, :eventType, :userId, :resource, :action, "
                + ":success, :details, :sourceIp, :timestamp)", params);
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e, "appendSecurityEvent");
        }
    }

    @Override
    public List<SecurityEvent> find(SecurityEventFilter filter, UserContext context) {
        if (context == null || !context.getPermissions().contains(Permission.ADMIN)) {
            throw new AuthorizationException("Access denied: security events require " + Permission.ADMIN);
        }
        SecurityEventFilter effective = filter != null ? filter : SecurityEventFilter.all();
        if (effective.getLimit() < 1 || effective.getLimit() > SecurityEventFilter.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + SecurityEventFilter.MAX_LIMIT);
        }

        StringBuilder sql = new StringBuilder(
            "SELECT id, event_type, user_id, resource, action, success, details, source_ip, timestamp "
                + "FROM security_events WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (effective.getEventType() != null) {
            sql.append(" AND event_type = :eventType");
            params.addValue("eventType", effective.getEventType());
        }
        if (effective.getUserId() != null) {
            sql.append(" AND user_id = :userId");
            params.addValue("userId", effective.getUserId());
        }
        if (effective.getSuccess() != null) {
            sql.append(" AND success = :success");
            params.addValue("success", effective.getSuccess() ? 1 : 0);
        }
        if (effective.getSince() != null) {
            sql.append(" AND timestamp >= :since");
            params.addValue("since", effective.getSince().toEpochMilli());
        }
        sql.append(" ORDER BY timestamp DESC, rowid DESC LIMIT :limit");
        params.addValue("limit", effective.getLimit());

        try {
            return jdbc.query(sql.toString(), params, rowMapper());
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e, "findSecurityEvents");
        }
    }

    @Override
    public long countSince(Instant since) {
        try {
            Long count = jdbc.queryForObject("SELECT COUNT(*) FROM security_events WHERE timestamp >= :since",
                new MapSqlParameterSource("since", since.toEpochMilli()), Long.class);
            return count == null ? 0L : count;
        } catch (RuntimeException e) {
            throw DataAccessErrors.translate(e, "countSecurityEvents");
        }
    }

    private RowMapper<SecurityEvent> rowMapper() {
        return (rs, rowNum) -> SecurityEvent.builder()
            .id(rs.getString("id"))
            .eventType(rs.getString("event_type"))
            .userId(rs.getString("user_id"))
            .resource(rs.getString("resource"))
            .action(rs.getString("action"))
            .success(rs.getInt("success") == 1)
            .details(readDetails(rs.getString("details")))
            .sourceIp(rs.getString("source_ip"))
            .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp")))
            .build();
    }

    private String writeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Unserializable audit details, storing keys only: {}", e.getMessage());
            return "{\"unserializable\":\"" + String.join(",", details.keySet()).replace("\"", "'") + "\"}";
        }
    }

    private Map<String, Object> readDetails(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit details: {}", e.getMessage());
            return Map.of("raw", json);
        }
    }
}
