package com.kmg.gateway.repo;

import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.model.UsageOutcome;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class UsageLogRepository {
    private final JdbcTemplate jdbcTemplate;

    public UsageLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<UsageLogEntry> MAPPER = new RowMapper<>() {
        @Override
        public UsageLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new UsageLogEntry(
                    rs.getLong("id"),
                    rs.getString("caller_id"),
                    rs.getString("key_id"),
                    rs.getString("service_id"),
                    rs.getString("lookup_key"),
                    UsageOutcome.valueOf(rs.getString("outcome")),
                    rs.getString("failure_code"),
                    rs.getString("source"),
                    rs.getLong("credits_charged"),
                    rs.getLong("response_time_ms"),
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public void insert(UsageLogEntry entry) {
        jdbcTemplate.update(
                """
                INSERT INTO usage_logs(caller_id, key_id, service_id, lookup_key, outcome, failure_code, source,
                                       credits_charged, response_time_ms, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                entry.callerId(),
                entry.keyId(),
                entry.serviceId(),
                entry.lookupKey(),
                entry.outcome().name(),
                entry.failureCode(),
                entry.source(),
                entry.creditsCharged(),
                entry.responseTimeMs(),
                SqlTime.text(entry.createdAt() != null ? entry.createdAt() : SqlTime.now())
        );
    }

    public List<UsageLogEntry> findRecent(int limit) {
        return jdbcTemplate.query("SELECT * FROM usage_logs ORDER BY id DESC LIMIT ?", MAPPER, limit);
    }

    public List<UsageLogEntry> findRecentByCaller(String callerId, int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM usage_logs WHERE caller_id = ? ORDER BY id DESC LIMIT ?",
                MAPPER,
                callerId,
                limit
        );
    }
}
