package com.kmg.gateway.repo;

import com.kmg.gateway.model.ApiKeyGrant;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Repository
public class ApiKeyRepository {
    private final JdbcTemplate jdbcTemplate;

    public ApiKeyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private record KeyRow(String id, String callerId, String keyHash, String label, boolean active,
                          String createdAt, String lastUsedAt) {
    }

    private static final RowMapper<KeyRow> MAPPER = new RowMapper<>() {
        @Override
        public KeyRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new KeyRow(
                    rs.getString("id"),
                    rs.getString("caller_id"),
                    rs.getString("key_hash"),
                    rs.getString("label"),
                    rs.getInt("is_active") == 1,
                    rs.getString("created_at"),
                    rs.getString("last_used_at")
            );
        }
    };

    public Optional<ApiKeyGrant> findByHash(String keyHash) {
        List<KeyRow> rows = jdbcTemplate.query("SELECT * FROM api_keys WHERE key_hash = ?", MAPPER, keyHash);
        return rows.stream().findFirst().map(this::toGrant);
    }

    public Optional<ApiKeyGrant> findById(String keyId) {
        List<KeyRow> rows = jdbcTemplate.query("SELECT * FROM api_keys WHERE id = ?", MAPPER, keyId);
        return rows.stream().findFirst().map(this::toGrant);
    }

    public List<ApiKeyGrant> findByCaller(String callerId) {
        return jdbcTemplate.query(
                        "SELECT * FROM api_keys WHERE caller_id = ? ORDER BY created_at ASC",
                        MAPPER,
                        callerId
                ).stream()
                .map(this::toGrant)
                .toList();
    }

    @Transactional
    public void insert(ApiKeyGrant grant) {
        jdbcTemplate.update(
                """
                INSERT INTO api_keys(id, caller_id, key_hash, label, is_active, created_at, last_used_at)
                VALUES (?, ?, ?, ?, ?, ?, NULL)
                """,
                grant.keyId(),
                grant.callerId(),
                grant.keyHash(),
                grant.label(),
                grant.active() ? 1 : 0,
                SqlTime.text(grant.createdAt())
        );
        insertGrants(grant.keyId(), grant.entitledServices());
    }

    @Transactional
    public void replaceGrants(String keyId, Collection<String> serviceIds) {
        jdbcTemplate.update("DELETE FROM api_key_services WHERE key_id = ?", keyId);
        insertGrants(keyId, serviceIds);
    }

    public boolean setActive(String keyId, boolean active) {
        return jdbcTemplate.update("UPDATE api_keys SET is_active = ? WHERE id = ?", active ? 1 : 0, keyId) > 0;
    }

    public void touchLastUsed(String keyId) {
        jdbcTemplate.update("UPDATE api_keys SET last_used_at = ? WHERE id = ?", SqlTime.nowText(), keyId);
    }

    private void insertGrants(String keyId, Collection<String> serviceIds) {
        for (String serviceId : new LinkedHashSet<>(serviceIds)) {
            jdbcTemplate.update(
                    "INSERT INTO api_key_services(key_id, service_id) VALUES (?, ?)",
                    keyId,
                    serviceId
            );
        }
    }

    private ApiKeyGrant toGrant(KeyRow row) {
        List<String> services = jdbcTemplate.queryForList(
                "SELECT service_id FROM api_key_services WHERE key_id = ?",
                String.class,
                row.id()
        );
        return new ApiKeyGrant(
                row.id(),
                row.callerId(),
                row.keyHash(),
                row.label(),
                new LinkedHashSet<>(services),
                row.active(),
                SqlTime.parse(row.createdAt()),
                SqlTime.parse(row.lastUsedAt())
        );
    }
}
