package com.kmg.gateway.repo;

import com.kmg.gateway.model.ServiceDefinition;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class ServiceDefinitionRepository {
    private final JdbcTemplate jdbcTemplate;

    public ServiceDefinitionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private record ServiceRow(String id, String name, boolean active, int cost, String updatedAt) {
    }

    private static final RowMapper<ServiceRow> MAPPER = new RowMapper<>() {
        @Override
        public ServiceRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ServiceRow(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getInt("is_active") == 1,
                    rs.getInt("cost"),
                    rs.getString("updated_at")
            );
        }
    };

    public List<ServiceDefinition> findAll() {
        List<ServiceRow> rows = jdbcTemplate.query("SELECT * FROM services ORDER BY id ASC", MAPPER);
        List<ServiceDefinition> result = new ArrayList<>();
        for (ServiceRow row : rows) {
            result.add(toDefinition(row));
        }
        return result;
    }

    public Optional<ServiceDefinition> findById(String id) {
        List<ServiceRow> rows = jdbcTemplate.query("SELECT * FROM services WHERE id = ?", MAPPER, id);
        return rows.stream().findFirst().map(this::toDefinition);
    }

    public List<String> findChain(String serviceId) {
        return jdbcTemplate.queryForList(
                "SELECT provider_id FROM service_fallback_chain WHERE service_id = ? ORDER BY position ASC",
                String.class,
                serviceId
        );
    }

    /**
     * Inserts a new service or refreshes name, cost and chain of an existing one.
     * The active flag of an existing row is left alone so that an operator's toggle survives restarts.
     */
    @Transactional
    public void upsertKeepingActiveFlag(ServiceDefinition definition) {
        String now = SqlTime.nowText();
        int updated = jdbcTemplate.update(
                "UPDATE services SET name = ?, cost = ?, updated_at = ? WHERE id = ?",
                definition.name(),
                definition.cost(),
                now,
                definition.id()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO services(id, name, is_active, cost, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)",
                    definition.id(),
                    definition.name(),
                    definition.active() ? 1 : 0,
                    definition.cost(),
                    now,
                    now
            );
        }

        jdbcTemplate.update("DELETE FROM service_fallback_chain WHERE service_id = ?", definition.id());
        List<String> chain = definition.fallbackChain();
        for (int i = 0; i < chain.size(); i++) {
            jdbcTemplate.update(
                    "INSERT INTO service_fallback_chain(service_id, position, provider_id) VALUES (?, ?, ?)",
                    definition.id(),
                    i,
                    chain.get(i)
            );
        }
    }

    public boolean setActive(String id, boolean active) {
        int updated = jdbcTemplate.update(
                "UPDATE services SET is_active = ?, updated_at = ? WHERE id = ?",
                active ? 1 : 0,
                SqlTime.nowText(),
                id
        );
        return updated > 0;
    }

    private ServiceDefinition toDefinition(ServiceRow row) {
        return new ServiceDefinition(
                row.id(),
                row.name(),
                row.active(),
                findChain(row.id()),
                row.cost(),
                SqlTime.parse(row.updatedAt())
        );
    }
}
