package com.kmg.gateway.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.gateway.model.VerificationRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcRecordStore implements RecordStore {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<VerificationRecord> mapper;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.mapper = (rs, rowNum) -> new VerificationRecord(
                rs.getString("service_id"),
                rs.getString("lookup_key"),
                readPayload(rs.getString("payload_json")),
                rs.getString("source"),
                SqlTime.parse(rs.getString("fetched_at"))
        );
    }

    @Override
    public Optional<VerificationRecord> get(String serviceId, String lookupKey) {
        List<VerificationRecord> rows = jdbcTemplate.query(
                "SELECT * FROM verification_records WHERE service_id = ? AND lookup_key = ?",
                mapper,
                serviceId,
                lookupKey
        );
        return rows.stream().findFirst();
    }

    @Override
    public void put(VerificationRecord record) {
        jdbcTemplate.update(
                """
                INSERT INTO verification_records(service_id, lookup_key, payload_json, source, fetched_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(service_id, lookup_key) DO UPDATE SET
                    payload_json = excluded.payload_json,
                    source = excluded.source,
                    fetched_at = excluded.fetched_at
                """,
                record.serviceId(),
                record.lookupKey(),
                writePayload(record),
                record.source(),
                SqlTime.text(record.fetchedAt() != null ? record.fetchedAt() : SqlTime.now())
        );
    }

    private JsonNode readPayload(String json) {
        try {
            return objectMapper.readTree(json == null ? "null" : json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored verification payload is not valid JSON", e);
        }
    }

    private String writePayload(VerificationRecord record) {
        try {
            return objectMapper.writeValueAsString(record.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize payload for " + record.serviceId() + "/" + record.lookupKey(), e);
        }
    }
}
