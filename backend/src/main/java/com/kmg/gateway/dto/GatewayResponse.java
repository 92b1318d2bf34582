package com.kmg.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.gateway.model.GatewayStatus;
import com.kmg.gateway.model.PipelineResult;
import com.kmg.gateway.model.VerificationRecord;
import com.kmg.gateway.repo.SqlTime;
import org.springframework.http.HttpStatus;

/**
 * Body returned to callers of the verification endpoint. {@code status} is the coarse outcome,
 * {@code code} the specific failure reason (or {@code SUCCESS}).
 */
public record GatewayResponse(
        GatewayStatus status,
        String code,
        String message,
        String serviceId,
        String lookupKey,
        String source,
        String fetchedAt,
        long creditsCharged,
        JsonNode payload
) {
    public static GatewayResponse from(PipelineResult result) {
        VerificationRecord record = result.record();
        return new GatewayResponse(
                result.status(),
                result.isSuccess() ? GatewayStatus.SUCCESS.name() : result.failure().name(),
                result.message(),
                result.serviceId(),
                result.lookupKey(),
                record == null ? null : record.source(),
                record == null ? null : SqlTime.text(record.fetchedAt()),
                result.creditsCharged(),
                record == null ? null : record.payload()
        );
    }

    public static HttpStatus httpStatus(PipelineResult result) {
        return result.isSuccess() ? HttpStatus.OK : result.failure().httpStatus();
    }
}
