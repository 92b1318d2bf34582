package com.kmg.gateway.model;

public record PipelineResult(
        PipelineStage stage,
        FailureReason failure,
        UsageOutcome outcome,
        String message,
        String serviceId,
        String lookupKey,
        VerificationRecord record,
        long creditsCharged
) {
    public static PipelineResult success(VerificationRecord record, long creditsCharged) {
        return new PipelineResult(PipelineStage.LOG_COMPLETE, null, UsageOutcome.SUCCESS, "Record resolved",
                record.serviceId(), record.lookupKey(), record, creditsCharged);
    }

    public static PipelineResult failed(FailureReason failure, String message, String serviceId, String lookupKey) {
        return failed(failure, failure.outcome(), message, serviceId, lookupKey);
    }

    public static PipelineResult failed(FailureReason failure, UsageOutcome outcome, String message,
                                        String serviceId, String lookupKey) {
        return new PipelineResult(PipelineStage.FAILED, failure, outcome, message, serviceId, lookupKey, null, 0);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public GatewayStatus status() {
        return failure == null ? GatewayStatus.SUCCESS : failure.status();
    }
}
