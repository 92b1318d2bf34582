package com.kmg.gateway.model;

public enum PipelineStage {
    AUTHORIZING,
    SERVICE_CHECKING,
    CREDIT_RESERVING,
    RESOLVING,
    SETTLING,
    LOG_COMPLETE,
    FAILED
}
