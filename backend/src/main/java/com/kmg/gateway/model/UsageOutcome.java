package com.kmg.gateway.model;

public enum UsageOutcome {
    SUCCESS,
    NOT_FOUND,
    ERROR
}
