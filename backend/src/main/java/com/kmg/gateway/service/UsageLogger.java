package com.kmg.gateway.service;

import com.kmg.gateway.model.UsageLogEntry;

/**
 * Sink for per-request usage entries. Best effort: implementations must not throw back into the request.
 */
public interface UsageLogger {

    void append(UsageLogEntry entry);
}
