package com.kmg.gateway.repo;

import com.kmg.gateway.model.VerificationRecord;

import java.util.Optional;

/**
 * Persisted verification records, one per (service, lookup key).
 */
public interface RecordStore {

    /**
     * Returns the stored record if it is present and still usable. Staleness rules belong to the implementation.
     */
    Optional<VerificationRecord> get(String serviceId, String lookupKey);

    /**
     * Inserts or overwrites the record for its (service, lookup key) identity.
     */
    void put(VerificationRecord record);
}
