package com.kmg.gateway.service;

import com.kmg.gateway.config.GatewayProperties;
import com.kmg.gateway.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases reservations that no request will ever settle: those left PENDING by a crash,
 * and those whose release kept failing.
 */
@Component
public class ReservationReconciler {
    private static final Logger log = LoggerFactory.getLogger(ReservationReconciler.class);

    private final CreditLedger creditLedger;
    private final GatewayProperties properties;

    public ReservationReconciler(CreditLedger creditLedger, GatewayProperties properties) {
        this.creditLedger = creditLedger;
        this.properties = properties;
    }

    /**
     * Run once at startup, before requests are served: every pending reservation belongs to a dead process.
     */
    public int recoverAfterRestart() {
        int released = creditLedger.releasePendingBefore(SqlTime.now().plusSeconds(1), "Released after restart");
        if (released > 0) {
            log.warn("Released {} reservation(s) left pending by a previous run", released);
        }
        return released;
    }

    @Scheduled(
            initialDelayString = "${gateway.ledger.reconcile-interval-ms:60000}",
            fixedDelayString = "${gateway.ledger.reconcile-interval-ms:60000}"
    )
    public void releaseOrphans() {
        try {
            int released = creditLedger.releasePendingBefore(
                    SqlTime.now().minus(properties.getLedger().getOrphanAfter()),
                    "Released orphaned reservation"
            );
            if (released > 0) {
                log.warn("Released {} orphaned reservation(s)", released);
            }
        } catch (Exception e) {
            log.error("Reservation reconciliation failed: {}", e.getMessage(), e);
        }
    }
}
