package com.kmg.gateway.service;

import com.kmg.gateway.config.GatewayProperties;
import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.model.CreditReservation;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.ReservationToken;
import com.kmg.gateway.repo.CreditAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-caller credit balances with reserve / commit / release semantics.
 *
 * <p>Operations on one caller are serialised twice: by a striped in-process lock, and by a version
 * compare-and-set on the account row for writers outside this process. A reservation leaves
 * PENDING exactly once, so a refund can neither be lost nor applied twice.</p>
 */
@Service
public class CreditLedger {
    private static final Logger log = LoggerFactory.getLogger(CreditLedger.class);
    private static final int LOCK_STRIPES = 64;

    private final CreditAccountRepository repository;
    private final GatewayProperties properties;
    private final ReentrantLock[] callerLocks = new ReentrantLock[LOCK_STRIPES];

    public CreditLedger(CreditAccountRepository repository, GatewayProperties properties) {
        this.repository = repository;
        this.properties = properties;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            callerLocks[i] = new ReentrantLock();
        }
    }

    public ReservationToken reserve(String callerId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Reservation amount must not be negative: " + amount);
        }
        return withCallerLock(callerId, () -> {
            int maxAttempts = properties.getLedger().getMaxAttempts();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                CreditAccount account = repository.findAccount(callerId)
                        .orElseGet(() -> amount == 0 ? repository.ensureAccount(callerId) : CreditAccount.empty(callerId));
                if (account.balance() < amount) {
                    throw new GatewayException(
                            FailureReason.INSUFFICIENT_CREDITS,
                            "Insufficient credits. Required: " + amount + ", Available: " + account.balance(),
                            callerId,
                            null
                    );
                }

                String reservationId = UUID.randomUUID().toString();
                if (repository.reserve(callerId, account.version(), amount, reservationId)) {
                    log.debug("Reserved {} credit(s) for {} as {}", amount, callerId, reservationId);
                    return new ReservationToken(reservationId, callerId, amount);
                }
                log.debug("Reserve conflict for {} at version {} (attempt {})", callerId, account.version(), attempt);
            }
            throw new LedgerConflictException(callerId, "Could not reserve credits after " + maxAttempts + " attempts");
        });
    }

    /**
     * Finalizes a reservation. The balance was already decremented by {@link #reserve}, so this only
     * closes the reservation. Never throws.
     *
     * @return true if the reservation moved to COMMITTED; false if it had already been released
     *         (the credits went back to the caller) or storage kept failing
     */
    public boolean commit(ReservationToken token) {
        int maxAttempts = properties.getLedger().getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (repository.commitReservation(token.reservationId())) {
                    return true;
                }
                log.warn("Reservation {} was no longer pending at commit", token.reservationId());
                return false;
            } catch (DataAccessException e) {
                log.warn("Commit of reservation {} failed (attempt {}): {}", token.reservationId(), attempt, e.getMessage());
            }
        }
        log.error("Reservation {} for {} could not be committed", token.reservationId(), token.callerId());
        return false;
    }

    /**
     * Refunds a reservation. Returns true if this call performed the refund, false if the reservation
     * was already settled. Retries storage failures; a reservation that still cannot be released stays
     * PENDING and is picked up by {@link ReservationReconciler}.
     */
    public boolean release(ReservationToken token, String reason) {
        // An interrupted caller still has to refund; the flag is restored afterwards.
        boolean interrupted = Thread.interrupted();
        try {
            int maxAttempts = properties.getLedger().getMaxAttempts();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    boolean refunded = withCallerLock(token.callerId(),
                            () -> repository.releaseReservation(token.reservationId(), reason));
                    if (refunded) {
                        log.debug("Released {} credit(s) for {} ({})", token.amount(), token.callerId(), reason);
                    } else {
                        log.warn("Reservation {} was already settled, nothing refunded", token.reservationId());
                    }
                    return refunded;
                } catch (DataAccessException | LedgerConflictException e) {
                    log.warn("Release of reservation {} failed (attempt {}): {}",
                            token.reservationId(), attempt, e.getMessage());
                }
            }
            log.error("Reservation {} for {} left pending after {} release attempts",
                    token.reservationId(), token.callerId(), maxAttempts);
            return false;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public CreditAccount balance(String callerId) {
        return repository.findAccount(callerId).orElse(CreditAccount.empty(callerId));
    }

    /**
     * Adds {@code delta} (may be negative) to the caller's balance, creating the account if needed.
     * The balance is floored at zero.
     */
    public CreditAccount adjustBalance(String callerId, long delta, String reason) {
        return withCallerLock(callerId, () -> {
            int maxAttempts = properties.getLedger().getMaxAttempts();
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                CreditAccount account = repository.ensureAccount(callerId);
                long next = Math.max(0, account.balance() + delta);
                if (repository.setBalance(callerId, account.version(), account.balance(), next, reason)) {
                    log.info("Credits for {} adjusted {} -> {} ({})", callerId, account.balance(), next, reason);
                    return repository.findAccount(callerId).orElseThrow();
                }
            }
            throw new LedgerConflictException(callerId, "Could not adjust credits after " + maxAttempts + " attempts");
        });
    }

    /**
     * Releases every reservation still pending that was created before {@code cutoff}.
     */
    public int releasePendingBefore(OffsetDateTime cutoff, String reason) {
        List<CreditReservation> pending = repository.findPendingCreatedBefore(cutoff);
        int released = 0;
        for (CreditReservation reservation : pending) {
            ReservationToken token = new ReservationToken(reservation.id(), reservation.callerId(), reservation.amount());
            if (release(token, reason)) {
                released++;
            }
        }
        return released;
    }

    private <T> T withCallerLock(String callerId, Supplier<T> action) {
        ReentrantLock lock = callerLocks[Math.floorMod(callerId.hashCode(), LOCK_STRIPES)];
        long waitMillis = properties.getLedger().getLockTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerConflictException(callerId, "Interrupted while waiting for the ledger lock");
        }
        if (!acquired) {
            throw new LedgerConflictException(callerId, "Timed out waiting for the ledger lock after " + waitMillis + "ms");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
