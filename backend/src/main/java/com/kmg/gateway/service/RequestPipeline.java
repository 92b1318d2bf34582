package com.kmg.gateway.service;

import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.model.Entitlement;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.PipelineResult;
import com.kmg.gateway.model.PipelineStage;
import com.kmg.gateway.model.ReservationToken;
import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.model.VerificationRecord;
import com.kmg.gateway.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one verification request through its stages:
 * AUTHORIZING, SERVICE_CHECKING, CREDIT_RESERVING, RESOLVING, SETTLING, LOG_COMPLETE.
 *
 * <p>Once the lookup key is accepted, every failure becomes a {@link PipelineResult}; nothing escapes
 * {@link #execute}. Credits are only charged when a record is returned to a live request. Once
 * reserved, a failure releases the reservation before the result is built. Exactly one usage entry
 * is appended per accepted call.</p>
 */
@Service
public class RequestPipeline {
    private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);

    private final AccessGate accessGate;
    private final ServiceRegistry serviceRegistry;
    private final CreditLedger creditLedger;
    private final FallbackResolver fallbackResolver;
    private final UsageLogger usageLogger;
    private final EventService eventService;

    public RequestPipeline(
            AccessGate accessGate,
            ServiceRegistry serviceRegistry,
            CreditLedger creditLedger,
            FallbackResolver fallbackResolver,
            UsageLogger usageLogger,
            EventService eventService
    ) {
        this.accessGate = accessGate;
        this.serviceRegistry = serviceRegistry;
        this.creditLedger = creditLedger;
        this.fallbackResolver = fallbackResolver;
        this.usageLogger = usageLogger;
        this.eventService = eventService;
    }

    /**
     * Trims and upper-cases a lookup key. Identifiers such as registration numbers are
     * case-insensitive, so "mh12ab1234 " and "MH12AB1234" share one stored record.
     */
    public static String normalizeLookupKey(String lookupKey) {
        if (lookupKey == null || lookupKey.isBlank()) {
            throw new IllegalArgumentException("lookupKey must not be blank");
        }
        return lookupKey.trim().toUpperCase(Locale.ROOT);
    }

    public PipelineResult execute(String apiKey, String serviceId, String lookupKey) {
        return execute(apiKey, serviceId, lookupKey, RequestContext.create());
    }

    /**
     * Runs the request and appends its usage entry.
     *
     * @throws IllegalArgumentException if the lookup key is blank. Such a call is rejected before it
     *         enters the pipeline, so nothing is reserved and no usage entry is written; the HTTP
     *         layer turns it into a 400.
     */
    public PipelineResult execute(String apiKey, String serviceId, String rawLookupKey, RequestContext context) {
        long startedAt = System.nanoTime();
        String lookupKey = normalizeLookupKey(rawLookupKey);
        Trace trace = new Trace(serviceId, lookupKey);

        PipelineResult result;
        try {
            result = run(apiKey, serviceId, lookupKey, context, trace);
        } catch (RuntimeException e) {
            // Failures before a reservation exists; anything after is handled inside run().
            log.error("Unexpected failure at {} for {}/{}: {}", trace.stage, serviceId, lookupKey, e.getMessage(), e);
            result = PipelineResult.failed(FailureReason.INTERNAL_ERROR, "Internal error", serviceId, lookupKey);
        }

        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;
        appendUsage(trace, result, elapsedMs);
        publishEvents(trace, result, elapsedMs);
        return result;
    }

    private PipelineResult run(String apiKey, String serviceId, String lookupKey, RequestContext context, Trace trace) {
        ServiceDefinition service;
        ReservationToken reservation;
        try {
            trace.stage = PipelineStage.AUTHORIZING;
            Entitlement entitlement = accessGate.authorize(apiKey, serviceId);
            trace.callerId = entitlement.callerId();
            trace.keyId = entitlement.keyId();

            trace.stage = PipelineStage.SERVICE_CHECKING;
            service = serviceRegistry.resolveService(serviceId);

            if (context.isAbandoned()) {
                log.info("{}/{} abandoned before reserving credits (request {})", serviceId, lookupKey, context.requestId());
                return PipelineResult.failed(FailureReason.REQUEST_ABANDONED, "Request was abandoned", serviceId, lookupKey);
            }

            trace.stage = PipelineStage.CREDIT_RESERVING;
            reservation = creditLedger.reserve(entitlement.callerId(), service.cost());
        } catch (GatewayException e) {
            trace.noteIdentity(e.getCallerId(), e.getKeyId());
            log.info("{}/{} rejected at {}: {} ({})", serviceId, lookupKey, trace.stage, e.getReason(), e.getMessage());
            return PipelineResult.failed(e.getReason(), e.getMessage(), serviceId, lookupKey);
        } catch (LedgerConflictException e) {
            log.warn("{}/{} rejected at {}: ledger busy for {}", serviceId, lookupKey, trace.stage, e.getCallerId());
            return PipelineResult.failed(FailureReason.LEDGER_BUSY, "Credit ledger is busy, retry later", serviceId, lookupKey);
        }

        VerificationRecord record;
        try {
            trace.stage = PipelineStage.RESOLVING;
            record = fallbackResolver.resolve(service, lookupKey, context);
        } catch (GatewayException e) {
            creditLedger.release(reservation, "Refund: " + e.getReason());
            log.info("{}/{} failed at {}: {} ({})", serviceId, lookupKey, trace.stage, e.getReason(), e.getMessage());
            return PipelineResult.failed(e.getReason(), e.getOutcome(), e.getMessage(), serviceId, lookupKey);
        } catch (RuntimeException e) {
            creditLedger.release(reservation, "Refund: " + FailureReason.INTERNAL_ERROR);
            log.error("{}/{} failed at {}: {}", serviceId, lookupKey, trace.stage, e.getMessage(), e);
            return PipelineResult.failed(FailureReason.INTERNAL_ERROR, "Internal error", serviceId, lookupKey);
        }

        if (context.isAbandoned()) {
            creditLedger.release(reservation, "Refund: " + FailureReason.REQUEST_ABANDONED);
            log.info("{}/{} resolved after request {} was abandoned, not charged", serviceId, lookupKey, context.requestId());
            return PipelineResult.failed(FailureReason.REQUEST_ABANDONED, "Request was abandoned", serviceId, lookupKey);
        }

        trace.stage = PipelineStage.SETTLING;
        trace.source = record.source();
        ReservationToken charge = settle(reservation, serviceId, lookupKey);
        trace.stage = PipelineStage.LOG_COMPLETE;
        if (charge == null) {
            return PipelineResult.success(record, 0);
        }
        context.markCharged(charge);
        return PipelineResult.success(record, charge.amount());
    }

    /**
     * Commits the reservation. If it was released underneath the request (the reconciler took it for
     * an orphan), the caller is charged again with a fresh reservation. Returns the committed
     * reservation, or null when the record goes out uncharged.
     */
    private ReservationToken settle(ReservationToken reservation, String serviceId, String lookupKey) {
        if (creditLedger.commit(reservation)) {
            return reservation;
        }
        try {
            ReservationToken retry = creditLedger.reserve(reservation.callerId(), reservation.amount());
            if (creditLedger.commit(retry)) {
                log.warn("{}/{} re-charged {} to {} after its reservation was released early",
                        serviceId, lookupKey, retry.amount(), retry.callerId());
                return retry;
            }
        } catch (GatewayException | LedgerConflictException e) {
            log.warn("{}/{} could not re-charge {}: {}", serviceId, lookupKey, reservation.callerId(), e.getMessage());
        }
        log.error("{}/{} delivered without charge to {}", serviceId, lookupKey, reservation.callerId());
        return null;
    }

    /**
     * Refunds the charge of a request whose response could not be delivered, for instance because the
     * HTTP deadline passed while the pipeline was committing. Safe to call more than once.
     */
    public void refundUndelivered(RequestContext context) {
        ReservationToken charge = context.takeCharge();
        if (charge == null || charge.amount() == 0) {
            return;
        }
        try {
            creditLedger.adjustBalance(charge.callerId(), charge.amount(), "Refund: response not delivered");
            log.warn("Refunded {} credit(s) to {}: response for request {} was not delivered",
                    charge.amount(), charge.callerId(), context.requestId());
        } catch (RuntimeException e) {
            log.error("Refund of undelivered request {} for {} failed: {}",
                    context.requestId(), charge.callerId(), e.getMessage(), e);
        }
    }

    private void appendUsage(Trace trace, PipelineResult result, long elapsedMs) {
        UsageLogEntry entry = new UsageLogEntry(
                null,
                trace.callerId,
                trace.keyId,
                trace.serviceId,
                trace.lookupKey,
                result.outcome(),
                result.isSuccess() ? null : result.failure().name(),
                trace.source,
                result.creditsCharged(),
                elapsedMs,
                SqlTime.now()
        );
        try {
            usageLogger.append(entry);
        } catch (RuntimeException e) {
            log.warn("Usage log append failed for {}/{}: {}", trace.serviceId, trace.lookupKey, e.getMessage());
        }
    }

    private void publishEvents(Trace trace, PipelineResult result, long elapsedMs) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("serviceId", trace.serviceId);
            payload.put("lookupKey", trace.lookupKey);
            payload.put("status", result.status().name());
            payload.put("source", trace.source);
            payload.put("creditsCharged", result.creditsCharged());
            payload.put("responseTimeMs", elapsedMs);
            eventService.publish(EventService.API_CALL, trace.callerId, result.message(), payload);

            if (result.isSuccess() && trace.callerId != null) {
                CreditAccount account = creditLedger.balance(trace.callerId);
                eventService.publish(EventService.CREDIT_BALANCE, trace.callerId, "Balance updated",
                        Map.of("balance", account.balance()));
            }
        } catch (RuntimeException e) {
            log.debug("Event publish failed: {}", e.getMessage());
        }
    }

    private static final class Trace {
        private final String serviceId;
        private final String lookupKey;
        private PipelineStage stage = PipelineStage.AUTHORIZING;
        private String callerId;
        private String keyId;
        private String source;

        private Trace(String serviceId, String lookupKey) {
            this.serviceId = serviceId;
            this.lookupKey = lookupKey;
        }

        private void noteIdentity(String callerId, String keyId) {
            if (this.callerId == null) {
                this.callerId = callerId;
            }
            if (this.keyId == null) {
                this.keyId = keyId;
            }
        }
    }
}
