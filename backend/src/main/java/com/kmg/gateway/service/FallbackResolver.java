package com.kmg.gateway.service;

import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.model.UsageOutcome;
import com.kmg.gateway.model.VerificationRecord;
import com.kmg.gateway.provider.ExternalProvider;
import com.kmg.gateway.provider.ProviderRegistry;
import com.kmg.gateway.provider.ProviderResponse;
import com.kmg.gateway.provider.ProviderUnavailableException;
import com.kmg.gateway.repo.RecordStore;
import com.kmg.gateway.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a record from the local store first, then from the service's providers in chain order.
 *
 * <p>A provider that is unknown, unconfigured, slow or failing only moves resolution on to the next
 * provider. The first provider hit is written back to the store, so the next lookup of the same
 * (service, key) stays local.</p>
 */
@Service
public class FallbackResolver {
    private static final Logger log = LoggerFactory.getLogger(FallbackResolver.class);

    private final RecordStore recordStore;
    private final ProviderRegistry providerRegistry;
    private final ExecutorService providerExecutor;

    public FallbackResolver(
            RecordStore recordStore,
            ProviderRegistry providerRegistry,
            @Qualifier("providerExecutor") ExecutorService providerExecutor
    ) {
        this.recordStore = recordStore;
        this.providerRegistry = providerRegistry;
        this.providerExecutor = providerExecutor;
    }

    public VerificationRecord resolve(ServiceDefinition service, String lookupKey) {
        return resolve(service, lookupKey, RequestContext.create());
    }

    public VerificationRecord resolve(ServiceDefinition service, String lookupKey, RequestContext context) {
        Optional<VerificationRecord> local = recordStore.get(service.id(), lookupKey);
        if (local.isPresent()) {
            log.debug("{}/{} served from local store", service.id(), lookupKey);
            return local.get().withSource(VerificationRecord.LOCAL_SOURCE);
        }

        boolean deniedByProvider = false;
        for (String providerId : service.fallbackChain()) {
            ensureNotAbandoned(context, service, lookupKey);

            Optional<ExternalProvider> maybeProvider = providerRegistry.find(providerId);
            if (maybeProvider.isEmpty()) {
                log.warn("Service {} names unknown provider {}, skipping", service.id(), providerId);
                continue;
            }
            ExternalProvider provider = maybeProvider.get();
            if (!provider.isConfigured()) {
                log.debug("Provider {} not configured, skipping for {}", providerId, service.id());
                continue;
            }

            ProviderResponse response;
            try {
                response = invoke(provider, service.id(), lookupKey);
            } catch (ProviderUnavailableException e) {
                log.warn("Provider {} unavailable for {}/{}: {}", providerId, service.id(), lookupKey, e.getMessage());
                continue;
            }

            if (!response.isFound()) {
                deniedByProvider |= response.status() == ProviderResponse.Status.NOT_FOUND;
                log.info("Provider {} had no record for {}/{} ({}: {})",
                        providerId, service.id(), lookupKey, response.status(), response.detail());
                continue;
            }

            if (context.isAbandoned()) {
                log.info("Discarding {} result for {}/{}: request {} was abandoned",
                        providerId, service.id(), lookupKey, context.requestId());
                throw new GatewayException(FailureReason.REQUEST_ABANDONED, "Request was abandoned");
            }

            VerificationRecord record = new VerificationRecord(
                    service.id(),
                    lookupKey,
                    response.payload(),
                    provider.id(),
                    SqlTime.now()
            );
            persist(record);
            log.info("{}/{} resolved by provider {}", service.id(), lookupKey, providerId);
            return record;
        }

        // NOT_FOUND only when some provider actually answered; an empty, unconfigured or failing chain is an ERROR.
        throw new GatewayException(
                FailureReason.RECORD_NOT_FOUND,
                "No record found for " + service.id() + " with key " + lookupKey,
                deniedByProvider ? UsageOutcome.NOT_FOUND : UsageOutcome.ERROR
        );
    }

    private ProviderResponse invoke(ExternalProvider provider, String serviceId, String lookupKey) {
        Duration timeout = provider.timeout();
        Future<ProviderResponse> future;
        try {
            future = providerExecutor.submit(() -> provider.fetch(serviceId, lookupKey, timeout));
        } catch (RejectedExecutionException e) {
            throw new ProviderUnavailableException(provider.id(), "Provider executor rejected the call", e);
        }

        try {
            ProviderResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return response != null ? response : ProviderResponse.unavailable("Provider returned nothing");
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderUnavailableException(provider.id(), "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProviderUnavailableException(provider.id(), String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(provider.id(), "Interrupted while waiting for provider", e);
        }
    }

    private void persist(VerificationRecord record) {
        try {
            recordStore.put(record);
        } catch (RuntimeException e) {
            // The caller still gets the fetched record; the next lookup goes external again.
            log.error("Failed to persist {}/{} from {}: {}",
                    record.serviceId(), record.lookupKey(), record.source(), e.getMessage(), e);
        }
    }

    private void ensureNotAbandoned(RequestContext context, ServiceDefinition service, String lookupKey) {
        if (context.isAbandoned()) {
            log.info("Stopping resolution of {}/{}: request {} was abandoned", service.id(), lookupKey, context.requestId());
            throw new GatewayException(FailureReason.REQUEST_ABANDONED, "Request was abandoned");
        }
    }
}
