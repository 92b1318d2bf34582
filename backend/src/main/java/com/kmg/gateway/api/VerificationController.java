package com.kmg.gateway.api;

import com.kmg.gateway.config.GatewayProperties;
import com.kmg.gateway.dto.GatewayResponse;
import com.kmg.gateway.dto.VerificationRequest;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.PipelineResult;
import com.kmg.gateway.service.RequestContext;
import com.kmg.gateway.service.RequestPipeline;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/api/v1/services")
public class VerificationController {
    public static final String API_KEY_HEADER = "X-API-Key";
    private static final Logger log = LoggerFactory.getLogger(VerificationController.class);

    private final RequestPipeline requestPipeline;
    private final ExecutorService requestExecutor;
    private final GatewayProperties properties;

    public VerificationController(
            RequestPipeline requestPipeline,
            @Qualifier("gatewayRequestExecutor") ExecutorService requestExecutor,
            GatewayProperties properties
    ) {
        this.requestPipeline = requestPipeline;
        this.requestExecutor = requestExecutor;
        this.properties = properties;
    }

    /**
     * Runs the pipeline on the request executor. When the deadline passes first, the caller gets
     * REQUEST_ABANDONED and the pipeline finishes in the background, refunding its reservation. A
     * result that arrives after the deadline was never seen by the caller, so its charge is refunded.
     */
    @PostMapping("/{serviceId}")
    public DeferredResult<ResponseEntity<GatewayResponse>> verify(
            @PathVariable String serviceId,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody VerificationRequest request
    ) {
        String lookupKey = RequestPipeline.normalizeLookupKey(request.lookupKey());
        RequestContext context = RequestContext.create();
        DeferredResult<ResponseEntity<GatewayResponse>> deferred =
                new DeferredResult<>(properties.getPipeline().getRequestTimeout().toMillis());

        deferred.onTimeout(() -> {
            context.abandon();
            log.warn("Request {} for {}/{} timed out", context.requestId(), serviceId, lookupKey);
            deferred.setResult(toResponse(PipelineResult.failed(
                    FailureReason.REQUEST_ABANDONED, "Request timed out", serviceId, lookupKey)));
        });
        deferred.onError(ex -> {
            context.abandon();
            log.warn("Request {} for {}/{} failed in transport: {}", context.requestId(), serviceId, lookupKey, ex.getMessage());
        });

        try {
            requestExecutor.submit(() -> {
                PipelineResult result = requestPipeline.execute(apiKey, serviceId, lookupKey, context);
                if (!deferred.setResult(toResponse(result))) {
                    log.warn("Request {} for {}/{} finished after its response was sent ({})",
                            context.requestId(), serviceId, lookupKey, result.status());
                    requestPipeline.refundUndelivered(context);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Request executor saturated, rejecting {}/{}", serviceId, lookupKey);
            deferred.setResult(toResponse(PipelineResult.failed(
                    FailureReason.INTERNAL_ERROR, "Gateway is overloaded, retry later", serviceId, lookupKey)));
        }
        return deferred;
    }

    private static ResponseEntity<GatewayResponse> toResponse(PipelineResult result) {
        return ResponseEntity.status(GatewayResponse.httpStatus(result)).body(GatewayResponse.from(result));
    }
}
