package com.kmg.gateway.api;

import com.kmg.gateway.dto.AccountView;
import com.kmg.gateway.dto.AdminServiceView;
import com.kmg.gateway.dto.ApiKeyView;
import com.kmg.gateway.dto.CreateApiKeyRequest;
import com.kmg.gateway.dto.CreditAdjustmentRequest;
import com.kmg.gateway.dto.IssuedApiKeyResponse;
import com.kmg.gateway.dto.KeyGrantsRequest;
import com.kmg.gateway.dto.ServiceStatusRequest;
import com.kmg.gateway.dto.UsageLogView;
import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.service.ApiKeyService;
import com.kmg.gateway.service.CreditLedger;
import com.kmg.gateway.service.EventService;
import com.kmg.gateway.service.ServiceRegistry;
import com.kmg.gateway.service.UsageReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {
    private final ServiceRegistry serviceRegistry;
    private final ApiKeyService apiKeyService;
    private final CreditLedger creditLedger;
    private final UsageReportService usageReportService;
    private final EventService eventService;

    public AdminController(
            ServiceRegistry serviceRegistry,
            ApiKeyService apiKeyService,
            CreditLedger creditLedger,
            UsageReportService usageReportService,
            EventService eventService
    ) {
        this.serviceRegistry = serviceRegistry;
        this.apiKeyService = apiKeyService;
        this.creditLedger = creditLedger;
        this.usageReportService = usageReportService;
        this.eventService = eventService;
    }

    @GetMapping("/services")
    public List<AdminServiceView> services() {
        return serviceRegistry.listServices().stream().map(AdminServiceView::from).toList();
    }

    @PatchMapping("/services/{id}")
    public AdminServiceView setServiceStatus(@PathVariable String id, @Valid @RequestBody ServiceStatusRequest request) {
        return AdminServiceView.from(serviceRegistry.setActive(id, request.active()));
    }

    @GetMapping("/keys")
    public List<ApiKeyView> keys(@RequestParam("callerId") String callerId) {
        return apiKeyService.listKeys(callerId).stream().map(ApiKeyView::from).toList();
    }

    @PostMapping("/keys")
    public ResponseEntity<IssuedApiKeyResponse> createKey(@Valid @RequestBody CreateApiKeyRequest request) {
        ApiKeyService.IssuedKey issued = apiKeyService.issue(request.callerId(), request.label(), request.services());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new IssuedApiKeyResponse(issued.rawKey(), ApiKeyView.from(issued.grant())));
    }

    @DeleteMapping("/keys/{keyId}")
    public ResponseEntity<Void> revokeKey(@PathVariable String keyId) {
        apiKeyService.revoke(keyId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/keys/{keyId}/services")
    public ApiKeyView replaceGrants(@PathVariable String keyId, @Valid @RequestBody KeyGrantsRequest request) {
        return ApiKeyView.from(apiKeyService.replaceGrants(keyId, request.services()));
    }

    @GetMapping("/accounts/{callerId}")
    public AccountView account(@PathVariable String callerId) {
        return toView(creditLedger.balance(callerId));
    }

    @PostMapping("/accounts/{callerId}/credits")
    public AccountView adjustCredits(@PathVariable String callerId, @Valid @RequestBody CreditAdjustmentRequest request) {
        CreditAccount updated = creditLedger.adjustBalance(callerId, request.delta(), request.reason());
        eventService.publish(EventService.CREDIT_BALANCE, callerId, request.reason(),
                Map.of("balance", updated.balance()));
        return toView(updated);
    }

    @GetMapping("/usage")
    public List<UsageLogView> usage(
            @RequestParam(value = "callerId", required = false) String callerId,
            @RequestParam(value = "limit", defaultValue = "50") int limit
    ) {
        return usageReportService.recent(callerId, limit).stream().map(UsageLogView::from).toList();
    }

    @GetMapping("/events")
    public SseEmitter events(@RequestParam(value = "callerId", required = false) String callerId) {
        return eventService.subscribe(callerId);
    }

    private AccountView toView(CreditAccount account) {
        List<ApiKeyView> keys = apiKeyService.listKeys(account.callerId()).stream().map(ApiKeyView::from).toList();
        return AccountView.from(account, keys);
    }
}
