package com.kmg.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.model.Entitlement;
import com.kmg.gateway.model.FailureReason;
import com.kmg.gateway.model.GatewayStatus;
import com.kmg.gateway.model.PipelineResult;
import com.kmg.gateway.model.PipelineStage;
import com.kmg.gateway.model.ReservationToken;
import com.kmg.gateway.model.ServiceDefinition;
import com.kmg.gateway.model.UsageLogEntry;
import com.kmg.gateway.model.UsageOutcome;
import com.kmg.gateway.model.VerificationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RequestPipeline")
class RequestPipelineTest {
    private static final String API_KEY = "vg_key";
    private static final String SERVICE_ID = "vehicle-rc-verification";
    private static final String KEY = "MH12AB1234";

    @Mock
    private AccessGate accessGate;
    @Mock
    private ServiceRegistry serviceRegistry;
    @Mock
    private CreditLedger creditLedger;
    @Mock
    private FallbackResolver fallbackResolver;
    @Mock
    private UsageLogger usageLogger;
    @Mock
    private EventService eventService;

    @InjectMocks
    private RequestPipeline pipeline;

    private ServiceDefinition service;
    private ReservationToken token;

    @BeforeEach
    void setUp() {
        service = new ServiceDefinition(SERVICE_ID, "RC", true, List.of("api1", "api2"), 2, null);
        token = new ReservationToken("res-1", "caller-1", 2);
    }

    private void givenAuthorizedAndReserved() {
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        when(creditLedger.reserve("caller-1", 2)).thenReturn(token);
    }

    private VerificationRecord record() {
        return new VerificationRecord(SERVICE_ID, KEY,
                new ObjectMapper().createObjectNode().put("owner", "A"), VerificationRecord.LOCAL_SOURCE, OffsetDateTime.now());
    }

    private UsageLogEntry loggedEntry() {
        ArgumentCaptor<UsageLogEntry> captor = ArgumentCaptor.forClass(UsageLogEntry.class);
        verify(usageLogger, times(1)).append(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Should reserve, resolve, commit and log a success")
    void shouldChargeOnSuccess() {
        // Given
        givenAuthorizedAndReserved();
        VerificationRecord record = new VerificationRecord(SERVICE_ID, KEY,
                new ObjectMapper().createObjectNode().put("owner", "A"), "api2", OffsetDateTime.now());
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class))).thenReturn(record);
        when(creditLedger.commit(token)).thenReturn(true);
        when(creditLedger.balance("caller-1")).thenReturn(new CreditAccount("caller-1", 8, 3, null));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, " mh12ab1234 ");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.stage()).isEqualTo(PipelineStage.LOG_COMPLETE);
        assertThat(result.creditsCharged()).isEqualTo(2);
        assertThat(result.record().source()).isEqualTo("api2");

        InOrder order = inOrder(accessGate, serviceRegistry, creditLedger, fallbackResolver, usageLogger);
        order.verify(accessGate).authorize(API_KEY, SERVICE_ID);
        order.verify(serviceRegistry).resolveService(SERVICE_ID);
        order.verify(creditLedger).reserve("caller-1", 2);
        order.verify(fallbackResolver).resolve(eq(service), eq(KEY), any(RequestContext.class));
        order.verify(creditLedger).commit(token);
        order.verify(usageLogger).append(any());
        verify(creditLedger, never()).release(any(), anyString());

        UsageLogEntry entry = loggedEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.SUCCESS);
        assertThat(entry.creditsCharged()).isEqualTo(2);
        assertThat(entry.source()).isEqualTo("api2");
        assertThat(entry.callerId()).isEqualTo("caller-1");
        assertThat(entry.lookupKey()).isEqualTo(KEY);
        verify(eventService).publish(eq(EventService.CREDIT_BALANCE), eq("caller-1"), anyString(), any());
    }

    @Test
    @DisplayName("Should fail authorization without touching credits but still log once")
    void shouldNotTouchCreditsWhenUnauthorized() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID))
                .thenThrow(new GatewayException(FailureReason.UNAUTHENTICATED, "Invalid API key"));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.status()).isEqualTo(GatewayStatus.UNAUTHENTICATED);
        assertThat(result.stage()).isEqualTo(PipelineStage.FAILED);
        verifyNoInteractions(serviceRegistry, creditLedger, fallbackResolver);

        UsageLogEntry entry = loggedEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.ERROR);
        assertThat(entry.failureCode()).isEqualTo("UNAUTHENTICATED");
        assertThat(entry.callerId()).isNull();
        assertThat(entry.creditsCharged()).isZero();
    }

    @Test
    @DisplayName("Should log the caller of a forbidden request")
    void shouldLogCallerOfForbiddenRequest() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID))
                .thenThrow(new GatewayException(FailureReason.FORBIDDEN, "no grant", "caller-1", "key-1"));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.status()).isEqualTo(GatewayStatus.FORBIDDEN);
        assertThat(loggedEntry().callerId()).isEqualTo("caller-1");
        verifyNoInteractions(creditLedger);
    }

    @Test
    @DisplayName("Should reject an inactive service before reserving")
    void shouldRejectInactiveServiceBeforeReserving() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID))
                .thenThrow(new GatewayException(FailureReason.SERVICE_INACTIVE, "inactive"));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.failure()).isEqualTo(FailureReason.SERVICE_INACTIVE);
        assertThat(result.status()).isEqualTo(GatewayStatus.SERVICE_UNAVAILABLE);
        verifyNoInteractions(creditLedger, fallbackResolver);
        assertThat(loggedEntry().failureCode()).isEqualTo("SERVICE_INACTIVE");
    }

    @Test
    @DisplayName("Should stop at insufficient credits without resolving")
    void shouldStopAtInsufficientCredits() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        when(creditLedger.reserve("caller-1", 2))
                .thenThrow(new GatewayException(FailureReason.INSUFFICIENT_CREDITS, "Insufficient credits", "caller-1", null));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.status()).isEqualTo(GatewayStatus.INSUFFICIENT_CREDITS);
        verifyNoInteractions(fallbackResolver);
        verify(creditLedger, never()).release(any(), anyString());
    }

    @Test
    @DisplayName("Should map an exhausted ledger retry to LEDGER_BUSY")
    void shouldMapLedgerConflict() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        when(creditLedger.reserve("caller-1", 2)).thenThrow(new LedgerConflictException("caller-1", "busy"));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.failure()).isEqualTo(FailureReason.LEDGER_BUSY);
        assertThat(result.status()).isEqualTo(GatewayStatus.SERVICE_UNAVAILABLE);
        verifyNoInteractions(fallbackResolver);
    }

    @Test
    @DisplayName("Should release the reservation when nothing is found")
    void shouldReleaseWhenNotFound() {
        // Given
        givenAuthorizedAndReserved();
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class)))
                .thenThrow(new GatewayException(FailureReason.RECORD_NOT_FOUND, "none", UsageOutcome.ERROR));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.status()).isEqualTo(GatewayStatus.NOT_FOUND);
        assertThat(result.creditsCharged()).isZero();
        verify(creditLedger, times(1)).release(eq(token), anyString());
        verify(creditLedger, never()).commit(any());

        UsageLogEntry entry = loggedEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.ERROR);
        assertThat(entry.failureCode()).isEqualTo("RECORD_NOT_FOUND");
        assertThat(entry.creditsCharged()).isZero();
    }

    @Test
    @DisplayName("Should release the reservation on an unexpected resolver failure")
    void shouldReleaseOnUnexpectedFailure() {
        // Given
        givenAuthorizedAndReserved();
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class)))
                .thenThrow(new IllegalStateException("boom"));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.failure()).isEqualTo(FailureReason.INTERNAL_ERROR);
        verify(creditLedger, times(1)).release(eq(token), anyString());
        verify(creditLedger, never()).commit(any());
    }

    @Test
    @DisplayName("Should not fail the request when the usage logger throws")
    void shouldSurviveUsageLoggerFailure() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID))
                .thenThrow(new GatewayException(FailureReason.UNAUTHENTICATED, "Invalid API key"));
        doThrow(new IllegalStateException("log store down")).when(usageLogger).append(any());

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.status()).isEqualTo(GatewayStatus.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("Should reject a blank lookup key")
    void shouldRejectBlankLookupKey() {
        assertThatThrownBy(() -> pipeline.execute(API_KEY, SERVICE_ID, "   "))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(accessGate, usageLogger);
    }

    @Test
    @DisplayName("Should not reserve credits for a request abandoned before it started")
    void shouldSkipAbandonedRequestBeforeReserving() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        RequestContext context = RequestContext.create();
        context.abandon();

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY, context);

        // Then
        assertThat(result.failure()).isEqualTo(FailureReason.REQUEST_ABANDONED);
        assertThat(result.creditsCharged()).isZero();
        verifyNoInteractions(creditLedger, fallbackResolver);
        assertThat(loggedEntry().failureCode()).isEqualTo("REQUEST_ABANDONED");
    }

    @Test
    @DisplayName("Should release instead of commit when the request is abandoned while resolving")
    void shouldReleaseWhenAbandonedDuringResolve() {
        // Given
        givenAuthorizedAndReserved();
        RequestContext context = RequestContext.create();
        when(fallbackResolver.resolve(eq(service), eq(KEY), same(context))).thenAnswer(invocation -> {
            context.abandon();
            return record();
        });

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY, context);

        // Then
        assertThat(result.failure()).isEqualTo(FailureReason.REQUEST_ABANDONED);
        verify(creditLedger).release(eq(token), anyString());
        verify(creditLedger, never()).commit(any());
        UsageLogEntry entry = loggedEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.ERROR);
        assertThat(entry.creditsCharged()).isZero();
    }

    @Test
    @DisplayName("Should charge again when the reservation was released before commit")
    void shouldRechargeWhenReservationWasReleasedEarly() {
        // Given
        ReservationToken retry = new ReservationToken("res-2", "caller-1", 2);
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        when(creditLedger.reserve("caller-1", 2)).thenReturn(token, retry);
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class))).thenReturn(record());
        when(creditLedger.commit(token)).thenReturn(false);
        when(creditLedger.commit(retry)).thenReturn(true);
        when(creditLedger.balance("caller-1")).thenReturn(new CreditAccount("caller-1", 8, 4, null));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.creditsCharged()).isEqualTo(2);
        verify(creditLedger).commit(retry);
        assertThat(loggedEntry().creditsCharged()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report no charge when a released reservation cannot be charged again")
    void shouldReportZeroChargeWhenRechargeFails() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID)).thenReturn(new Entitlement("key-1", "caller-1", SERVICE_ID));
        when(serviceRegistry.resolveService(SERVICE_ID)).thenReturn(service);
        when(creditLedger.reserve("caller-1", 2))
                .thenReturn(token)
                .thenThrow(new GatewayException(FailureReason.INSUFFICIENT_CREDITS, "Insufficient credits", "caller-1", null));
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class))).thenReturn(record());
        when(creditLedger.commit(token)).thenReturn(false);
        when(creditLedger.balance("caller-1")).thenReturn(new CreditAccount("caller-1", 1, 4, null));

        // When
        PipelineResult result = pipeline.execute(API_KEY, SERVICE_ID, KEY);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.creditsCharged()).isZero();
        UsageLogEntry entry = loggedEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.SUCCESS);
        assertThat(entry.creditsCharged()).isZero();
    }

    @Test
    @DisplayName("Should refund a delivered-too-late charge exactly once")
    void shouldRefundUndeliveredChargeOnce() {
        // Given
        givenAuthorizedAndReserved();
        when(fallbackResolver.resolve(eq(service), eq(KEY), any(RequestContext.class))).thenReturn(record());
        when(creditLedger.commit(token)).thenReturn(true);
        when(creditLedger.balance("caller-1")).thenReturn(new CreditAccount("caller-1", 8, 3, null));
        RequestContext context = RequestContext.create();
        pipeline.execute(API_KEY, SERVICE_ID, KEY, context);

        // When
        pipeline.refundUndelivered(context);
        pipeline.refundUndelivered(context);

        // Then
        verify(creditLedger, times(1)).adjustBalance(eq("caller-1"), eq(2L), anyString());
    }

    @Test
    @DisplayName("Should not refund an undelivered failure")
    void shouldNotRefundUncharged() {
        // Given
        when(accessGate.authorize(API_KEY, SERVICE_ID))
                .thenThrow(new GatewayException(FailureReason.UNAUTHENTICATED, "Invalid API key"));
        RequestContext context = RequestContext.create();
        pipeline.execute(API_KEY, SERVICE_ID, KEY, context);

        // When
        pipeline.refundUndelivered(context);

        // Then
        verifyNoInteractions(creditLedger);
    }
}
