package com.kmg.gateway.service;

import com.kmg.gateway.dto.EventMessage;
import com.kmg.gateway.repo.SqlTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of gateway activity to operator dashboards over Server-Sent Events.
 * A subscription is either global or scoped to one caller.
 */
@Service
public class EventService {
    public static final String API_CALL = "api-call";
    public static final String CREDIT_BALANCE = "credit-balance";

    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    private record Subscription(SseEmitter emitter, String callerId) {
        boolean wants(String eventCallerId) {
            return callerId == null || callerId.equals(eventCallerId);
        }
    }

    public SseEmitter subscribe() {
        return subscribe(null);
    }

    /**
     * @param callerId only events for this caller are delivered; {@code null} or blank for every event
     */
    public SseEmitter subscribe(String callerId) {
        SseEmitter emitter = new SseEmitter(0L);
        Subscription subscription = new Subscription(emitter,
                callerId == null || callerId.isBlank() ? null : callerId.trim());
        subscriptions.add(subscription);

        emitter.onCompletion(() -> subscriptions.remove(subscription));
        emitter.onTimeout(() -> subscriptions.remove(subscription));
        emitter.onError(ex -> subscriptions.remove(subscription));

        log.debug("SSE subscriber added (caller={}), total {}", subscription.callerId(), subscriptions.size());
        return emitter;
    }

    public void publish(String type, String callerId, String message, Object payload) {
        if (subscriptions.isEmpty()) {
            return;
        }
        EventMessage event = new EventMessage(type, callerId, message, SqlTime.nowText(), payload);
        for (Subscription subscription : subscriptions) {
            if (!subscription.wants(callerId)) {
                continue;
            }
            try {
                subscription.emitter().send(SseEmitter.event().name(type).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                subscriptions.remove(subscription);
            }
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
