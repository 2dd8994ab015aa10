package com.twinforge.dispatch.api;

import com.twinforge.core.engine.RunRegistry;
import com.twinforge.core.events.EventBus;
import com.twinforge.core.events.RunEvent;
import com.twinforge.core.events.RunEventType;
import com.twinforge.core.model.RunSnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each client connection gets an emitter subscribed to its run's events. The emitter
 * completes after a terminal run event, or right away when the run had already finished
 * before the client connected. Heartbeat comments go out every 30 seconds so
 * idle connections survive proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final RunRegistry registry;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, RunRegistry registry) {
        this(eventBus, registry, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, RunRegistry registry, long timeoutMs) {
        this.eventBus = eventBus;
        this.registry = registry;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    /**
     * Creates an emitter that streams the events of one run.
     */
    public SseEmitter createEmitter(String runId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(runId, event -> sendEvent(emitter, event));
        var registration = new EmitterRegistration(runId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", runId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", runId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for run {}: {}", runId, e.getMessage());
        }
        // subscribed first, so a run finishing now is seen either as an event or as a terminal snapshot
        registry.snapshot(runId)
                .filter(snapshot -> snapshot.status().isTerminal())
                .ifPresent(snapshot -> {
                    sendEvent(emitter, terminalEvent(snapshot));
                    cleanup(registration);
                });
        log.info("SSE emitter created for run {} (timeout={}ms)", runId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for run {}: {}", registration.runId(), e.getMessage());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, RunEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("runId", event.runId());
            if (event.target() != null) {
                data.put("target", event.target().wireName());
            }
            data.put("message", event.message());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
            if (event.type().isTerminal()) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}", event.eventType(), event.runId(), e.getMessage());
        }
    }

    private static RunEvent terminalEvent(RunSnapshot snapshot) {
        RunEventType type = switch (snapshot.status()) {
            case DELIVERED -> RunEventType.RUN_DELIVERED;
            case STOPPED -> RunEventType.RUN_STOPPED;
            default -> RunEventType.RUN_FAILED;
        };
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", snapshot.status().name());
        payload.put("finalStatus", snapshot.finalStatus() == null ? "" : snapshot.finalStatus());
        payload.put("iteration", snapshot.iteration());
        if (snapshot.stopReason() != null && !snapshot.stopReason().isBlank()) {
            payload.put("reason", snapshot.stopReason());
        }
        return RunEvent.of(type, snapshot.runId(), "Run already finished with status " + snapshot.status(), payload);
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(String runId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
