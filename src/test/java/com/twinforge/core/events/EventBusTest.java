package com.twinforge.core.events;

import com.twinforge.core.model.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("RunEvent")
    class RunEventTests {

        @Test
        @DisplayName("exposes the wire name as event type")
        void wireName() {
            var event = RunEvent.of(RunEventType.JUDGMENT_RESULT, "R-1", "ok", Map.of());
            assertEquals("judgment.result", event.eventType());
            assertNull(event.target());
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("copies the payload and tolerates null")
        void payloadCopy() {
            var payload = new java.util.HashMap<String, Object>();
            payload.put("iteration", 2);
            var event = RunEvent.forTarget(RunEventType.TARGET_CODING, "R-1", Target.BACKEND, "coding", payload);
            payload.put("iteration", 9);

            assertEquals(2, event.intValue("iteration", 0));
            assertEquals(7, event.intValue("missing", 7));
            assertTrue(RunEvent.of(RunEventType.RUN_CREATED, "R-1", "x", null).payload().isEmpty());
        }

        @Test
        @DisplayName("only delivered, failed and stopped are terminal")
        void terminalTypes() {
            assertTrue(RunEventType.RUN_DELIVERED.isTerminal());
            assertTrue(RunEventType.RUN_FAILED.isTerminal());
            assertTrue(RunEventType.RUN_STOPPED.isTerminal());
            assertFalse(RunEventType.TARGET_FAILED.isTerminal());
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events to subscribers of the same run only")
        void deliversToRunSubscriber() {
            List<RunEvent> received = new ArrayList<>();
            List<RunEvent> other = new ArrayList<>();
            eventBus.subscribe("R-1", received::add);
            eventBus.subscribe("R-2", other::add);

            eventBus.publish(RunEvent.of(RunEventType.PLANNING_STARTED, "R-1", "planning", Map.of()));

            assertEquals(1, received.size());
            assertTrue(other.isEmpty());
        }

        @Test
        @DisplayName("global subscribers see every run, before run subscribers")
        void globalFirst() {
            List<String> order = new ArrayList<>();
            eventBus.subscribe("R-1", e -> order.add("run"));
            eventBus.subscribeAll(e -> order.add("global"));

            eventBus.publish(RunEvent.of(RunEventType.RUN_CREATED, "R-1", "created", Map.of()));
            eventBus.publish(RunEvent.of(RunEventType.RUN_CREATED, "R-2", "created", Map.of()));

            assertEquals(List.of("global", "run", "global"), order);
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<RunEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("R-1", received::add);
            subscription.unsubscribe();

            eventBus.publish(RunEvent.of(RunEventType.RUN_CREATED, "R-1", "created", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void isolatesSubscriberFailures() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("broken subscriber");
            });
            eventBus.subscribe("R-1", received::add);

            assertDoesNotThrow(() ->
                    eventBus.publish(RunEvent.of(RunEventType.RUN_CREATED, "R-1", "created", Map.of())));
            assertEquals(1, received.size());
        }
    }
}
