package com.labelloop.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

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

    private static LabelLoopEvent event(String type, String taskId) {
        return new LabelLoopEvent(type, taskId, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("LabelLoopEvent")
    class LabelLoopEventTests {

        @Test
        @DisplayName("creates event with all fields")
        void createsEventWithAllFields() {
            Instant now = Instant.now();
            var event = new LabelLoopEvent(LabelLoopEvent.TASK_ASSIGNED, "T-1", Map.of("annotatorId", "ann-1"), now);

            assertEquals("task.assigned", event.eventType());
            assertEquals("T-1", event.taskId());
            assertEquals(Map.of("annotatorId", "ann-1"), event.payload());
            assertEquals(now, event.timestamp());
        }

        @Test
        @DisplayName("allows null taskId for batch events and null payload")
        void allowsNullTaskIdAndPayload() {
            var event = new LabelLoopEvent(LabelLoopEvent.BATCH_READY, null, null, Instant.now());

            assertNull(event.taskId());
            assertEquals(Map.of(), event.payload());
        }

        @Test
        @DisplayName("payload is a defensive copy")
        void payloadIsCopied() {
            var payload = new HashMap<String, Object>();
            payload.put("size", 10);
            var event = new LabelLoopEvent(LabelLoopEvent.BATCH_READY, null, payload, Instant.now());
            payload.put("size", 11);

            assertEquals(10, event.payload().get("size"));
            assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
        }
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to task subscriber")
        void deliversEventToTaskSubscriber() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribe("T-1", received::add);

            var event = event(LabelLoopEvent.TASK_ANNOTATED, "T-1");
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver event to subscribers of a different task")
        void doesNotDeliverToDifferentTask() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribe("T-2", received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_ANNOTATED, "T-1"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("delivers a task's events in publish order")
        void deliversInOrder() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribe("T-1", received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_CREATED, "T-1"));
            eventBus.publish(event(LabelLoopEvent.TASK_ASSIGNED, "T-1"));
            eventBus.publish(event(LabelLoopEvent.CONSENSUS_REACHED, "T-1"));

            assertEquals(List.of("task.created", "task.assigned", "consensus.reached"),
                    received.stream().map(LabelLoopEvent::eventType).toList());
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("global subscriber receives task and batch events")
        void globalSubscriberReceivesAllEvents() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_CREATED, "T-1"));
            eventBus.publish(event(LabelLoopEvent.BATCH_READY, null));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("global and task-specific subscribers both receive the event")
        void globalAndTaskSpecificBothReceive() {
            List<LabelLoopEvent> global = new ArrayList<>();
            List<LabelLoopEvent> perTask = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("T-1", perTask::add);

            eventBus.publish(event(LabelLoopEvent.TASK_VOTING, "T-1"));

            assertEquals(1, global.size());
            assertEquals(1, perTask.size());
        }
    }

    @Nested
    @DisplayName("type subscription and task lifetime")
    class TypeAndLifetimeTests {

        @Test
        @DisplayName("type subscriber receives only its event type, from any task")
        void typeSubscriberFiltersByType() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribeType(LabelLoopEvent.BATCH_READY, received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_CREATED, "T-1"));
            eventBus.publish(event(LabelLoopEvent.BATCH_READY, null));
            eventBus.publish(event(LabelLoopEvent.BATCH_ACKNOWLEDGED, null));

            assertEquals(List.of("retraining.batch_ready"), received.stream().map(LabelLoopEvent::eventType).toList());
        }

        @Test
        @DisplayName("task subscribers get the terminal event and nothing after it")
        void terminalEventEndsTaskSubscription() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribe("T-1", received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_VOTING, "T-1"));
            eventBus.publish(event(LabelLoopEvent.CONSENSUS_REACHED, "T-1"));
            eventBus.publish(event(LabelLoopEvent.TASK_ANNOTATED, "T-1"));

            assertEquals(List.of("task.voting", "consensus.reached"),
                    received.stream().map(LabelLoopEvent::eventType).toList());
        }

        @Test
        @DisplayName("manual review and consensus are the terminal events")
        void terminalEvents() {
            assertTrue(event(LabelLoopEvent.CONSENSUS_REACHED, "T-1").isTerminal());
            assertTrue(event(LabelLoopEvent.TASK_MANUAL_REVIEW, "T-1").isTerminal());
            assertFalse(event(LabelLoopEvent.TASK_STALLED, "T-1").isTerminal());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribeStopsDelivery() {
            List<LabelLoopEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("T-1", received::add);

            eventBus.publish(event(LabelLoopEvent.TASK_ASSIGNED, "T-1"));
            subscription.unsubscribe();
            eventBus.publish(event(LabelLoopEvent.TASK_ANNOTATED, "T-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing global subscription stops delivery")
        void unsubscribeGlobalStopsDelivery() {
            List<LabelLoopEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(event(LabelLoopEvent.BATCH_READY, null));
            subscription.unsubscribe();
            eventBus.publish(event(LabelLoopEvent.BATCH_ACKNOWLEDGED, null));

            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("concurrency and failures")
    class ConcurrencyTests {

        @Test
        @DisplayName("handles concurrent publishes safely")
        void handlesConcurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<LabelLoopEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("T-1", received::add);

            int threadCount = 8;
            int eventsPerThread = 100;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < eventsPerThread; i++) {
                        eventBus.publish(event(LabelLoopEvent.TASK_ANNOTATED, "T-1"));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * eventsPerThread, received.size());
        }

        @Test
        @DisplayName("subscriber exception does not prevent delivery to other subscribers")
        void subscriberExceptionDoesNotPreventOthers() {
            List<LabelLoopEvent> received = new ArrayList<>();
            eventBus.subscribe("T-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("T-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(LabelLoopEvent.TASK_STALLED, "T-1")));
            assertEquals(1, received.size());
        }
    }
}
