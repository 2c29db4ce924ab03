package com.labelloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub for labeling engine events.
 * <p>
 * Subscribers listen to one task, to one event type (e.g. {@link LabelLoopEvent#BATCH_READY}
 * for a training collaborator) or to everything. A task's subscribers are dropped after its
 * terminal event has been delivered. Safe for concurrent publish and subscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LabelLoopEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LabelLoopEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<LabelLoopEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the task's subscribers, then to subscribers of its type, then to
     * global subscribers.
     */
    public void publish(LabelLoopEvent event) {
        log.debug("Publishing {} for task {}", event.eventType(), event.taskId());

        if (event.taskId() != null) {
            deliverAll(taskSubscribers.get(event.taskId()), event);
            if (event.isTerminal() && taskSubscribers.remove(event.taskId()) != null) {
                log.debug("Dropped subscribers of finished task {}", event.taskId());
            }
        }
        deliverAll(typeSubscribers.get(event.eventType()), event);
        deliverAll(globalSubscribers, event);
    }

    /**
     * Subscribe to the events of one task until it reaches consensus or manual review.
     *
     * @return a {@link Subscription} handle to unsubscribe earlier
     */
    public Subscription subscribe(String taskId, Consumer<LabelLoopEvent> consumer) {
        return addTo(taskSubscribers, taskId, consumer);
    }

    /** Subscribe to every event of the given type, e.g. {@link LabelLoopEvent#BATCH_READY}. */
    public Subscription subscribeType(String eventType, Consumer<LabelLoopEvent> consumer) {
        return addTo(typeSubscribers, eventType, consumer);
    }

    public Subscription subscribeAll(Consumer<LabelLoopEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription addTo(ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<LabelLoopEvent>>> table,
                               String key, Consumer<LabelLoopEvent> consumer) {
        table.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", key);
        return () -> {
            CopyOnWriteArrayList<Consumer<LabelLoopEvent>> subs = table.get(key);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    private void deliverAll(List<Consumer<LabelLoopEvent>> subscribers, LabelLoopEvent event) {
        if (subscribers == null) {
            return;
        }
        for (Consumer<LabelLoopEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
            }
        }
    }
}
