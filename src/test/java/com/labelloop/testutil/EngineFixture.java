package com.labelloop.testutil;

import com.labelloop.core.assignment.AssignmentEngine;
import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.consensus.ConsensusEngine;
import com.labelloop.core.engine.LabelingEngine;
import com.labelloop.core.engine.ManualReviewGateway;
import com.labelloop.core.engine.StallHandler;
import com.labelloop.core.events.EventBus;
import com.labelloop.core.events.LabelLoopEvent;
import com.labelloop.core.ledger.AnnotationLedger;
import com.labelloop.core.metrics.LabelLoopMetrics;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.model.ManualReviewRequired;
import com.labelloop.core.model.Prediction;
import com.labelloop.core.queue.TaskPriorityQueue;
import com.labelloop.core.reliability.AnnotatorRegistry;
import com.labelloop.core.reliability.ReliabilityUpdater;
import com.labelloop.core.retraining.RetrainingPayloadWriter;
import com.labelloop.core.retraining.RetrainingTrigger;
import com.labelloop.core.store.AnnotatorStore;
import com.labelloop.core.store.ConsensusStore;
import com.labelloop.core.store.LedgerStore;
import com.labelloop.core.store.RetrainingStore;
import com.labelloop.core.store.TaskStore;
import com.labelloop.core.store.memory.InMemoryAnnotatorStore;
import com.labelloop.core.store.memory.InMemoryConsensusStore;
import com.labelloop.core.store.memory.InMemoryLedgerStore;
import com.labelloop.core.store.memory.InMemoryRetrainingStore;
import com.labelloop.core.store.memory.InMemoryTaskStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The engine wired by hand over in-memory stores and a {@link MutableClock}, the way the
 * Spring context wires it.
 */
public class EngineFixture {

    public static final Instant START = Instant.parse("2026-01-05T09:00:00Z");

    public final LabelLoopProperties properties = new LabelLoopProperties();
    public final MutableClock clock = new MutableClock(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final List<ManualReviewRequired> manualReviews = new CopyOnWriteArrayList<>();
    public final List<LabelLoopEvent> events = new CopyOnWriteArrayList<>();

    public TaskStore taskStore;
    public AnnotatorStore annotatorStore;
    public LedgerStore ledgerStore;
    public ConsensusStore consensusStore;
    public RetrainingStore retrainingStore;

    public EntityLocks locks;
    public EventBus eventBus;
    public LabelLoopMetrics metrics;
    public TaskPriorityQueue queue;
    public AnnotatorRegistry registry;
    public AnnotationLedger ledger;
    public AssignmentEngine assignmentEngine;
    public ConsensusEngine consensusEngine;
    public ReliabilityUpdater reliabilityUpdater;
    public RetrainingTrigger retrainingTrigger;
    public RetrainingPayloadWriter payloadWriter;
    public StallHandler stallHandler;
    public LabelingEngine engine;

    private ManualReviewGateway gateway = manualReviews::add;

    public static EngineFixture create() {
        return create(p -> {});
    }

    public static EngineFixture create(Consumer<LabelLoopProperties> configure) {
        var fixture = new EngineFixture();
        configure.accept(fixture.properties);
        fixture.stores(new InMemoryTaskStore(), new InMemoryAnnotatorStore(), new InMemoryLedgerStore(),
                new InMemoryConsensusStore(), new InMemoryRetrainingStore());
        return fixture.build();
    }

    public EngineFixture stores(TaskStore tasks, AnnotatorStore annotators, LedgerStore ledger,
                                ConsensusStore consensus, RetrainingStore retraining) {
        this.taskStore = tasks;
        this.annotatorStore = annotators;
        this.ledgerStore = ledger;
        this.consensusStore = consensus;
        this.retrainingStore = retraining;
        return this;
    }

    public EngineFixture gateway(ManualReviewGateway gateway) {
        this.gateway = gateway;
        return this;
    }

    public EngineFixture build() {
        locks = new EntityLocks();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        metrics = new LabelLoopMetrics(meterRegistry);
        queue = new TaskPriorityQueue(properties, clock);
        registry = new AnnotatorRegistry(annotatorStore, locks, properties, clock);
        ledger = new AnnotationLedger(ledgerStore);
        assignmentEngine = new AssignmentEngine(queue, taskStore, registry, locks, properties, clock);
        consensusEngine = new ConsensusEngine(locks, taskStore, consensusStore, ledger, registry, properties, clock);
        reliabilityUpdater = new ReliabilityUpdater(registry, annotatorStore, consensusStore, ledger, locks);
        retrainingTrigger = new RetrainingTrigger(retrainingStore, properties, clock);
        payloadWriter = new RetrainingPayloadWriter(consensusStore, clock);
        stallHandler = new StallHandler(locks, taskStore, queue, registry, gateway, eventBus, metrics, properties, clock);
        engine = new LabelingEngine(taskStore, consensusStore, queue, assignmentEngine, ledger, consensusEngine,
                registry, reliabilityUpdater, retrainingTrigger, payloadWriter, stallHandler, locks, eventBus,
                metrics, properties, clock);
        engine.start();
        return this;
    }

    public static Prediction prediction(String id, double uncertainty) {
        return new Prediction(id, "video-" + id, "a caption for " + id, uncertainty, "captioner-v1", START);
    }

    /** Stores an annotator with the given reliability, bypassing the agreement history. */
    public Annotator annotator(String id, double reliability) {
        registry.getOrRegister(id);
        return registry.update(id, a -> a.withReliability(reliability));
    }

    public List<String> eventTypes() {
        return events.stream().map(LabelLoopEvent::eventType).toList();
    }
}
