package com.labelloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for the labeling engine.
 */
@Service
public class LabelLoopMetrics {

    private final MeterRegistry registry;

    public LabelLoopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskIngested() {
        Counter.builder("labelloop.tasks.ingested")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "assigned", "no_eligible_annotator" or "empty_queue"
     */
    public void recordAssignment(String outcome) {
        Counter.builder("labelloop.assignments")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnnotation(Duration timeOnTask) {
        Counter.builder("labelloop.annotations")
                .register(registry)
                .increment();
        Timer.builder("labelloop.annotation.duration")
                .description("Time from assignment to submitted annotation")
                .register(registry)
                .record(timeOnTask);
    }

    public void recordVote(boolean agree) {
        Counter.builder("labelloop.votes")
                .tag("agree", String.valueOf(agree))
                .register(registry)
                .increment();
    }

    public void recordConsensus(double confidence, boolean lowConfidence) {
        Counter.builder("labelloop.consensus.total")
                .tag("confidence", lowConfidence ? "low" : "normal")
                .register(registry)
                .increment();
        DistributionSummary.builder("labelloop.consensus.confidence")
                .register(registry)
                .record(confidence);
    }

    /**
     * @param stage status the task stalled from
     */
    public void recordStall(String stage) {
        Counter.builder("labelloop.stalls.total")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordManualReview() {
        Counter.builder("labelloop.manual_review.total")
                .register(registry)
                .increment();
    }

    public void recordBatchEmitted(String trigger, int size) {
        Counter.builder("labelloop.retraining.batches")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
        DistributionSummary.builder("labelloop.retraining.batch_size")
                .register(registry)
                .record(size);
    }

    public void recordBatchReoffered() {
        Counter.builder("labelloop.retraining.reoffers")
                .description("Batches offered again after the acknowledgement deadline passed")
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reporting the number of queued tasks.
     */
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder("labelloop.queue.depth", depth, s -> s.get().doubleValue())
                .description("Tasks waiting for an annotator")
                .strongReference(true)
                .register(registry);
    }
}
