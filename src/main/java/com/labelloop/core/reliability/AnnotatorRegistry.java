package com.labelloop.core.reliability;

import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.store.AnnotatorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owner of per-annotator state. Every write goes through {@link #update} under the
 * annotator's lock, so concurrent assignments and reliability updates never lose a change.
 */
@Service
public class AnnotatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnnotatorRegistry.class);

    private final AnnotatorStore store;
    private final EntityLocks locks;
    private final ReliabilityCalculator calculator;
    private final int defaultMaxConcurrentTasks;
    private final Clock clock;

    public AnnotatorRegistry(AnnotatorStore store, EntityLocks locks, LabelLoopProperties properties, Clock clock) {
        this.store = store;
        this.locks = locks;
        this.calculator = new ReliabilityCalculator(properties.getReliability().getPrior(),
                properties.getReliability().getSmoothingConstant());
        this.defaultMaxConcurrentTasks = properties.getAssignment().getMaxConcurrentTasks();
        this.clock = clock;
    }

    /**
     * Registers an annotator, or changes the capacity of one that already exists.
     */
    public Annotator register(String annotatorId, int maxConcurrentTasks) {
        requireId(annotatorId);
        Annotator.requireCapacity(maxConcurrentTasks);
        return locks.annotators().withLock(annotatorId, () -> {
            Optional<Annotator> existing = store.find(annotatorId);
            if (existing.isPresent()) {
                Annotator resized = existing.get().withMaxConcurrentTasks(maxConcurrentTasks);
                store.save(resized);
                log.info("Annotator {} capacity set to {}", annotatorId, maxConcurrentTasks);
                return resized;
            }
            Annotator created = store.insertIfAbsent(
                    Annotator.register(annotatorId, maxConcurrentTasks, calculator.prior(), clock.instant()));
            log.info("Registered annotator {} (capacity {}, reliability {})",
                    annotatorId, created.maxConcurrentTasks(), created.reliability());
            return created;
        });
    }

    /** Returns the annotator, registering it with default capacity on first sight. */
    public Annotator getOrRegister(String annotatorId) {
        requireId(annotatorId);
        Optional<Annotator> existing = store.find(annotatorId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Annotator created = store.insertIfAbsent(
                Annotator.register(annotatorId, defaultMaxConcurrentTasks, calculator.prior(), clock.instant()));
        log.debug("Auto-registered annotator {}", annotatorId);
        return created;
    }

    public Optional<Annotator> find(String annotatorId) {
        return store.find(annotatorId);
    }

    public Annotator get(String annotatorId) {
        return store.find(annotatorId).orElseThrow(() -> new EntityNotFoundException("Annotator", annotatorId));
    }

    public List<Annotator> all() {
        return store.findAll();
    }

    /**
     * Applies {@code change} to the stored annotator under its lock and saves the result.
     */
    public Annotator update(String annotatorId, UnaryOperator<Annotator> change) {
        return locks.annotators().withLock(annotatorId, () -> {
            Annotator updated = change.apply(get(annotatorId));
            store.save(updated);
            return updated;
        });
    }

    /**
     * Adds an annotator's contribution to one task's consensus to its agreement counts and
     * recomputes reliability from the new totals. The counts and the applied mark are stored
     * together, so replaying a contribution is a no-op.
     *
     * @return the updated annotator, or empty if this contribution was applied before
     */
    public Optional<Annotator> recordOutcomes(String taskId, String annotatorId, long agreements, long disagreements) {
        return locks.annotators().withLock(annotatorId, () -> {
            if (store.isContributionApplied(taskId, annotatorId)) {
                return Optional.<Annotator>empty();
            }
            Annotator current = get(annotatorId);
            long agreed = current.agreementCount() + agreements;
            long disagreed = current.disagreementCount() + disagreements;
            Annotator updated = current.withCounts(agreed, disagreed, calculator.reliability(agreed, disagreed));
            store.saveContribution(taskId, updated);
            return Optional.of(updated);
        });
    }

    /** Recomputes one annotator's reliability from its stored counts. */
    public Annotator recompute(String annotatorId) {
        return update(annotatorId, a -> a.withReliability(calculator.reliability(a.agreementCount(), a.disagreementCount())));
    }

    public ReliabilityCalculator calculator() {
        return calculator;
    }

    private static void requireId(String annotatorId) {
        if (annotatorId == null || annotatorId.isBlank()) {
            throw new IllegalArgumentException("annotator id must not be blank");
        }
    }
}
