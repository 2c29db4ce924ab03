package com.labelloop.core.consensus;

import com.labelloop.core.consensus.ConsensusEngine.ConsensusOutcome;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.error.InvalidStateTransitionException;
import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;
import com.labelloop.testutil.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusEngineTest {

    private EngineFixture fixture;
    private ConsensusEngine consensus;
    private Annotation red;
    private Annotation blue;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.create();
        consensus = fixture.consensusEngine;
        votingTask("T-1");
        red = fixture.ledger.appendAnnotation("T-1", "alice", "a red car", fixture.clock.instant());
        fixture.clock.advance(Duration.ofSeconds(1));
        blue = fixture.ledger.appendAnnotation("T-1", "bob", "a blue car", fixture.clock.instant());
    }

    /** Stores a task that has two submitted annotations and is open for voting. */
    private Task votingTask(String id) {
        var now = fixture.clock.instant();
        Task task = Task.create(id, EngineFixture.prediction("p-" + id, 0.8), 0.5, 2, now)
                .withAssignment("alice", now)
                .withAssignment("bob", now)
                .withSubmission("alice", now)
                .withSubmission("bob", now)
                .withStatus(TaskStatus.ANNOTATED, now)
                .withStatus(TaskStatus.VOTING, now);
        fixture.taskStore.insert(task);
        return task;
    }

    private void vote(Annotation annotation, String voter, boolean agree) {
        fixture.ledger.appendVote(annotation, voter, agree, fixture.clock.instant());
    }

    @Nested
    @DisplayName("trigger")
    class TriggerTests {

        @Test
        @DisplayName("two of three votes for the leader reach consensus on its caption")
        void thresholdReached() {
            vote(red, "carol", true);
            vote(red, "dave", true);
            vote(blue, "erin", true);

            ConsensusOutcome outcome = consensus.finalizeConsensus("T-1");

            ConsensusResult result = outcome.result();
            assertTrue(outcome.created());
            assertEquals("a red car", result.caption());
            assertEquals(red.id(), result.annotationId());
            assertEquals(2.0 / 3.0, result.agreementRatio(), 1e-12);
            assertFalse(result.lowConfidence());
            assertEquals(TaskStatus.CONSENSUS_REACHED, fixture.taskStore.find("T-1").orElseThrow().status());
        }

        @Test
        @DisplayName("too few votes: tryFinalize waits, explicit finalize is rejected")
        void tooFewVotes() {
            vote(red, "carol", true);
            vote(red, "dave", true);

            assertTrue(consensus.tryFinalize("T-1").isEmpty());
            assertThrows(InvalidStateTransitionException.class, () -> consensus.finalizeConsensus("T-1"));
            assertEquals(TaskStatus.VOTING, fixture.taskStore.find("T-1").orElseThrow().status());
        }

        @Test
        @DisplayName("split vote below the threshold does not finalize")
        void belowThreshold() {
            vote(red, "carol", true);
            vote(blue, "dave", true);
            vote(red, "erin", false);

            assertTrue(consensus.tryFinalize("T-1").isEmpty());
        }

        @Test
        @DisplayName("elapsed voting window finalizes from the best votes with low confidence")
        void windowElapsed() {
            vote(red, "carol", true);
            fixture.clock.advance(fixture.properties.getConsensus().getMaxVotingWindow());

            ConsensusResult result = consensus.tryFinalize("T-1").orElseThrow().result();

            assertTrue(result.lowConfidence());
            assertEquals("a red car", result.caption());
        }

        @Test
        @DisplayName("elapsed window without any agreeing vote has no candidate")
        void windowElapsedWithoutCandidate() {
            vote(red, "carol", false);
            fixture.clock.advance(Duration.ofHours(3));

            assertTrue(consensus.tryFinalize("T-1").isEmpty());
            assertTrue(consensus.evaluate(fixture.taskStore.find("T-1").orElseThrow()).windowElapsed());
        }

        @Test
        @DisplayName("task not in voting is rejected; unknown task is not found")
        void wrongState() {
            var now = fixture.clock.instant();
            fixture.taskStore.insert(Task.create("T-2", EngineFixture.prediction("p-T-2", 0.5), 0.5, 2, now));

            assertTrue(consensus.tryFinalize("T-2").isEmpty());
            assertThrows(InvalidStateTransitionException.class, () -> consensus.finalizeConsensus("T-2"));
            assertThrows(EntityNotFoundException.class, () -> consensus.finalizeConsensus("missing"));
        }
    }

    @Nested
    @DisplayName("result")
    class ResultTests {

        @Test
        @DisplayName("contributing annotations include other captions equal to the accepted one")
        void contributing() {
            var now = fixture.clock.instant();
            Annotation sameWords = fixture.ledger.appendAnnotation("T-1", "frank", "A red  car", now);
            vote(red, "carol", true);
            vote(red, "dave", true);
            vote(blue, "erin", false);

            ConsensusResult result = consensus.finalizeConsensus("T-1").result();

            assertEquals(List.of(red.id(), sameWords.id()), result.contributingAnnotationIds());
        }

        @Test
        @DisplayName("reliable agreeing voters raise confidence")
        void confidenceBlend() {
            fixture.annotator("carol", 1.0);
            fixture.annotator("dave", 1.0);
            vote(red, "carol", true);
            vote(red, "dave", true);
            vote(red, "erin", true);
            fixture.annotator("erin", 0.7);

            ConsensusResult result = consensus.finalizeConsensus("T-1").result();

            // ratio 1.0, mean reliability (1.0 + 1.0 + 0.7) / 3
            assertEquals(0.5 * 1.0 + 0.5 * 0.9, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("finalizing again returns the stored result")
        void idempotent() {
            vote(red, "carol", true);
            vote(red, "dave", true);
            vote(red, "erin", true);

            ConsensusOutcome first = consensus.finalizeConsensus("T-1");
            fixture.clock.advance(Duration.ofMinutes(1));
            ConsensusOutcome second = consensus.finalizeConsensus("T-1");
            Optional<ConsensusOutcome> third = consensus.tryFinalize("T-1");

            assertTrue(first.created());
            assertFalse(second.created());
            assertEquals(first.result(), second.result());
            assertEquals(first.result(), third.orElseThrow().result());
        }

        @Test
        @DisplayName("a stored result repairs a task whose status write was lost")
        void repairsStatus() {
            var stored = new ConsensusResult("T-1", "p-T-1", red.id(), red.caption(), 0.7, 1.0, false,
                    List.of(red.id()), fixture.clock.instant());
            fixture.consensusStore.putIfAbsent(stored);

            ConsensusOutcome outcome = consensus.finalizeConsensus("T-1");

            assertFalse(outcome.created());
            assertEquals(stored, outcome.result());
            assertEquals(TaskStatus.CONSENSUS_REACHED, fixture.taskStore.find("T-1").orElseThrow().status());
        }
    }

    @Test
    @DisplayName("concurrent finalize calls produce exactly one result")
    void concurrentFinalize() throws Exception {
        vote(red, "carol", true);
        vote(red, "dave", true);
        vote(red, "erin", true);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<ConsensusOutcome>> calls = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            calls.add(() -> {
                start.await();
                return consensus.finalizeConsensus("T-1");
            });
        }
        List<Future<ConsensusOutcome>> futures = new ArrayList<>();
        for (Callable<ConsensusOutcome> call : calls) {
            futures.add(pool.submit(call));
        }
        start.countDown();

        int created = 0;
        ConsensusResult first = null;
        for (Future<ConsensusOutcome> future : futures) {
            ConsensusOutcome outcome = future.get();
            if (outcome.created()) {
                created++;
            }
            if (first == null) {
                first = outcome.result();
            }
            assertEquals(first, outcome.result());
        }
        pool.shutdown();

        assertEquals(1, created);
        assertEquals(1, fixture.consensusStore.findAll().size());
    }
}
