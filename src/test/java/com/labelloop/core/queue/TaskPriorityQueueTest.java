package com.labelloop.core.queue;

import com.labelloop.core.error.DuplicateTaskException;
import com.labelloop.core.model.Prediction;
import com.labelloop.core.model.PrioritizedTask;
import com.labelloop.core.model.Task;
import com.labelloop.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TaskPriorityQueueTest {

    private static final Instant START = Instant.parse("2026-01-05T09:00:00Z");

    private MutableClock clock;
    private TaskPriorityQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        queue = new TaskPriorityQueue(new FreshnessDecay(2.0, Duration.ofMinutes(10)), clock);
    }

    private static Task task(String id, double uncertainty, double difficulty, Instant createdAt) {
        var prediction = new Prediction("pred-" + id, "video-" + id, "caption", uncertainty, "v1", createdAt);
        return Task.create(id, prediction, difficulty, 2, createdAt);
    }

    @Nested
    @DisplayName("FreshnessDecay")
    class FreshnessDecayTests {

        private final FreshnessDecay decay = new FreshnessDecay(2.0, Duration.ofMinutes(10));

        @Test
        @DisplayName("starts at 1 and is bounded by the max boost")
        void bounds() {
            assertEquals(1.0, decay.multiplier(Duration.ZERO), 1e-12);
            assertTrue(decay.multiplier(Duration.ofDays(1)) <= 2.0);
            assertEquals(1.0 + (1.0 - Math.exp(-1.0)), decay.multiplier(Duration.ofMinutes(10)), 1e-9);
        }

        @Test
        @DisplayName("strictly increases with wait time")
        void strictlyIncreasing() {
            double previous = decay.multiplier(Duration.ZERO);
            for (int minutes = 1; minutes <= 120; minutes++) {
                double current = decay.multiplier(Duration.ofMinutes(minutes));
                assertTrue(current > previous, "not increasing at " + minutes + " minutes");
                previous = current;
            }
        }

        @Test
        @DisplayName("rejects a max boost of 1 or less and a non-positive time constant")
        void validates() {
            assertThrows(IllegalArgumentException.class, () -> new FreshnessDecay(1.0, Duration.ofMinutes(1)));
            assertThrows(IllegalArgumentException.class, () -> new FreshnessDecay(2.0, Duration.ZERO));
        }
    }

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("older task outranks an otherwise identical newer one")
        void waitTimeRaisesPriority() {
            Task older = task("old", 0.6, 0.5, START);
            Task newer = task("new", 0.6, 0.5, START.plus(Duration.ofMinutes(5)));
            clock.advance(Duration.ofMinutes(6));

            assertTrue(queue.priorityOf(older) > queue.priorityOf(newer));
        }

        @Test
        @DisplayName("higher uncertainty outranks at equal difficulty and wait")
        void uncertaintyRaisesPriority() {
            queue.enqueue(task("low", 0.3, 0.5, START));
            queue.enqueue(task("high", 0.9, 0.5, START));

            assertEquals("high", queue.peekNext(q -> true).orElseThrow().taskId());
        }

        @Test
        @DisplayName("long wait lets a lower-uncertainty task overtake a fresh one")
        void starvationGuard() {
            queue.enqueue(task("waiting", 0.5, 0.5, START));
            clock.advance(Duration.ofHours(1));
            queue.enqueue(task("fresh", 0.8, 0.5, clock.instant()));

            assertEquals("waiting", queue.peekNext(q -> true).orElseThrow().taskId());
        }

        @Test
        @DisplayName("ties go to the earlier creation time, then the task id")
        void tieBreak() {
            queue.enqueue(task("b", 0.5, 0.5, START));
            queue.enqueue(task("a", 0.5, 0.5, START));

            assertEquals("a", queue.peekNext(q -> true).orElseThrow().taskId());
        }

        @Test
        @DisplayName("peekNext skips tasks the predicate rejects")
        void predicateFilters() {
            queue.enqueue(task("top", 0.9, 0.9, START));
            queue.enqueue(task("second", 0.5, 0.5, START));

            assertEquals("second", queue.peekNext(q -> !q.taskId().equals("top")).orElseThrow().taskId());
            assertTrue(queue.peekNext(q -> false).isEmpty());
        }

        @Test
        @DisplayName("rank orders any tasks by current priority")
        void rank() {
            List<PrioritizedTask> ranked = queue.rank(List.of(
                    task("mid", 0.5, 0.5, START), task("top", 0.9, 0.9, START), task("low", 0.1, 0.5, START)));

            assertEquals(List.of("top", "mid", "low"), ranked.stream().map(p -> p.task().id()).toList());
            assertEquals(0.81, ranked.get(0).priority(), 1e-9);
        }
    }

    @Nested
    @DisplayName("membership")
    class MembershipTests {

        @Test
        @DisplayName("a second task for the same prediction is rejected")
        void duplicatePrediction() {
            queue.enqueue(task("T-1", 0.5, 0.5, START));
            var other = Task.create("T-2", task("T-1", 0.5, 0.5, START).prediction(), 0.5, 2, START);

            var e = assertThrows(DuplicateTaskException.class, () -> queue.enqueue(other));
            assertEquals("T-1", e.existingTaskId());
        }

        @Test
        @DisplayName("re-enqueueing the same task is a no-op, also after removal")
        void reenqueue() {
            Task task = task("T-1", 0.5, 0.5, START);
            queue.enqueue(task);
            queue.enqueue(task);
            assertEquals(1, queue.size());

            assertTrue(queue.remove("T-1"));
            assertFalse(queue.contains("T-1"));
            queue.enqueue(task);
            assertTrue(queue.contains("T-1"));
        }

        @Test
        @DisplayName("claimed task is invisible until released")
        void claim() {
            queue.enqueue(task("T-1", 0.5, 0.5, START));

            assertTrue(queue.tryClaim("T-1"));
            assertFalse(queue.tryClaim("T-1"));
            assertTrue(queue.peekNext(q -> true).isEmpty());

            queue.release("T-1");
            assertEquals("T-1", queue.peekNext(q -> true).orElseThrow().taskId());
            assertFalse(queue.tryClaim("unknown"));
        }

        @Test
        @DisplayName("rebuild keeps only tasks that still need annotators")
        void rebuild() {
            Task waiting = task("waiting", 0.5, 0.5, START);
            Task full = task("full", 0.5, 0.5, START).withAssignment("a", START).withAssignment("b", START);

            queue.rebuild(List.of(waiting, full));

            assertEquals(1, queue.size());
            assertTrue(queue.contains("waiting"));
            assertThrows(DuplicateTaskException.class,
                    () -> queue.enqueue(Task.create("other", full.prediction(), 0.5, 2, START)));
        }
    }

    @Test
    @DisplayName("concurrent claimers never win the same task twice")
    void concurrentClaims() throws InterruptedException {
        for (int i = 0; i < 20; i++) {
            queue.enqueue(task("T-" + i, 0.5, 0.5, START));
        }
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> won = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        List<Runnable> jobs = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            jobs.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                while (true) {
                    var next = queue.peekNext(q -> true);
                    if (next.isEmpty()) {
                        return;
                    }
                    if (queue.tryClaim(next.get().taskId()) && !won.add(next.get().taskId())) {
                        duplicates.incrementAndGet();
                    }
                }
            });
        }
        jobs.forEach(pool::submit);
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(0, duplicates.get());
        assertEquals(20, won.size());
    }
}
