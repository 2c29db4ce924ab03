package com.labelloop.core.reliability;

import com.labelloop.core.model.Annotator;
import com.labelloop.testutil.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnnotatorRegistryTest {

    private EngineFixture fixture;
    private AnnotatorRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.create();
        registry = fixture.registry;
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("registers a new annotator with the prior and resizes a known one")
        void registerAndResize() {
            Annotator created = registry.register("alice", 2);
            assertEquals(2, created.maxConcurrentTasks());
            assertEquals(0.5, created.reliability());

            registry.update("alice", Annotator::withTaskOpened);
            Annotator resized = registry.register("alice", 5);

            assertEquals(5, resized.maxConcurrentTasks());
            assertEquals(1, resized.openTaskCount());
            assertEquals(created.registeredAt(), resized.registeredAt());
        }

        @Test
        @DisplayName("capacity below one is rejected for new and known annotators alike")
        void rejectsZeroCapacity() {
            assertThrows(IllegalArgumentException.class, () -> registry.register("bob", 0));
            assertTrue(registry.find("bob").isEmpty());

            registry.register("alice", 3);
            assertThrows(IllegalArgumentException.class, () -> registry.register("alice", 0));
            assertThrows(IllegalArgumentException.class, () -> fixture.engine.registerAnnotator("alice", -1));

            Annotator alice = registry.get("alice");
            assertEquals(3, alice.maxConcurrentTasks());
            assertEquals(0.0, alice.loadFraction());
        }
    }

    @Nested
    @DisplayName("recordOutcomes")
    class RecordOutcomesTests {

        @Test
        @DisplayName("a contribution to one task is counted once")
        void contributionCountedOnce() {
            registry.getOrRegister("carol");

            assertTrue(registry.recordOutcomes("T-1", "carol", 2, 0).isPresent());
            assertTrue(registry.recordOutcomes("T-1", "carol", 2, 0).isEmpty());
            registry.recordOutcomes("T-2", "carol", 0, 1);

            Annotator carol = registry.get("carol");
            assertEquals(2, carol.agreementCount());
            assertEquals(1, carol.disagreementCount());
            assertEquals((2 + 0.5) / 4.0, carol.reliability(), 1e-12);
        }
    }
}
