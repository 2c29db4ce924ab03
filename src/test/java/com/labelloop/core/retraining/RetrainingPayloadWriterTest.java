package com.labelloop.core.retraining;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labelloop.core.model.BatchTrigger;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.RetrainingBatch;
import com.labelloop.core.store.memory.InMemoryConsensusStore;
import com.labelloop.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetrainingPayloadWriterTest {

    private static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    @Test
    @DisplayName("renders the training webhook document for a batch")
    void rendersWebhookDocument() throws Exception {
        var store = new InMemoryConsensusStore();
        store.putIfAbsent(new ConsensusResult("T-1", "p-1", "a-1", "a red car", 0.83, 0.67, false,
                List.of("a-1"), NOW));
        store.putIfAbsent(new ConsensusResult("T-2", "p-2", "a-2", "a dog running", 0.41, 0.5, true,
                List.of("a-2"), NOW));
        var writer = new RetrainingPayloadWriter(store, new MutableClock(NOW));
        var batch = RetrainingBatch.emit("B-1", List.of("T-1", "T-2"), BatchTrigger.SIZE, NOW).offered(NOW);

        JsonNode root = new ObjectMapper().readTree(writer.render(batch));

        assertEquals("retraining.triggered", root.get("event").asText());
        assertEquals("2026-01-05T09:00:00Z", root.get("timestamp").asText());
        JsonNode payload = root.get("payload");
        assertEquals("B-1", payload.get("batch_id").asText());
        assertEquals("SIZE", payload.get("trigger").asText());
        assertEquals(1, payload.get("offer_count").asInt());
        JsonNode tasks = payload.get("labeled_tasks");
        assertEquals(2, tasks.size());
        assertEquals("T-1", tasks.get(0).get("task_id").asText());
        assertEquals("a red car", tasks.get(0).get("caption").asText());
        assertEquals(0.83, tasks.get(0).get("confidence").asDouble(), 1e-12);
        assertTrue(tasks.get(1).get("low_confidence").asBoolean());
    }

    @Test
    @DisplayName("skips tasks without a stored consensus result")
    void skipsMissingResults() throws Exception {
        var writer = new RetrainingPayloadWriter(new InMemoryConsensusStore(), new MutableClock(NOW));
        var batch = RetrainingBatch.emit("B-1", List.of("T-missing"), BatchTrigger.MANUAL, NOW);

        JsonNode root = new ObjectMapper().readTree(writer.render(batch));

        assertEquals(0, root.get("payload").get("labeled_tasks").size());
    }
}
