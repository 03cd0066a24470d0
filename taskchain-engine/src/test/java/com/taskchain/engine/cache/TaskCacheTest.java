package com.taskchain.engine.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taskchain.core.model.ErrorRecord;
import com.taskchain.core.model.ResultRecord;
import com.taskchain.engine.persistence.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskCacheTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    private final ObjectMapper objectMapper = TaskCache.defaultObjectMapper();

    private InMemoryCacheStore store;
    private TaskCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryCacheStore();
        cache = new TaskCache(store, objectMapper);
    }

    @Test
    void resultRecord_shouldSurviveStorage() {
        ResultRecord record = new ResultRecord(T0, objectMapper.valueToTree(Map.of("machines", 3)), "S1");

        cache.putResult("taskchain:k", record);

        assertThat(cache.getResult("taskchain:k")).contains(record);
        assertThat(store.get("taskchain:k")).hasValueSatisfying(node ->
            assertThat(node.get("timestamp").asText()).isEqualTo("2024-01-15T10:00:00Z"));
    }

    @Test
    void errorRecord_shouldKeepTimestampOrder() {
        ErrorRecord record = ErrorRecord.start("S1")
            .withFailure(T0)
            .withFailure(T0.plusSeconds(30));

        cache.putError("taskchain:kerror", record);

        assertThat(cache.getError("taskchain:kerror")).hasValueSatisfying(r -> {
            assertThat(r.seqId()).isEqualTo("S1");
            assertThat(r.timestamps()).containsExactly(T0, T0.plusSeconds(30));
        });
    }

    @Test
    void undecodableRecord_shouldReadAsAbsent() {
        store.set("taskchain:k", TextNode.valueOf("written by something else"));

        assertThat(cache.getResult("taskchain:k")).isEmpty();
    }

    @Test
    void delete_shouldReportWhetherRecordExisted() {
        cache.putResult("taskchain:k", new ResultRecord(T0, TextNode.valueOf("x"), "S1"));

        assertThat(cache.deleteResult("taskchain:k")).isTrue();
        assertThat(cache.deleteResult("taskchain:k")).isFalse();
        assertThat(cache.getResult("taskchain:k")).isEmpty();
    }
}
