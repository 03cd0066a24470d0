package com.taskchain.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void start_shouldHaveNoFailures() {
        ErrorRecord record = ErrorRecord.start("seq-1");
        
        assertEquals("seq-1", record.seqId());
        assertEquals(0, record.failureCount());
        assertEquals(List.of(), record.offsets());
    }

    @Test
    void offsets_shouldBeRelativeToFirstFailure() {
        ErrorRecord record = ErrorRecord.start("seq-1")
            .withFailure(T0)
            .withFailure(T0.plusSeconds(30))
            .withFailure(T0.plusSeconds(150));
        
        assertEquals(3, record.failureCount());
        assertEquals(
            List.of(Duration.ZERO, Duration.ofSeconds(30), Duration.ofSeconds(150)),
            record.offsets());
    }

    @Test
    void withFailure_shouldKeepTimestampsNonDecreasing() {
        ErrorRecord record = ErrorRecord.start("seq-1")
            .withFailure(T0.plusSeconds(60))
            .withFailure(T0);
        
        assertEquals(T0.plusSeconds(60), record.timestamps().get(1));
        assertEquals(Duration.ZERO, record.offsets().get(1));
    }

    @Test
    void withFailure_shouldNotMutateOriginal() {
        ErrorRecord original = ErrorRecord.start("seq-1").withFailure(T0);
        original.withFailure(T0.plusSeconds(5));
        
        assertEquals(1, original.failureCount());
    }
}
