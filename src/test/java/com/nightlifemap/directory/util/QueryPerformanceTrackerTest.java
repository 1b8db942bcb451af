package com.nightlifemap.directory.util;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QueryPerformanceTrackerTest {

    private SimpleMeterRegistry meterRegistry;
    private QueryPerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new QueryPerformanceTracker(meterRegistry);
    }

    @Test
    void trackQuery_Success_ReturnsResultAndRecordsTimer() {
        String result = tracker.trackQuery("GetItem", "DirectoryTable", () -> "venue");

        assertThat(result).isEqualTo("venue");
        Timer timer = meterRegistry.find("dynamodb.query.duration")
            .tags("operation", "GetItem", "table", "DirectoryTable", "outcome", "success")
            .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void trackQuery_Failure_RethrowsAndRecordsError() {
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> tracker.trackQuery("UpdateItem", "DirectoryTable", () -> {
            throw failure;
        })).isSameAs(failure);

        Timer timer = meterRegistry.find("dynamodb.query.duration")
            .tags("operation", "UpdateItem", "outcome", "error")
            .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }
}
