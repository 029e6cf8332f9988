package com.kiisha.ai.gateway.telemetry;

import com.kiisha.ai.gateway.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeMetricsTest {

    private MutableClock clock;
    private RealtimeMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-02-20T08:30:00Z");
        metrics = new RealtimeMetrics(clock);
    }

    @Test
    void testSnapshot_empty() {
        RealtimeMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(0, snapshot.getCallsInLastMinute());
        assertEquals(0, snapshot.getAvgLatencyLastMinute());
        assertEquals(0.0, snapshot.getErrorRateLastMinute());
    }

    @Test
    void testSnapshot_lastMinuteStats() {
        metrics.record(100, true);
        metrics.record(300, false);

        RealtimeMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(2, snapshot.getCallsInLastMinute());
        assertEquals(200, snapshot.getAvgLatencyLastMinute());
        assertEquals(0.5, snapshot.getErrorRateLastMinute(), 1e-9);
    }

    @Test
    void testSnapshot_windowRollsOff() {
        metrics.record(100, true);
        clock.advance(Duration.ofMinutes(30));
        metrics.record(100, true);
        clock.advance(Duration.ofSeconds(90));

        RealtimeMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(0, snapshot.getCallsInLastMinute());
        assertEquals(2, snapshot.getCallsInLastHour());

        clock.advance(Duration.ofMinutes(30));
        assertEquals(1, metrics.snapshot().getCallsInLastHour());
    }
}
