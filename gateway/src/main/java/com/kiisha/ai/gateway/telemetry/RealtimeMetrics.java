package com.kiisha.ai.gateway.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling one-hour window of call samples for liveness monitoring.
 * All access is serialized on the window's lock.
 */
public class RealtimeMetrics {

    private static final Duration WINDOW = Duration.ofHours(1);
    private static final Duration RECENT = Duration.ofMinutes(1);

    private static final class Sample {
        final Instant timestamp;
        final long latencyMs;
        final boolean success;

        Sample(Instant timestamp, long latencyMs, boolean success) {
            this.timestamp = timestamp;
            this.latencyMs = latencyMs;
            this.success = success;
        }
    }

    private final Clock clock;
    private final Deque<Sample> samples = new ArrayDeque<>();

    public RealtimeMetrics(Clock clock) {
        this.clock = clock;
    }

    public synchronized void record(long latencyMs, boolean success) {
        Instant now = clock.instant();
        samples.addLast(new Sample(now, latencyMs, success));
        prune(now);
    }

    public synchronized Snapshot snapshot() {
        Instant now = clock.instant();
        prune(now);
        Instant minuteAgo = now.minus(RECENT);

        int lastMinute = 0;
        int errorsLastMinute = 0;
        long latencyLastMinute = 0;
        for (Sample sample : samples) {
            if (!sample.timestamp.isBefore(minuteAgo)) {
                lastMinute++;
                latencyLastMinute += sample.latencyMs;
                if (!sample.success) {
                    errorsLastMinute++;
                }
            }
        }

        return new Snapshot(
                lastMinute,
                samples.size(),
                lastMinute > 0 ? Math.round((double) latencyLastMinute / lastMinute) : 0,
                lastMinute > 0 ? (double) errorsLastMinute / lastMinute : 0.0);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!samples.isEmpty() && samples.peekFirst().timestamp.isBefore(cutoff)) {
            samples.removeFirst();
        }
    }

    /**
     * Point-in-time view of the window.
     */
    public static final class Snapshot {
        private final int callsInLastMinute;
        private final int callsInLastHour;
        private final long avgLatencyLastMinute;
        private final double errorRateLastMinute;

        Snapshot(int callsInLastMinute, int callsInLastHour, long avgLatencyLastMinute, double errorRateLastMinute) {
            this.callsInLastMinute = callsInLastMinute;
            this.callsInLastHour = callsInLastHour;
            this.avgLatencyLastMinute = avgLatencyLastMinute;
            this.errorRateLastMinute = errorRateLastMinute;
        }

        public int getCallsInLastMinute() {
            return callsInLastMinute;
        }

        public int getCallsInLastHour() {
            return callsInLastHour;
        }

        public long getAvgLatencyLastMinute() {
            return avgLatencyLastMinute;
        }

        public double getErrorRateLastMinute() {
            return errorRateLastMinute;
        }

        @Override
        public String toString() {
            return "Snapshot{lastMinute=" + callsInLastMinute + ", lastHour=" + callsInLastHour +
                    ", avgLatencyMs=" + avgLatencyLastMinute +
                    String.format(", errorRate=%.2f", errorRateLastMinute) + '}';
        }
    }
}
