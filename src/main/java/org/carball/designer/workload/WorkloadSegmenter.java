package org.carball.designer.workload;

import lombok.extern.slf4j.Slf4j;
import org.carball.designer.config.InvalidConfigurationException;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.Session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a trace into chronological intervals for temporal skew analysis.
 *
 * <p>The trace span runs from the earliest session start (or operation) to the latest
 * session end. Each operation belongs to the interval holding its query time; an operation
 * exactly on an interior boundary belongs to the earlier interval, the first and last
 * boundaries belong to the first and last interval.
 */
@Slf4j
public class WorkloadSegmenter {

    public SegmentedWorkload segment(List<Session> sessions, int intervalCount) {
        if (intervalCount <= 0) {
            throw new InvalidConfigurationException("Interval count must be positive, got " + intervalCount);
        }

        List<List<Operation>> buckets = new ArrayList<>(intervalCount);
        for (int i = 0; i < intervalCount; i++) {
            buckets.add(new ArrayList<>());
        }

        Instant minTime = null;
        Instant maxTime = null;
        int operationCount = 0;
        for (Session session : sessions) {
            minTime = earliest(minTime, session.startTime());
            maxTime = latest(maxTime, session.endTime());
            for (Operation op : session.operations()) {
                minTime = earliest(minTime, op.queryTime());
                maxTime = latest(maxTime, op.queryTime());
                operationCount++;
            }
        }

        if (operationCount == 0) {
            log.info("Empty workload, returning {} empty intervals", intervalCount);
            return new SegmentedWorkload(buckets);
        }

        Duration span = Duration.between(minTime, maxTime);
        for (Session session : sessions) {
            for (Operation op : session.operations()) {
                Duration offset = Duration.between(minTime, op.queryTime());
                buckets.get(intervalOf(offset, span, intervalCount)).add(op);
            }
        }

        log.info("Segmented {} operations spanning {} into {} intervals", operationCount, span, intervalCount);
        if (log.isDebugEnabled()) {
            for (int i = 0; i < intervalCount; i++) {
                log.debug("  interval[{}]: {} operations", i, buckets.get(i).size());
            }
        }
        return new SegmentedWorkload(buckets);
    }

    /**
     * Interval index for an offset within the span. Spans longer than about 292 years do
     * not fit in a long of nanoseconds and are divided in floating point seconds instead.
     */
    static int intervalOf(Duration offset, Duration span, int intervalCount) {
        long offsetNanos;
        long spanNanos;
        try {
            offsetNanos = offset.toNanos();
            spanNanos = span.toNanos();
        } catch (ArithmeticException e) {
            double ratio = toSeconds(offset) / toSeconds(span);
            return clamp((long) Math.ceil(ratio * intervalCount) - 1, intervalCount);
        }
        return intervalOf(offsetNanos, spanNanos, intervalCount);
    }

    /**
     * Interval index for an offset within the span: ceil(offset * count / span) - 1, clamped.
     */
    static int intervalOf(long offsetNanos, long spanNanos, int intervalCount) {
        if (spanNanos <= 0 || offsetNanos <= 0) {
            return 0;
        }
        long index;
        try {
            long scaled = Math.multiplyExact(offsetNanos, (long) intervalCount);
            long quotient = scaled / spanNanos;
            if (scaled % spanNanos != 0) {
                quotient++;
            }
            index = quotient - 1;
        } catch (ArithmeticException e) {
            // offset * count overflows for spans of decades
            index = (long) Math.ceil((double) offsetNanos * intervalCount / spanNanos) - 1;
        }
        return clamp(index, intervalCount);
    }

    private static int clamp(long index, int intervalCount) {
        return (int) Math.max(0, Math.min(intervalCount - 1, index));
    }

    private static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    private static Instant earliest(Instant current, Instant candidate) {
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    private static Instant latest(Instant current, Instant candidate) {
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
