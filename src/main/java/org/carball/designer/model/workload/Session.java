package org.carball.designer.model.workload;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Operations issued over one client connection, in the order they were captured.
 */
@Builder
public record Session(
        long sessionId,
        String clientAddress,
        String serverAddress,
        Instant startTime,
        Instant endTime,
        List<Operation> operations
) {

    public Session {
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        operations = operations == null ? List.of() : List.copyOf(operations);
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException(String.format(
                    "Session %d ends (%s) before it starts (%s)", sessionId, endTime, startTime));
        }
        for (Operation op : operations) {
            if (op.queryTime().isBefore(startTime) || op.respTime().isAfter(endTime)) {
                throw new IllegalArgumentException(String.format(
                        "Operation on '%s' at %s falls outside session %d [%s, %s]",
                        op.collection(), op.queryTime(), sessionId, startTime, endTime));
            }
        }
    }
}
