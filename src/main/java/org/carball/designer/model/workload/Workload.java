package org.carball.designer.model.workload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The captured trace: an ordered, already-deduplicated list of sessions.
 */
public record Workload(List<Session> sessions) {

    public Workload {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }

    public static Workload empty() {
        return new Workload(List.of());
    }

    /**
     * All operations in session order, then capture order within each session.
     */
    public List<Operation> operations() {
        List<Operation> operations = new ArrayList<>();
        for (Session session : sessions) {
            operations.addAll(session.operations());
        }
        return Collections.unmodifiableList(operations);
    }

    public int operationCount() {
        return sessions.stream().mapToInt(s -> s.operations().size()).sum();
    }

    public boolean isEmpty() {
        return operationCount() == 0;
    }
}
