package org.carball.designer.workload;

import org.carball.designer.model.workload.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A workload split into consecutive, equal-width time intervals.
 */
public record SegmentedWorkload(List<List<Operation>> intervals) {

    public SegmentedWorkload {
        List<List<Operation>> copy = new ArrayList<>(intervals.size());
        for (List<Operation> interval : intervals) {
            copy.add(List.copyOf(interval));
        }
        intervals = Collections.unmodifiableList(copy);
    }

    public int intervalCount() {
        return intervals.size();
    }

    public List<Operation> interval(int index) {
        return intervals.get(index);
    }

    /**
     * Every operation once, interval by interval.
     */
    public List<Operation> allOperations() {
        List<Operation> operations = new ArrayList<>(operationCount());
        intervals.forEach(operations::addAll);
        return Collections.unmodifiableList(operations);
    }

    public int operationCount() {
        return intervals.stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return operationCount() == 0;
    }
}
