package org.carball.designer.stats;

import org.carball.designer.model.workload.OperationType;
import org.carball.designer.model.workload.PredicateType;

import java.util.List;
import java.util.SortedMap;

/**
 * Shape of an operation with its values stripped: two operations share a query class
 * when they touch the same collection in the same way.
 */
public record QueryClass(
        String collection,
        OperationType type,
        SortedMap<String, PredicateType> predicates,
        List<String> contentFields
) {

    @Override
    public String toString() {
        return collection + "." + type.name().toLowerCase() + predicates + contentFields;
    }
}
