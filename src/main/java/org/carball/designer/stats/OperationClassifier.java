package org.carball.designer.stats;

import lombok.extern.slf4j.Slf4j;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.PredicateType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups operations into query classes and counts how often each class occurs.
 */
@Slf4j
public class OperationClassifier {

    public QueryClass classify(Operation op) {
        SortedMap<String, PredicateType> predicates = Collections.unmodifiableSortedMap(new TreeMap<>(op.predicates()));
        List<String> contentFields = op.referencedFields().stream()
                .filter(field -> !predicates.containsKey(field))
                .sorted()
                .toList();
        return new QueryClass(op.collection(), op.type(), predicates, contentFields);
    }

    /**
     * Counts operations per query class, in order of first appearance.
     */
    public Map<QueryClass, Long> histogram(Collection<Operation> operations) {
        Map<QueryClass, Long> histogram = new LinkedHashMap<>();
        for (Operation op : operations) {
            histogram.merge(classify(op), 1L, Long::sum);
        }
        log.info("Classified {} operations into {} query classes", operations.size(), histogram.size());
        if (log.isDebugEnabled()) {
            histogram.forEach((queryClass, count) -> log.debug("  {} -> {}", queryClass, count));
        }
        return Collections.unmodifiableMap(histogram);
    }
}
