package org.carball.designer.stats;

import lombok.extern.slf4j.Slf4j;
import org.carball.designer.config.InvalidConfigurationException;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.stats.FieldStat;
import org.carball.designer.model.stats.FieldType;
import org.carball.designer.model.workload.Operation;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives per-collection and per-field statistics from a sampled dataset and the
 * captured workload.
 */
@Slf4j
public class StatisticsProcessor {

    public static final long DEFAULT_SEED = 20120101L;

    private static final int ID_SIZE = 12;
    private static final int INT_SIZE = 4;
    private static final int DATETIME_SIZE = 8;
    private static final int FLOAT_SIZE = 8;
    private static final int BOOLEAN_SIZE = 1;

    private final long seed;

    public StatisticsProcessor() {
        this(DEFAULT_SEED);
    }

    /**
     * @param seed seed for row sampling; the same seed always picks the same rows
     */
    public StatisticsProcessor(long seed) {
        this.seed = seed;
    }

    /**
     * Computes statistics for every collection present in {@code sampledRows}.
     *
     * @param sampledRows documents per collection; a collection with no documents is still known
     * @param operations  historical operations used for query use counts
     * @param sampleRate  percentage of rows, in (0, 100], used for cardinality and size estimates
     * @throws InvalidConfigurationException if the sample rate is out of range
     * @throws UnknownCollectionException    if an operation references a collection absent from the dataset
     */
    public Map<String, CollectionStat> computeStats(Map<String, ? extends Iterable<Map<String, Object>>> sampledRows,
                                                    Collection<Operation> operations,
                                                    int sampleRate) {
        if (sampleRate <= 0 || sampleRate > 100) {
            throw new InvalidConfigurationException("Sample rate must be within (0, 100], got " + sampleRate);
        }
        log.info("Computing statistics for {} collections and {} operations at {}% sample rate",
                sampledRows.size(), operations.size(), sampleRate);

        Map<String, CollectionAccumulator> accumulators = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Iterable<Map<String, Object>>> entry : sampledRows.entrySet()) {
            accumulators.put(entry.getKey(), processDataset(entry.getKey(), entry.getValue(), sampleRate));
        }

        processWorkload(accumulators, operations);

        Map<String, CollectionStat> stats = new LinkedHashMap<>();
        for (CollectionAccumulator accumulator : accumulators.values()) {
            CollectionStat stat = accumulator.toStat();
            stats.put(stat.name(), stat);
            log.info("Collection '{}': {} documents, avg size {} bytes, {} fields, interesting {}",
                    stat.name(), stat.tupleCount(), stat.avgDocSize(), stat.fields().size(), stat.interestingFields());
        }
        return Collections.unmodifiableMap(stats);
    }

    private CollectionAccumulator processDataset(String name, Iterable<Map<String, Object>> rows, int sampleRate) {
        CollectionAccumulator accumulator = new CollectionAccumulator(name);
        Random random = new Random(seed ^ name.hashCode());

        for (Map<String, Object> row : rows) {
            accumulator.tupleCount++;
            boolean sampled = random.nextInt(100) < sampleRate;
            if (sampled) {
                accumulator.sampledCount++;
            }
            for (Map.Entry<String, Object> field : row.entrySet()) {
                if (Operation.ID_FIELD.equals(field.getKey())) {
                    if (sampled) {
                        accumulator.totalBytes += ID_SIZE;
                    }
                    continue;
                }
                FieldAccumulator fieldAccumulator = accumulator.fields
                        .computeIfAbsent(field.getKey(), FieldAccumulator::new);
                if (sampled) {
                    accumulator.totalBytes += estimateSize(field.getValue());
                    fieldAccumulator.observe(field.getValue());
                }
            }
        }
        log.debug("Collection '{}': sampled {} of {} documents", name, accumulator.sampledCount, accumulator.tupleCount);
        return accumulator;
    }

    private void processWorkload(Map<String, CollectionAccumulator> accumulators, Collection<Operation> operations) {
        for (Operation op : operations) {
            CollectionAccumulator accumulator = accumulators.get(op.collection());
            if (accumulator == null) {
                throw new UnknownCollectionException(op.collection());
            }
            for (String field : op.referencedFields()) {
                if (Operation.ID_FIELD.equals(field)) {
                    accumulator.idUseCount++;
                    continue;
                }
                FieldAccumulator fieldAccumulator = accumulator.fields.get(field);
                if (fieldAccumulator != null) {
                    fieldAccumulator.queryUseCount++;
                } else {
                    log.debug("Ignoring reference to unknown field '{}' in collection '{}'", field, op.collection());
                }
            }
        }
    }

    /**
     * Estimated stored size of a value in bytes.
     */
    static long estimateSize(Object value) {
        if (value == null) {
            return 0;
        }
        switch (FieldType.of(value)) {
            case INT:
                return INT_SIZE;
            case FLOAT:
                return FLOAT_SIZE;
            case DATETIME:
                return DATETIME_SIZE;
            case STR:
                return ((CharSequence) value).length();
            default:
                break;
        }
        if (value instanceof Boolean) {
            return BOOLEAN_SIZE;
        }
        if (value instanceof Map<?, ?> document) {
            long size = 0;
            for (Object nested : document.values()) {
                size += estimateSize(nested);
            }
            return size;
        }
        if (value instanceof Iterable<?> elements) {
            long size = 0;
            for (Object element : elements) {
                size += estimateSize(element);
            }
            return size;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        return 0;
    }

    private static final class CollectionAccumulator {
        private final String name;
        private final Map<String, FieldAccumulator> fields = new LinkedHashMap<>();
        private long tupleCount;
        private long sampledCount;
        private long totalBytes;
        private long idUseCount;

        private CollectionAccumulator(String name) {
            this.name = name;
        }

        private CollectionStat toStat() {
            Map<String, FieldStat> fieldStats = new LinkedHashMap<>();
            fieldStats.put(Operation.ID_FIELD, FieldStat.of(tupleCount, tupleCount, idUseCount, FieldType.OTHER));
            for (FieldAccumulator field : fields.values()) {
                fieldStats.put(field.name,
                        FieldStat.of(field.distinctValues.size(), tupleCount, field.queryUseCount, field.type()));
            }
            // Bytes of sampled rows over every row
            long avgDocSize = tupleCount == 0 ? 0 : totalBytes / tupleCount;
            return new CollectionStat(name, tupleCount, avgDocSize, fieldStats, interestingFields(fieldStats));
        }

        private static List<String> interestingFields(Map<String, FieldStat> fieldStats) {
            return fieldStats.entrySet().stream()
                    .filter(e -> !Operation.ID_FIELD.equals(e.getKey()))
                    .filter(e -> e.getValue().queryUseCount() > 0 && e.getValue().selectivity() > 0)
                    .sorted(Comparator
                            .comparingDouble((Map.Entry<String, FieldStat> e) -> e.getValue().selectivity()).reversed()
                            .thenComparing(e -> e.getValue().queryUseCount(), Comparator.reverseOrder())
                            .thenComparing(Map.Entry::getKey))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
        }
    }

    private static final class FieldAccumulator {
        private final String name;
        private final Set<Object> distinctValues = new HashSet<>();
        private FieldType type;
        private boolean conflictingTypes;
        private long queryUseCount;

        private FieldAccumulator(String name) {
            this.name = name;
        }

        private void observe(Object value) {
            if (value == null) {
                return;
            }
            distinctValues.add(value);
            FieldType observed = FieldType.of(value);
            if (type == null) {
                type = observed;
            } else if (type != observed && !conflictingTypes) {
                log.debug("Field '{}' holds both {} and {} values, treating it as {}",
                        name, type, observed, FieldType.OTHER);
                conflictingTypes = true;
            }
        }

        private FieldType type() {
            if (type == null || conflictingTypes) {
                return FieldType.OTHER;
            }
            return type;
        }
    }
}
