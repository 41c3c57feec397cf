package org.carball.designer.model.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sampled size and per-field statistics for one collection.
 *
 * <p>{@code interestingFields} lists high-selectivity fields the workload actually
 * references. It is advisory input for whoever proposes shard keys and is not read by
 * the cost model.
 */
public record CollectionStat(
        String name,
        long tupleCount,
        long avgDocSize,
        Map<String, FieldStat> fields,
        List<String> interestingFields
) {

    public CollectionStat {
        Objects.requireNonNull(name, "name");
        if (tupleCount < 0 || avgDocSize < 0) {
            throw new IllegalArgumentException(String.format(
                    "Collection '%s' has negative size statistics (tuples=%d, avgDocSize=%d)",
                    name, tupleCount, avgDocSize));
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        interestingFields = interestingFields == null ? List.of() : List.copyOf(interestingFields);
    }

    public Optional<FieldStat> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Estimated standalone footprint in bytes.
     */
    public long baseSize() {
        return tupleCount * avgDocSize;
    }
}
