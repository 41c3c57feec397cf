package org.carball.designer.model.stats;

/**
 * Statistics for one field of a collection.
 */
public record FieldStat(
        long cardinality,
        double selectivity,
        long queryUseCount,
        FieldType type
) {

    public FieldStat {
        if (cardinality < 0) {
            throw new IllegalArgumentException("Cardinality must not be negative: " + cardinality);
        }
        if (selectivity < 0.0 || selectivity > 1.0) {
            throw new IllegalArgumentException("Selectivity must be within [0, 1]: " + selectivity);
        }
        if (queryUseCount < 0) {
            throw new IllegalArgumentException("Query use count must not be negative: " + queryUseCount);
        }
        if (type == null) {
            type = FieldType.OTHER;
        }
    }

    /**
     * Builds a stat whose selectivity is {@code cardinality / tupleCount}, capped at 1, or 0 for an empty collection.
     */
    public static FieldStat of(long cardinality, long tupleCount, long queryUseCount, FieldType type) {
        double selectivity = tupleCount > 0 ? Math.min(1.0, (double) cardinality / tupleCount) : 0.0;
        return new FieldStat(cardinality, selectivity, queryUseCount, type);
    }
}
