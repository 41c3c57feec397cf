package org.carball.designer.model.stats;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Date;

public enum FieldType {
    INT,
    STR,
    DATETIME,
    FLOAT,
    OTHER;

    /**
     * Classifies a sampled value. Nested documents, arrays, booleans and nulls are OTHER.
     */
    public static FieldType of(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INT;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof CharSequence) {
            return STR;
        }
        if (value instanceof Date || value instanceof Temporal) {
            return DATETIME;
        }
        return OTHER;
    }
}
