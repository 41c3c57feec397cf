package org.carball.designer.model.workload;

/**
 * Kind of constraint an operation places on a field.
 */
public enum PredicateType {
    EQUALITY,
    RANGE,
    REGEX
}
