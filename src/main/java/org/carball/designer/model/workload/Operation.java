package org.carball.designer.model.workload;

import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single captured database operation. Content documents are deep-copied into
 * unmodifiable structures, so an operation can be shared freely between threads.
 *
 * <p>Query documents may be wrapped under {@code $query}, next to modifiers such as
 * {@code $orderby} that do not filter. Write documents may hold {@code $}-prefixed
 * modifiers such as {@code $set}. Fields under {@code $query} of a query, or under any
 * modifier of a write, count as fields of the operation itself.
 */
@Builder
public record Operation(
        String collection,
        OperationType type,
        Map<String, PredicateType> predicates,
        List<Map<String, Object>> queryContent,
        long responseSize,
        Instant queryTime,
        Instant respTime
) {

    public static final String ID_FIELD = "_id";

    private static final String OPERATOR_PREFIX = "$";
    private static final String QUERY_WRAPPER = "$query";
    private static final String EQ_OPERATOR = "$eq";

    public Operation {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(queryTime, "queryTime");
        Objects.requireNonNull(respTime, "respTime");
        if (respTime.isBefore(queryTime)) {
            throw new IllegalArgumentException(String.format(
                    "Response time %s precedes query time %s for operation on '%s'",
                    respTime, queryTime, collection));
        }
        if (responseSize < 0) {
            throw new IllegalArgumentException("Response size must not be negative: " + responseSize);
        }
        predicates = predicates == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(predicates));
        queryContent = queryContent == null ? List.of() : freezeDocuments(queryContent);
    }

    /**
     * Fields referenced by the predicates or the written content, in first-seen order.
     */
    public Set<String> referencedFields() {
        Set<String> fields = new LinkedHashSet<>(predicates.keySet());
        for (Map<String, Object> document : queryContent) {
            collectFields(document, fields);
        }
        return fields;
    }

    public boolean hasEqualityPredicate(String field) {
        return predicates.get(field) == PredicateType.EQUALITY;
    }

    /**
     * Looks up the value the operation supplies for a top-level field, searching
     * inside the wrappers that hold its fields and unwrapping {@code {$eq: v}}.
     */
    public Optional<Object> findValue(String field) {
        for (Map<String, Object> document : queryContent) {
            Optional<Object> value = findValue(document, field);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private Optional<Object> findValue(Map<String, Object> document, String field) {
        if (document.containsKey(field)) {
            Object value = document.get(field);
            if (value instanceof Map<?, ?> nested && nested.size() == 1 && nested.containsKey(EQ_OPERATOR)) {
                value = nested.get(EQ_OPERATOR);
            }
            return Optional.ofNullable(value);
        }
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (holdsFields(entry.getKey()) && entry.getValue() instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Optional<Object> value = findValue((Map<String, Object>) nested, field);
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    private void collectFields(Map<String, Object> document, Set<String> fields) {
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(OPERATOR_PREFIX)) {
                if (holdsFields(key) && entry.getValue() instanceof Map<?, ?> nested) {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> operand = (Map<String, Object>) nested;
                    collectFields(operand, fields);
                }
            } else {
                fields.add(key);
            }
        }
    }

    /**
     * Whether a {@code $}-prefixed key wraps fields of the operation: only {@code $query}
     * for a query, any update modifier for a write.
     */
    private boolean holdsFields(String key) {
        if (type == OperationType.QUERY) {
            return QUERY_WRAPPER.equals(key);
        }
        return key.startsWith(OPERATOR_PREFIX);
    }

    private static List<Map<String, Object>> freezeDocuments(List<Map<String, Object>> documents) {
        List<Map<String, Object>> frozen = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents) {
            frozen.add(freezeDocument(document));
        }
        return Collections.unmodifiableList(frozen);
    }

    private static Map<String, Object> freezeDocument(Map<String, Object> document) {
        Map<String, Object> copy = new LinkedHashMap<>();
        document.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeDocument((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freezeValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
