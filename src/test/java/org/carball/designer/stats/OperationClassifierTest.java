package org.carball.designer.stats;

import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.OperationType;
import org.carball.designer.model.workload.PredicateType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.designer.WorkloadFixtures.equalityQuery;
import static org.carball.designer.WorkloadFixtures.insert;

public class OperationClassifierTest {

    private final OperationClassifier classifier = new OperationClassifier();

    @Test
    void shouldIgnoreValuesWhenClassifying() {
        QueryClass first = classifier.classify(equalityQuery("articles", Map.of("author", "a0"), 0));
        QueryClass second = classifier.classify(equalityQuery("articles", Map.of("author", "zz"), 5));

        assertThat(first).isEqualTo(second);
        assertThat(first.predicates()).containsEntry("author", PredicateType.EQUALITY);
        assertThat(first.type()).isEqualTo(OperationType.QUERY);
    }

    @Test
    void shouldSeparateDifferentShapes() {
        QueryClass byAuthor = classifier.classify(equalityQuery("articles", Map.of("author", "a0"), 0));
        QueryClass bySlug = classifier.classify(equalityQuery("articles", Map.of("slug", "d4"), 0));
        QueryClass insert = classifier.classify(insert("articles", Map.of("author", "a0"), 0));

        assertThat(byAuthor).isNotEqualTo(bySlug);
        assertThat(insert).isNotEqualTo(byAuthor);
        assertThat(insert.contentFields()).containsExactly("author");
    }

    @Test
    void shouldCountOperationsPerClassInFirstSeenOrder() {
        // Given
        List<Operation> operations = List.of(
                insert("comments", Map.of("text", "hi"), 0),
                equalityQuery("articles", Map.of("author", "a0"), 1),
                equalityQuery("articles", Map.of("author", "a1"), 2),
                insert("comments", Map.of("text", "bye"), 3));

        // When
        Map<QueryClass, Long> histogram = classifier.histogram(operations);

        // Then
        assertThat(histogram).hasSize(2);
        assertThat(histogram.values()).containsExactly(2L, 2L);
        assertThat(histogram.keySet().iterator().next().collection()).isEqualTo("comments");
    }
}
