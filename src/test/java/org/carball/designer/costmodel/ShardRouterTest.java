package org.carball.designer.costmodel;

import org.carball.designer.model.design.Design;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.OperationType;
import org.carball.designer.model.workload.PredicateType;
import org.carball.designer.stats.StatisticsProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.designer.WorkloadFixtures.at;
import static org.carball.designer.WorkloadFixtures.equalityQuery;
import static org.carball.designer.WorkloadFixtures.rows;
import static org.carball.designer.WorkloadFixtures.scanQuery;

public class ShardRouterTest {

    private static final int NODES = 4;

    private ShardRouter router;

    @BeforeEach
    void setUp() {
        Map<String, CollectionStat> stats = new StatisticsProcessor().computeStats(Map.of(
                "articles", rows(20, "author", 5),
                "comments", rows(60, "article_id", 20),
                "drafts", List.<Map<String, Object>>of()), List.of(), 100);
        router = new ShardRouter(stats, NODES);
    }

    @Test
    void shouldRouteEqualityOnShardKeyToOneNode() {
        // Given
        Design design = Design.builder().shardKey("articles", "author").build();
        Operation op = equalityQuery("articles", Map.of("author", 3), 0);

        // When
        ShardRouter.Route route = router.route(op, design);

        // Then
        assertThat(route.singleNode()).isTrue();
        assertThat(route.nodesTouched()).isEqualTo(1);
        assertThat(route.targetNode()).isBetween(0, NODES - 1);
        assertThat(router.route(equalityQuery("articles", Map.of("author", 3), 9), design))
                .isEqualTo(route);
    }

    @Test
    void shouldBroadcastWithoutShardKeyPredicate() {
        Design design = Design.builder().shardKey("articles", "author").build();

        ShardRouter.Route route = router.route(scanQuery("articles", 0), design);

        assertThat(route.singleNode()).isFalse();
        assertThat(route.targetNode()).isEqualTo(-1);
        assertThat(route.nodesTouched()).isEqualTo(NODES);
    }

    @Test
    void shouldBroadcastRangePredicates() {
        // Given
        Design design = Design.builder().shardKey("articles", "author").build();
        Operation range = Operation.builder()
                .collection("articles")
                .type(OperationType.QUERY)
                .predicates(Map.of("author", PredicateType.RANGE))
                .queryContent(List.of(Map.<String, Object>of("author", Map.of("$gt", 2))))
                .queryTime(at(0))
                .respTime(at(0))
                .build();

        // When / Then
        assertThat(router.route(range, design).singleNode()).isFalse();
    }

    @Test
    void shouldRequireEveryFieldOfCompoundKey() {
        Design design = Design.builder().shardKey("articles", "author", "_id").build();

        assertThat(router.route(equalityQuery("articles", Map.of("author", 1), 0), design).singleNode())
                .isFalse();
        assertThat(router.route(equalityQuery("articles", Map.of("author", 1, "_id", 7), 0), design).singleNode())
                .isTrue();
    }

    @Test
    void shouldUseIdWhenNoShardKeyIsSet() {
        Design design = Design.builder().build();

        assertThat(router.route(equalityQuery("articles", Map.of("_id", 4), 0), design).singleNode()).isTrue();
        assertThat(router.route(equalityQuery("articles", Map.of("author", 4), 0), design).singleNode()).isFalse();
    }

    @Test
    void shouldBroadcastWhenCardinalityIsUnknown() {
        // Given: drafts has no documents, so _id cardinality is zero
        Design design = Design.builder().build();

        // When / Then
        assertThat(router.route(equalityQuery("drafts", Map.of("_id", 1), 0), design).singleNode()).isFalse();
        assertThat(router.route(equalityQuery("articles", Map.of("title", "x"),
                0), Design.builder().shardKey("articles", "title").build()).singleNode()).isFalse();
    }

    @Test
    void shouldRouteEmbeddedCollectionByRootShardKey() {
        // Given: comments live inside articles, which are sharded on a field only comments carry
        Design design = Design.builder()
                .shardKey("articles", "article_id")
                .denormalize("comments", "articles")
                .build();

        // When
        ShardRouter.Route byArticle = router.route(equalityQuery("comments", Map.of("article_id", 2), 0), design);
        ShardRouter.Route byId = router.route(equalityQuery("comments", Map.of("_id", 2), 0), design);

        // Then
        assertThat(byArticle.singleNode()).isTrue();
        assertThat(byId.singleNode()).isFalse();
    }
}
