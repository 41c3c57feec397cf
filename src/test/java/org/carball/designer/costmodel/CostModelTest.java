package org.carball.designer.costmodel;

import org.carball.designer.config.CostModelConfig;
import org.carball.designer.config.InvalidConfigurationException;
import org.carball.designer.model.cost.CostBreakdown;
import org.carball.designer.model.design.Design;
import org.carball.designer.model.design.InvalidDesignException;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.model.workload.OperationType;
import org.carball.designer.stats.StatisticsProcessor;
import org.carball.designer.stats.UnknownCollectionException;
import org.carball.designer.workload.SegmentedWorkload;
import org.carball.designer.workload.WorkloadSegmenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.carball.designer.WorkloadFixtures.at;
import static org.carball.designer.WorkloadFixtures.config;
import static org.carball.designer.WorkloadFixtures.equalityQuery;
import static org.carball.designer.WorkloadFixtures.insert;
import static org.carball.designer.WorkloadFixtures.rows;
import static org.carball.designer.WorkloadFixtures.scanQuery;
import static org.carball.designer.WorkloadFixtures.session;

public class CostModelTest {

    private static final int NODES = 4;

    private Map<String, CollectionStat> stats;
    private final WorkloadSegmenter segmenter = new WorkloadSegmenter();

    @BeforeEach
    void setUp() {
        // 16 bytes per document: _id (12) plus one int field (4)
        stats = new StatisticsProcessor().computeStats(Map.of(
                "articles", rows(100, "author", 10),
                "comments", rows(300, "article_id", 100)), List.of(), 100);
    }

    private SegmentedWorkload workload(int intervals, List<Operation> operations) {
        return segmenter.segment(List.of(session(1, operations)), intervals);
    }

    private CostModel model(List<Operation> operations) {
        return new CostModel(stats, workload(1, operations), config(NODES, 1));
    }

    private static List<Operation> authorQueries(int count) {
        List<Operation> operations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            operations.add(equalityQuery("articles", Map.of("author", i % 10), i));
        }
        return operations;
    }

    @Test
    void shouldChargeOneNodePerRoutedOperation() {
        // Given
        CostModel model = model(authorQueries(20));

        // When
        double routed = model.networkCost(Design.builder().shardKey("articles", "author").build());
        double broadcast = model.networkCost(Design.builder().build());

        // Then
        assertThat(routed).isEqualTo(1.0);
        assertThat(broadcast).isEqualTo(NODES);
    }

    @Test
    void shouldWeighReadsByResponseSize() {
        // Given: mean query response is 200 bytes
        Operation small = Operation.builder().collection("articles").type(OperationType.QUERY)
                .responseSize(100).queryTime(at(0)).respTime(at(0)).build();
        Operation large = Operation.builder().collection("articles").type(OperationType.QUERY)
                .responseSize(300).queryTime(at(1)).respTime(at(1)).build();
        Operation write = insert("articles", Map.of("author", 1), 2);

        // When
        CostModel model = model(List.of(small, large, write));

        // Then
        assertThat(model.operationWeight(small)).isEqualTo(0.5);
        assertThat(model.operationWeight(large)).isEqualTo(1.5);
        assertThat(model.operationWeight(write)).isEqualTo(1.0);
        assertThat(model.networkCost(Design.builder().build())).isCloseTo(NODES, within(1e-9));
    }

    @Test
    void shouldScoreUniformLoadWithoutSkew() {
        // Given: only broadcasts, so every node does the same work
        List<Operation> scans = List.of(scanQuery("articles", 0), scanQuery("articles", 1), scanQuery("comments", 2));

        // When
        double skew = model(scans).skewCost(Design.builder().build());

        // Then
        assertThat(skew).isZero();
    }

    @Test
    void shouldScoreHotspotAsFullSkew() {
        // Given: every query targets the same shard key value
        List<Operation> hot = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            hot.add(equalityQuery("articles", Map.of("author", 7), i));
        }

        // When
        double skew = model(hot).skewCost(Design.builder().shardKey("articles", "author").build());

        // Then
        assertThat(skew).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldTakeWorstIntervalForSkew() {
        // Given: a quiet broadcast interval followed by a hotspot interval
        List<Operation> operations = new ArrayList<>();
        operations.add(scanQuery("articles", 0));
        for (int i = 0; i < 5; i++) {
            operations.add(equalityQuery("articles", Map.of("author", 3), 100));
        }
        CostModel model = new CostModel(stats, workload(2, operations), config(NODES, 2));

        // When
        double skew = model.skewCost(Design.builder().shardKey("articles", "author").build());

        // Then: the hotspot interval holds 5 routed queries plus nothing else
        assertThat(skew).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldMeasureImbalance() {
        assertThat(CostModel.imbalance(new long[]{5, 5, 5})).isZero();
        assertThat(CostModel.imbalance(new long[]{0, 0, 0})).isZero();
        assertThat(CostModel.imbalance(new long[]{7})).isZero();
        assertThat(CostModel.imbalance(new long[]{4, 0})).isCloseTo(1.0, within(1e-9));
        assertThat(CostModel.imbalance(new long[]{3, 1, 1, 1}))
                .isGreaterThan(0.0)
                .isLessThan(CostModel.imbalance(new long[]{6, 1, 1, 1}));
    }

    @Test
    void shouldSumCollectionFootprints() {
        CostModel model = model(List.of());

        assertThat(model.diskCost(Design.builder().build())).isEqualTo(100 * 16 + 300 * 16);
    }

    @Test
    void shouldGrowDiskCostWithCollectionSize() {
        // Given
        Map<String, CollectionStat> larger = new StatisticsProcessor().computeStats(Map.of(
                "articles", rows(200, "author", 10),
                "comments", rows(300, "article_id", 100)), List.of(), 100);
        Design design = Design.builder().build();

        // When
        double small = model(List.of()).diskCost(design);
        double large = new CostModel(larger, workload(1, List.of()), config(NODES, 1)).diskCost(design);

        // Then
        assertThat(large).isGreaterThan(small);
    }

    @Test
    void shouldKeepFootprintWhenEmbeddingChild() {
        // Given
        CostModel model = model(List.of());
        Design separate = Design.builder().build();
        Design embedded = Design.builder().denormalize("comments", "articles").build();

        // When / Then
        assertThat(model.diskCost(embedded)).isEqualTo(model.diskCost(separate));
    }

    @Test
    void shouldFallBackToChildSizeForEmptyParent() {
        // Given
        Map<String, CollectionStat> withEmptyParent = new StatisticsProcessor().computeStats(Map.of(
                "drafts", List.<Map<String, Object>>of(),
                "comments", rows(300, "article_id", 100)), List.of(), 100);
        CostModel model = new CostModel(withEmptyParent, workload(1, List.of()), config(NODES, 1));

        // When
        double embedded = model.diskCost(Design.builder().denormalize("comments", "drafts").build());

        // Then
        assertThat(embedded).isEqualTo(300 * 16);
    }

    @Test
    void shouldAddIndexOverhead() {
        // Given
        CostModel model = model(List.of());
        double base = model.diskCost(Design.builder().build());

        // When
        double indexed = model.diskCost(Design.builder().index("articles", "author").build());

        // Then: one 8 byte address per article
        assertThat(indexed - base).isEqualTo(100 * 8);
    }

    @Test
    void shouldPenalizeDesignsExceedingMemory() {
        // Given
        CostModelConfig tiny = config(NODES, 1).toBuilder().maxMemoryBytes(1000).build();
        CostModel model = new CostModel(stats, workload(1, List.of()), tiny);

        // When
        CostBreakdown cost = model.evaluate(Design.builder().build());

        // Then
        assertThat(cost.feasible()).isFalse();
        assertThat(cost.disk()).isEqualTo(6400 * CostModel.INFEASIBLE_PENALTY_FACTOR);
        assertThat(cost.getSummary()).contains("exceeds memory budget");
    }

    @Test
    void shouldCombineWeightedCosts() {
        // Given
        CostModelConfig weighted = config(NODES, 1).toBuilder()
                .weightNetwork(2.0).weightSkew(3.0).weightDisk(0.5).build();
        CostModel model = new CostModel(stats, workload(1, authorQueries(10)), weighted);

        // When
        CostBreakdown cost = model.evaluate(Design.builder().build());

        // Then
        double expected = 2.0 * cost.network() + 3.0 * cost.skew() + 0.5 * cost.disk() / (1L << 30);
        assertThat(cost.overall()).isCloseTo(expected, within(1e-12));
        assertThat(cost.feasible()).isTrue();
    }

    @Test
    void shouldNotDecreaseWhenAnyComponentGrows() {
        CostModelConfig config = config(NODES, 1);
        double base = CostModel.combine(1.0, 0.2, 1000, config);

        assertThat(CostModel.combine(1.5, 0.2, 1000, config)).isGreaterThanOrEqualTo(base);
        assertThat(CostModel.combine(1.0, 0.4, 1000, config)).isGreaterThanOrEqualTo(base);
        assertThat(CostModel.combine(1.0, 0.2, 5000, config)).isGreaterThanOrEqualTo(base);
        assertThat(CostModel.combine(1.0, 0.2, 1000, config.toBuilder().weightSkew(0.0).build()))
                .isLessThanOrEqualTo(base);
    }

    @Test
    void shouldRescoreWithOtherWeights() {
        // Given
        CostModel model = model(authorQueries(10));
        Design design = Design.builder().build();
        CostModelConfig networkOnly = config(NODES, 1).toBuilder().weightSkew(0.0).weightDisk(0.0).build();

        // When
        double overall = model.overallCost(design, networkOnly);

        // Then
        assertThat(overall).isEqualTo(model.networkCost(design));
    }

    @Test
    void shouldScoreEmptyWorkloadAsZero() {
        // Given
        CostModel model = new CostModel(stats, segmenter.segment(List.of(), 5), config(NODES, 5));
        Design design = Design.builder().shardKey("articles", "author").build();

        // When / Then
        assertThat(model.networkCost(design)).isZero();
        assertThat(model.skewCost(design)).isZero();
    }

    @Test
    void shouldRejectWorkloadOnUnknownCollection() {
        SegmentedWorkload workload = workload(1, List.of(scanQuery("users", 0)));

        assertThatThrownBy(() -> new CostModel(stats, workload, config(NODES, 1)))
                .isInstanceOf(UnknownCollectionException.class)
                .hasMessageContaining("users");
    }

    @Test
    void shouldRejectInvalidConfig() {
        SegmentedWorkload workload = workload(1, List.of());

        assertThatThrownBy(() -> new CostModel(stats, workload, config(0, 1)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void shouldRejectInvalidDesigns() {
        CostModel model = model(List.of());

        assertThatThrownBy(() -> model.evaluate(Design.builder().shardKey("users", "email").build()))
                .isInstanceOf(UnknownCollectionException.class);
        assertThatThrownBy(() -> model.evaluate(Design.builder().denormalize("comments", "comments").build()))
                .isInstanceOf(InvalidDesignException.class);
    }

    @Test
    void shouldEvaluateDeterministically() {
        // Given
        CostModel model = model(authorQueries(50));
        Design design = Design.builder().shardKey("articles", "author").index("comments", "article_id").build();

        // When
        CostBreakdown first = model.evaluate(design);
        CostBreakdown second = CostModel.evaluate(design, stats, workload(1, authorQueries(50)), config(NODES, 1));

        // Then
        assertThat(second).isEqualTo(first);
    }
}
