package org.carball.designer.costmodel;

import lombok.extern.slf4j.Slf4j;
import org.carball.designer.config.CostModelConfig;
import org.carball.designer.model.cost.CostBreakdown;
import org.carball.designer.model.design.Design;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.workload.Operation;
import org.carball.designer.stats.UnknownCollectionException;
import org.carball.designer.workload.SegmentedWorkload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores candidate designs against an immutable snapshot of collection statistics and a
 * segmented workload.
 *
 * <p>Every cost function is a pure function of the design and the snapshot taken at
 * construction, so one instance may be shared by any number of threads.
 */
@Slf4j
public class CostModel {

    /**
     * Multiplier applied to the footprint of a design that does not fit in memory.
     */
    public static final double INFEASIBLE_PENALTY_FACTOR = 1000.0;

    private final Map<String, CollectionStat> stats;
    private final SegmentedWorkload workload;
    private final List<Operation> operations;
    private final CostModelConfig config;
    private final ShardRouter router;
    private final double meanQueryResponseSize;

    /**
     * @throws org.carball.designer.config.InvalidConfigurationException if the config is unusable
     * @throws UnknownCollectionException if an operation references a collection without statistics
     */
    public CostModel(Map<String, CollectionStat> stats, SegmentedWorkload workload, CostModelConfig config) {
        config.validate();
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        this.workload = workload;
        this.operations = workload.allOperations();
        this.config = config;
        this.router = new ShardRouter(this.stats, config.getNodeCount());

        long queryCount = 0;
        double responseBytes = 0;
        for (Operation op : operations) {
            if (!this.stats.containsKey(op.collection())) {
                throw new UnknownCollectionException(op.collection());
            }
            if (op.type().isRead()) {
                queryCount++;
                responseBytes += op.responseSize();
            }
        }
        this.meanQueryResponseSize = queryCount == 0 ? 0.0 : responseBytes / queryCount;

        log.debug("Cost model ready: {} collections, {} operations in {} intervals, {}",
                this.stats.size(), operations.size(), workload.intervalCount(), config.getConfigurationSummary());
    }

    /**
     * One-shot evaluation for callers holding the raw snapshot.
     */
    public static CostBreakdown evaluate(Design design,
                                         Map<String, CollectionStat> stats,
                                         SegmentedWorkload workload,
                                         CostModelConfig config) {
        return new CostModel(stats, workload, config).evaluate(design);
    }

    /**
     * Computes every cost of the design, validating it once.
     */
    public CostBreakdown evaluate(Design design) {
        design.validate(stats.keySet());

        double network = computeNetworkCost(design);
        double skew = computeSkewCost(design);
        double footprint = estimateFootprint(design);
        boolean feasible = footprint <= config.getMaxMemoryBytes();
        double disk = feasible ? footprint : footprint * INFEASIBLE_PENALTY_FACTOR;
        double overall = combine(network, skew, disk, config);

        CostBreakdown breakdown = new CostBreakdown(network, skew, disk, overall, feasible);
        log.debug("Evaluated {}: {}", design, breakdown.getSummary());
        return breakdown;
    }

    /**
     * Average nodes touched per operation, each operation scaled by its weight.
     * Returns 0 for an empty workload.
     */
    public double networkCost(Design design) {
        design.validate(stats.keySet());
        return computeNetworkCost(design);
    }

    /**
     * Worst per-interval load imbalance, in [0, 1].
     */
    public double skewCost(Design design) {
        design.validate(stats.keySet());
        return computeSkewCost(design);
    }

    /**
     * Estimated storage footprint in bytes, or the penalized footprint when it exceeds the memory budget.
     */
    public double diskCost(Design design) {
        design.validate(stats.keySet());
        double footprint = estimateFootprint(design);
        if (footprint > config.getMaxMemoryBytes()) {
            log.debug("Design needs {} bytes, budget is {}", (long) footprint, config.getMaxMemoryBytes());
            return footprint * INFEASIBLE_PENALTY_FACTOR;
        }
        return footprint;
    }

    public double overallCost(Design design) {
        return evaluate(design).overall();
    }

    /**
     * Overall cost using another config's weights and memory budget; cluster shape stays that of this model.
     */
    public double overallCost(Design design, CostModelConfig weights) {
        weights.validate();
        CostBreakdown breakdown = evaluate(design);
        double footprint = breakdown.feasible() ? breakdown.disk() : breakdown.disk() / INFEASIBLE_PENALTY_FACTOR;
        double disk = footprint <= weights.getMaxMemoryBytes() ? footprint : footprint * INFEASIBLE_PENALTY_FACTOR;
        return combine(breakdown.network(), breakdown.skew(), disk, weights);
    }

    /**
     * Weighted sum of the three costs, disk normalized by the memory budget.
     * Non-decreasing in each cost since weights are non-negative.
     */
    public static double combine(double network, double skew, double disk, CostModelConfig config) {
        return config.getWeightNetwork() * network
                + config.getWeightSkew() * skew
                + config.getWeightDisk() * (disk / config.getMaxMemoryBytes());
    }

    public CostModelConfig getConfig() {
        return config;
    }

    public Map<String, CollectionStat> getStats() {
        return stats;
    }

    public SegmentedWorkload getWorkload() {
        return workload;
    }

    private double computeNetworkCost(Design design) {
        if (operations.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Operation op : operations) {
            total += router.route(op, design).nodesTouched() * operationWeight(op);
        }
        return total / operations.size();
    }

    /**
     * Reads weigh by response size relative to the mean query response, writes weigh 1.
     */
    double operationWeight(Operation op) {
        if (op.type().isWrite() || meanQueryResponseSize == 0.0) {
            return 1.0;
        }
        return op.responseSize() / meanQueryResponseSize;
    }

    private double computeSkewCost(Design design) {
        int nodeCount = config.getNodeCount();
        double worst = 0.0;
        for (int i = 0; i < workload.intervalCount(); i++) {
            long[] perNode = new long[nodeCount];
            for (Operation op : workload.interval(i)) {
                ShardRouter.Route route = router.route(op, design);
                if (route.singleNode()) {
                    perNode[route.targetNode()]++;
                } else {
                    for (int node = 0; node < nodeCount; node++) {
                        perNode[node]++;
                    }
                }
            }
            double imbalance = imbalance(perNode);
            log.trace("Interval {} imbalance {}", i, imbalance);
            worst = Math.max(worst, imbalance);
        }
        return worst;
    }

    /**
     * Coefficient of variation of per-node counts, scaled by sqrt(n - 1) so that all load on
     * one node scores 1. Zero for an idle interval or a single node.
     */
    static double imbalance(long[] perNode) {
        int n = perNode.length;
        if (n <= 1) {
            return 0.0;
        }
        long total = 0;
        for (long count : perNode) {
            total += count;
        }
        if (total == 0) {
            return 0.0;
        }
        double mean = (double) total / n;
        double squares = 0.0;
        for (long count : perNode) {
            double diff = count - mean;
            squares += diff * diff;
        }
        double stdDev = Math.sqrt(squares / n);
        return (stdDev / mean) / Math.sqrt(n - 1);
    }

    /**
     * Bytes needed by every collection under the design, indexes included.
     */
    double estimateFootprint(Design design) {
        double footprint = 0.0;
        for (CollectionStat collection : stats.values()) {
            String name = collection.name();
            if (design.isDenormalized(name)) {
                footprint += embeddedSize(collection, stats.get(design.resolveRoot(name)));
            } else {
                footprint += collection.baseSize();
            }
            int indexCount = design.getIndexes(name).size();
            footprint += (double) indexCount * collection.tupleCount() * config.getIndexEntryBytes();
        }
        return footprint;
    }

    private static double embeddedSize(CollectionStat child, CollectionStat parent) {
        if (parent.tupleCount() == 0) {
            return child.baseSize();
        }
        double childrenPerParent = (double) child.tupleCount() / parent.tupleCount();
        long embeddedDocuments = Math.round(parent.tupleCount() * childrenPerParent);
        return (double) embeddedDocuments * child.avgDocSize();
    }
}
