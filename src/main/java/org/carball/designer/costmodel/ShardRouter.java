package org.carball.designer.costmodel;

import org.carball.designer.model.design.Design;
import org.carball.designer.model.stats.CollectionStat;
import org.carball.designer.model.stats.FieldStat;
import org.carball.designer.model.workload.Operation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which nodes an operation touches under a design.
 *
 * <p>An operation goes to a single node when every field of its effective shard key has an
 * equality predicate and known, non-zero cardinality. Everything else is broadcast. The
 * single node is picked by hashing the shard key values, so the same operation always
 * lands on the same node.
 */
public class ShardRouter {

    private final Map<String, CollectionStat> stats;
    private final int nodeCount;

    public ShardRouter(Map<String, CollectionStat> stats, int nodeCount) {
        this.stats = stats;
        this.nodeCount = nodeCount;
    }

    public Route route(Operation op, Design design) {
        String root = design.resolveRoot(op.collection());
        List<String> shardKey = design.effectiveShardKey(op.collection());

        for (String field : shardKey) {
            if (!op.hasEqualityPredicate(field) || !hasKnownCardinality(root, op.collection(), field)) {
                return Route.broadcast(nodeCount);
            }
        }
        return Route.singleNode(targetNode(op, shardKey));
    }

    private boolean hasKnownCardinality(String root, String collection, String field) {
        Optional<FieldStat> stat = fieldStat(root, field);
        if (stat.isEmpty() && !root.equals(collection)) {
            stat = fieldStat(collection, field);
        }
        return stat.map(s -> s.cardinality() > 0).orElse(false);
    }

    private Optional<FieldStat> fieldStat(String collection, String field) {
        CollectionStat stat = stats.get(collection);
        return stat == null ? Optional.empty() : stat.field(field);
    }

    private int targetNode(Operation op, List<String> shardKey) {
        StringBuilder key = new StringBuilder();
        for (String field : shardKey) {
            if (!key.isEmpty()) key.append('|');
            key.append(field).append('=');
            key.append(op.findValue(field).map(String::valueOf).orElse(field));
        }
        return Math.floorMod(key.toString().hashCode(), nodeCount);
    }

    /**
     * Nodes touched by one operation; {@code targetNode} is -1 for a broadcast.
     */
    public record Route(boolean singleNode, int targetNode, int nodesTouched) {

        static Route singleNode(int targetNode) {
            return new Route(true, targetNode, 1);
        }

        static Route broadcast(int nodeCount) {
            return new Route(false, -1, nodeCount);
        }
    }
}
