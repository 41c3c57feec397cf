package org.carball.designer.model.cost;

/**
 * Costs of one design. {@code disk} already carries the infeasibility penalty when
 * {@code feasible} is false.
 */
public record CostBreakdown(
        double network,
        double skew,
        double disk,
        double overall,
        boolean feasible
) {

    public String getSummary() {
        return String.format("overall=%.4f network=%.4f skew=%.4f disk=%.0f%s",
                overall, network, skew, disk, feasible ? "" : " (exceeds memory budget)");
    }
}
