package org.carball.designer.model.cost;

import org.carball.designer.model.design.Design;

/**
 * A candidate design with its costs and its position in the submitted batch.
 */
public record RankedDesign(
        int candidateIndex,
        Design design,
        CostBreakdown cost
) {
}
