package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

/**
 * Оценка одного дерева в двух режимах: начальный риск (без деревьев обхода) и остаточный
 */
@Data
@Builder
public class TreeEvaluation {
    private String rootId;
    private String title;
    private NodeRole role;
    private NodeMetrics initial;
    private FeasibilityRating initialFeasibility;
    private NodeMetrics residual;
    private FeasibilityRating residualFeasibility;

    public boolean hasAttackPath() {
        return initial != null || residual != null;
    }
}
