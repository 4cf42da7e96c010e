package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

/**
 * Итоговая оценка угрозы. null в рейтингах означает "TBD": у дерева нет пути атаки.
 */
@Data
@Builder
public class ThreatAssessment {
    private String threatId;
    private String name;
    private String rootId;
    private Impact impact;
    private Integer initialScore;
    private FeasibilityRating initialFeasibility;
    private RiskLevel initialRisk;
    private Integer residualScore;
    private FeasibilityRating residualFeasibility;
    private RiskLevel residualRisk;
}
