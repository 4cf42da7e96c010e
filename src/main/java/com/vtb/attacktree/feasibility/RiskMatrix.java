package com.vtb.attacktree.feasibility;

import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.Impact;
import com.vtb.attacktree.models.RiskLevel;

import java.util.EnumMap;
import java.util.Map;

/**
 * Матрица риска TARA: осуществимость атаки x уровень ущерба
 */
public final class RiskMatrix {

    private static final Map<FeasibilityRating, Map<Impact, RiskLevel>> MATRIX = new EnumMap<>(FeasibilityRating.class);

    static {
        row(FeasibilityRating.HIGH, RiskLevel.NEGLIGIBLE, RiskLevel.MEDIUM, RiskLevel.HIGH, RiskLevel.CRITICAL);
        row(FeasibilityRating.MEDIUM, RiskLevel.NEGLIGIBLE, RiskLevel.LOW, RiskLevel.MEDIUM, RiskLevel.HIGH);
        row(FeasibilityRating.LOW, RiskLevel.NEGLIGIBLE, RiskLevel.LOW, RiskLevel.LOW, RiskLevel.MEDIUM);
        row(FeasibilityRating.VERY_LOW, RiskLevel.NEGLIGIBLE, RiskLevel.NEGLIGIBLE, RiskLevel.NEGLIGIBLE, RiskLevel.LOW);
    }

    private RiskMatrix() {}

    /**
     * Уровень риска; null, если осуществимость не определена (нет пути атаки)
     */
    public static RiskLevel riskLevel(FeasibilityRating feasibility, Impact impact) {
        if (feasibility == null) {
            return null;
        }
        Impact effectiveImpact = impact != null ? impact : Impact.NEGLIGIBLE;
        return MATRIX.get(feasibility).get(effectiveImpact);
    }

    private static void row(FeasibilityRating feasibility,
                            RiskLevel negligible, RiskLevel moderate, RiskLevel major, RiskLevel severe) {
        Map<Impact, RiskLevel> row = new EnumMap<>(Impact.class);
        row.put(Impact.NEGLIGIBLE, negligible);
        row.put(Impact.MODERATE, moderate);
        row.put(Impact.MAJOR, major);
        row.put(Impact.SEVERE, severe);
        MATRIX.put(feasibility, row);
    }
}
