package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Результат анализа проекта: метрики всех деревьев и оценка угроз
 */
@Data
@Builder
public class AssessmentReport {
    private String projectName;
    private String source;
    private LocalDateTime generatedAt;

    @Builder.Default
    private List<TreeEvaluation> trees = new ArrayList<>();

    @Builder.Default
    private List<ThreatAssessment> threats = new ArrayList<>();

    private AssessmentStatistics statistics;

    /**
     * Количество угроз с заданной начальной осуществимостью
     */
    public int getThreatCountByFeasibility(FeasibilityRating rating) {
        return (int) threats.stream()
            .filter(t -> t.getInitialFeasibility() == rating)
            .count();
    }

    /**
     * Есть ли угрозы с высокой осуществимостью (с учётом мер защиты)
     */
    public boolean hasHighFeasibilityThreats() {
        return threats.stream()
            .anyMatch(t -> t.getResidualFeasibility() == FeasibilityRating.HIGH);
    }
}
