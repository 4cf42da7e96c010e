package com.vtb.attacktree.core;

import com.vtb.attacktree.feasibility.FeasibilityMapper;
import com.vtb.attacktree.feasibility.RiskMatrix;
import com.vtb.attacktree.metrics.MetricsEngine;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.NodeMetrics;
import com.vtb.attacktree.models.Threat;
import com.vtb.attacktree.models.ThreatAssessment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Оценка угроз проекта: осуществимость атаки по дереву угрозы и уровень риска по матрице.
 * Начальная оценка считается без деревьев обхода, остаточная - с ними.
 */
@Slf4j
public class ProjectRiskCalculator {

    private final FeasibilityMapper feasibilityMapper;

    public ProjectRiskCalculator(FeasibilityMapper feasibilityMapper) {
        this.feasibilityMapper = feasibilityMapper;
    }

    public List<ThreatAssessment> assess(MetricsEngine engine, List<Threat> threats) {
        List<ThreatAssessment> assessments = new ArrayList<>(threats.size());
        for (Threat threat : threats) {
            assessments.add(assess(engine, threat));
        }
        return assessments;
    }

    public ThreatAssessment assess(MetricsEngine engine, Threat threat) {
        ThreatAssessment.ThreatAssessmentBuilder builder = ThreatAssessment.builder()
            .threatId(threat.getId())
            .name(threat.getName())
            .rootId(threat.getRootId())
            .impact(threat.getImpact());

        if (!engine.getGraph().contains(threat.getRootId())) {
            log.warn("Угроза {}: дерево атак {} не найдено, оценка не определена",
                threat.getId(), threat.getRootId());
            return builder.build();
        }

        Optional<NodeMetrics> initial = engine.evaluate(threat.getRootId(), false);
        Optional<NodeMetrics> residual = engine.evaluate(threat.getRootId(), true);

        FeasibilityRating initialFeasibility = rating(initial);
        FeasibilityRating residualFeasibility = rating(residual);

        return builder
            .initialScore(initial.map(NodeMetrics::getPotentialScore).orElse(null))
            .initialFeasibility(initialFeasibility)
            .initialRisk(RiskMatrix.riskLevel(initialFeasibility, threat.getImpact()))
            .residualScore(residual.map(NodeMetrics::getPotentialScore).orElse(null))
            .residualFeasibility(residualFeasibility)
            .residualRisk(RiskMatrix.riskLevel(residualFeasibility, threat.getImpact()))
            .build();
    }

    private FeasibilityRating rating(Optional<NodeMetrics> metrics) {
        return metrics.map(m -> feasibilityMapper.ratingOf(m.getPotentialScore())).orElse(null);
    }
}
