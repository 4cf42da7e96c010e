package com.vtb.attacktree.core;

import com.vtb.attacktree.config.EngineConfig;
import com.vtb.attacktree.feasibility.FeasibilityMapper;
import com.vtb.attacktree.feasibility.ThresholdFeasibilityMapper;
import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.metrics.MetricsEngine;
import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.AssessmentStatistics;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.NodeMetrics;
import com.vtb.attacktree.models.NodeRole;
import com.vtb.attacktree.models.Threat;
import com.vtb.attacktree.models.ThreatAssessment;
import com.vtb.attacktree.models.TreeEvaluation;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Полный анализ проекта: метрики всех корней в обоих режимах и оценка угроз.
 * Корни независимы и считаются параллельно на общем неизменяемом снимке графа.
 */
@Slf4j
public class AttackTreeAnalyzer {

    private static final NodeRole[] ROOT_ROLES = {
        NodeRole.ATTACK_ROOT, NodeRole.CIRCUMVENT_ROOT, NodeRole.TECHNICAL_ROOT
    };

    private final AttackTreeLoader loader;
    private final FeasibilityMapper feasibilityMapper;
    private final EngineConfig.Evaluation limits;

    public AttackTreeAnalyzer(AttackTreeLoader loader) {
        this(loader, new ThresholdFeasibilityMapper(), EngineConfig.load().getEvaluation());
    }

    public AttackTreeAnalyzer(AttackTreeLoader loader, FeasibilityMapper feasibilityMapper,
                              EngineConfig.Evaluation limits) {
        this.loader = loader;
        this.feasibilityMapper = feasibilityMapper;
        this.limits = limits;
    }

    public AssessmentReport analyze() {
        AttackTreeGraph graph = loader.getGraph();
        if (graph == null) {
            throw new IllegalStateException("Проект не загружен");
        }
        log.info("=== Анализ деревьев атак: {} ===", loader.getProjectName());

        long startTime = System.currentTimeMillis();
        MetricsEngine engine = new MetricsEngine(graph, feasibilityMapper, limits);

        List<AttackNode> roots = new ArrayList<>();
        for (NodeRole role : ROOT_ROLES) {
            roots.addAll(graph.roots(role));
        }
        List<TreeEvaluation> trees = evaluateTrees(engine, roots);
        List<ThreatAssessment> threats = new ProjectRiskCalculator(feasibilityMapper)
            .assess(engine, loader.getThreats());

        long duration = System.currentTimeMillis() - startTime;
        AssessmentStatistics statistics = AssessmentStatistics.builder()
            .totalNodes(graph.size())
            .attackRoots(graph.roots(NodeRole.ATTACK_ROOT).size())
            .circumventRoots(graph.roots(NodeRole.CIRCUMVENT_ROOT).size())
            .technicalRoots(graph.roots(NodeRole.TECHNICAL_ROOT).size())
            .activeConfigurations(graph.activeConfigurationIds().size())
            .treesWithoutAttackPath((int) trees.stream().filter(t -> !t.hasAttackPath()).count())
            .evaluationDurationMs(duration)
            .build();

        log.info("=== Анализ завершён за {} мс: деревьев {}, угроз {} ===", duration, trees.size(), threats.size());

        return AssessmentReport.builder()
            .projectName(loader.getProjectName())
            .source(loader.getSource())
            .generatedAt(LocalDateTime.now())
            .trees(trees)
            .threats(threats)
            .statistics(statistics)
            .build();
    }

    /**
     * Оценка одного корня в обоих режимах
     */
    public TreeEvaluation evaluateTree(MetricsEngine engine, AttackNode root) {
        Optional<NodeMetrics> initial = engine.evaluate(root.getId(), false);
        Optional<NodeMetrics> residual = engine.evaluate(root.getId(), true);
        return TreeEvaluation.builder()
            .rootId(root.getId())
            .title(root.getTitle())
            .role(root.getRole())
            .initial(initial.orElse(null))
            .initialFeasibility(initial.map(m -> feasibilityMapper.ratingOf(m.getPotentialScore())).orElse(null))
            .residual(residual.orElse(null))
            .residualFeasibility(residual.map(m -> feasibilityMapper.ratingOf(m.getPotentialScore())).orElse(null))
            .build();
    }

    private List<TreeEvaluation> evaluateTrees(MetricsEngine engine, List<AttackNode> roots) {
        if (roots.size() < 2) {
            List<TreeEvaluation> single = new ArrayList<>();
            for (AttackNode root : roots) {
                single.add(evaluateTree(engine, root));
            }
            return single;
        }

        int threads = Math.min(roots.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TreeEvaluation>> futures = new ArrayList<>(roots.size());
            for (AttackNode root : roots) {
                futures.add(executor.submit(() -> evaluateTree(engine, root)));
            }
            List<TreeEvaluation> results = new ArrayList<>(roots.size());
            for (Future<TreeEvaluation> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Анализ прерван", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Ошибка расчёта дерева: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
