package com.vtb.attacktree.metrics;

import com.vtb.attacktree.config.EngineConfig;
import com.vtb.attacktree.feasibility.FeasibilityMapper;
import com.vtb.attacktree.feasibility.ThresholdFeasibilityMapper;
import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.LogicGate;
import com.vtb.attacktree.models.NodeMetrics;
import com.vtb.attacktree.models.NodeRole;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Восходящий расчёт потенциала атаки и критических путей дерева.
 *
 * AND: все дети обязательны, потенциал - покомпонентный максимум, пути - декартово произведение.
 * OR: потенциал - покомпонентный минимум живых детей, пути - объединение путей всех детей
 * с минимальным баллом (ничьи сохраняются).
 *
 * Структурные "ненаходки" (нет узла, нет живых детей, цикл, отключённая конфигурация)
 * не являются ошибками и возвращаются как пустой результат.
 */
@Slf4j
public class MetricsEngine {

    @Getter
    private final AttackTreeGraph graph;
    private final FeasibilityMapper feasibilityMapper;
    private final int maxDepth;
    private final int maxCriticalPaths;

    public MetricsEngine(AttackTreeGraph graph) {
        this(graph, new ThresholdFeasibilityMapper(), EngineConfig.load().getEvaluation());
    }

    public MetricsEngine(AttackTreeGraph graph, FeasibilityMapper feasibilityMapper, EngineConfig.Evaluation limits) {
        this.graph = graph;
        this.feasibilityMapper = feasibilityMapper;
        limits.ensureDefaults();
        this.maxDepth = limits.getMaxDepth();
        this.maxCriticalPaths = limits.getMaxCriticalPaths();
    }

    /**
     * Рассчитать узел с активными конфигурациями графа.
     *
     * @param rootId                  корень дерева (или любой промежуточный узел)
     * @param includeReusableSubtrees false - начальный риск (деревья обхода исключены),
     *                                true - остаточный риск (полный граф)
     * @throws IllegalArgumentException если узла нет в графе
     */
    public Optional<NodeMetrics> evaluate(String rootId, boolean includeReusableSubtrees) {
        return evaluate(rootId, includeReusableSubtrees, graph.activeConfigurationIds());
    }

    public Optional<NodeMetrics> evaluate(String rootId, boolean includeReusableSubtrees,
                                          Set<String> activeConfigurationIds) {
        if (!graph.contains(rootId)) {
            throw new IllegalArgumentException("Корень не найден в графе: " + rootId);
        }
        if (!includeReusableSubtrees && graph.isRole(rootId, NodeRole.CIRCUMVENT_ROOT)) {
            log.debug("Дерево обхода {} исключено в режиме начального риска", rootId);
            return Optional.empty();
        }

        EvaluationContext context = new EvaluationContext(activeConfigurationIds, includeReusableSubtrees);
        NodeMetrics result = compute(rootId, context);

        if (result == null) {
            log.debug("Узел {}: пути атаки нет (режим {})", rootId, modeName(includeReusableSubtrees));
        } else {
            log.debug("Узел {}: AP={} ({}), критических путей: {}{}", rootId, result.getPotentialScore(),
                result.getPotential(), result.getCriticalPaths().size(), result.isTruncated() ? " (обрезано)" : "");
        }
        return Optional.ofNullable(result);
    }

    /**
     * Рассчитать все корни заданного вида, в порядке следования в проекте
     */
    public Map<String, Optional<NodeMetrics>> evaluateRoots(NodeRole role, boolean includeReusableSubtrees) {
        Map<String, Optional<NodeMetrics>> results = new LinkedHashMap<>();
        for (AttackNode root : graph.roots(role)) {
            results.put(root.getId(), evaluate(root.getId(), includeReusableSubtrees));
        }
        return results;
    }

    private NodeMetrics compute(String nodeId, EvaluationContext context) {
        AttackNode node = graph.node(nodeId).orElse(null);
        if (node == null) {
            return null;
        }

        if (!context.isEnabled(node)) {
            log.debug("Узел {} отключён конфигурацией {}", nodeId, node.getRequiredToeConfigurationIds());
            return context.remember(nodeId, null);
        }

        if (context.isVisiting(nodeId)) {
            log.debug("Цикл через узел {}: ветка считается недостижимой", nodeId);
            return null;
        }

        if (context.hasMemo(nodeId)) {
            return context.memo(nodeId);
        }

        if (context.depth() >= maxDepth) {
            if (context.markDepthLimitReported()) {
                log.warn("Превышена глубина дерева ({}) на узле {}: ветка отброшена", maxDepth, nodeId);
            }
            return null;
        }

        if (node.isLeaf()) {
            AttackPotential potential = node.getAttackPotential();
            return context.remember(nodeId, NodeMetrics.builder()
                .potential(potential)
                .potentialScore(feasibilityMapper.scoreOf(potential))
                .criticalPaths(List.of(List.of(nodeId)))
                .build());
        }

        context.enter(nodeId);
        NodeMetrics result;
        try {
            List<String> liveChildren = liveChildren(node, context);
            if (liveChildren.isEmpty()) {
                result = null;
            } else if (node.effectiveGate() == LogicGate.OR) {
                result = combineOr(nodeId, liveChildren, context);
            } else {
                result = combineAnd(nodeId, liveChildren, context);
            }
        } finally {
            context.leave(nodeId);
        }
        return context.remember(nodeId, result);
    }

    /**
     * В режиме начального риска связи на корни деревьев обхода не существуют
     */
    private List<String> liveChildren(AttackNode node, EvaluationContext context) {
        if (context.includeReusableSubtrees()) {
            return node.getChildren();
        }
        List<String> live = new ArrayList<>(node.getChildren().size());
        for (String childId : node.getChildren()) {
            if (!graph.isRole(childId, NodeRole.CIRCUMVENT_ROOT)) {
                live.add(childId);
            }
        }
        return live;
    }

    private NodeMetrics combineAnd(String nodeId, List<String> children, EvaluationContext context) {
        List<NodeMetrics> results = new ArrayList<>(children.size());
        boolean satisfiable = true;
        for (String childId : children) {
            NodeMetrics child = compute(childId, context);
            if (child == null) {
                satisfiable = false;
            }
            results.add(child);
        }
        if (!satisfiable) {
            return null;
        }

        AttackPotential combined = AttackPotential.ZERO;
        boolean truncated = false;
        List<List<String>> product = new ArrayList<>();
        product.add(List.of());

        for (NodeMetrics child : results) {
            combined = combined.max(child.getPotential());
            truncated |= child.isTruncated();

            List<List<String>> next = new ArrayList<>();
            outer:
            for (List<String> prefix : product) {
                for (List<String> childPath : child.getCriticalPaths()) {
                    if (next.size() >= maxCriticalPaths) {
                        truncated = true;
                        break outer;
                    }
                    List<String> path = new ArrayList<>(prefix.size() + childPath.size());
                    path.addAll(prefix);
                    path.addAll(childPath);
                    next.add(path);
                }
            }
            product = next;
        }

        List<List<String>> paths = new ArrayList<>(product.size());
        for (List<String> path : product) {
            paths.add(prepend(nodeId, path));
        }

        return NodeMetrics.builder()
            .potential(combined)
            .potentialScore(feasibilityMapper.scoreOf(combined))
            .criticalPaths(paths)
            .truncated(truncated)
            .build();
    }

    private NodeMetrics combineOr(String nodeId, List<String> children, EvaluationContext context) {
        List<NodeMetrics> valid = new ArrayList<>(children.size());
        for (String childId : children) {
            NodeMetrics child = compute(childId, context);
            if (child != null) {
                valid.add(child);
            }
        }
        if (valid.isEmpty()) {
            return null;
        }

        AttackPotential minimum = valid.get(0).getPotential();
        int minScore = Integer.MAX_VALUE;
        for (NodeMetrics child : valid) {
            minimum = minimum.min(child.getPotential());
            minScore = Math.min(minScore, child.getPotentialScore());
        }

        boolean truncated = false;
        List<List<String>> paths = new ArrayList<>();
        outer:
        for (NodeMetrics child : valid) {
            if (child.getPotentialScore() != minScore) {
                continue;
            }
            truncated |= child.isTruncated();
            for (List<String> childPath : child.getCriticalPaths()) {
                if (paths.size() >= maxCriticalPaths) {
                    truncated = true;
                    break outer;
                }
                paths.add(prepend(nodeId, childPath));
            }
        }

        return NodeMetrics.builder()
            .potential(minimum)
            .potentialScore(feasibilityMapper.scoreOf(minimum))
            .criticalPaths(paths)
            .truncated(truncated)
            .build();
    }

    private static List<String> prepend(String nodeId, List<String> path) {
        List<String> result = new ArrayList<>(path.size() + 1);
        result.add(nodeId);
        result.addAll(path);
        return result;
    }

    private static String modeName(boolean includeReusableSubtrees) {
        return includeReusableSubtrees ? "остаточный" : "начальный";
    }
}
