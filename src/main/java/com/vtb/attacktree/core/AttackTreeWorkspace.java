package com.vtb.attacktree.core;

import com.vtb.attacktree.config.EngineConfig;
import com.vtb.attacktree.feasibility.FeasibilityMapper;
import com.vtb.attacktree.feasibility.ThresholdFeasibilityMapper;
import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.graph.SubtreeClassifier;
import com.vtb.attacktree.graph.TopologyValidator;
import com.vtb.attacktree.metrics.MetricsCache;
import com.vtb.attacktree.metrics.MetricsEngine;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackerType;
import com.vtb.attacktree.models.LinkDecision;
import com.vtb.attacktree.models.NodeMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Редактируемое дерево атак.
 *
 * Все изменения проходят через этот класс и публикуют новый неизменяемый снимок графа.
 * Запись сериализована, чтение (расчёт метрик) идёт без блокировок по текущему снимку.
 */
@Slf4j
public class AttackTreeWorkspace {

    private volatile AttackTreeGraph snapshot;
    private final FeasibilityMapper feasibilityMapper;
    private final EngineConfig.Evaluation limits;
    private final MetricsCache cache;

    public AttackTreeWorkspace(AttackTreeGraph initial) {
        this(initial, new ThresholdFeasibilityMapper(), EngineConfig.load().getEvaluation());
    }

    public AttackTreeWorkspace(AttackTreeGraph initial, FeasibilityMapper feasibilityMapper,
                               EngineConfig.Evaluation limits) {
        if (initial == null) {
            throw new IllegalArgumentException("Граф не может быть null");
        }
        limits.ensureDefaults();
        this.snapshot = initial;
        this.feasibilityMapper = feasibilityMapper;
        this.limits = limits;
        this.cache = limits.isCacheEnabled() ? new MetricsCache() : null;
    }

    public AttackTreeGraph snapshot() {
        return snapshot;
    }

    public TopologyValidator validator() {
        return new TopologyValidator(snapshot);
    }

    public SubtreeClassifier classifier() {
        return new SubtreeClassifier(snapshot);
    }

    /**
     * Добавить связь source -> target. Шлюз source при необходимости назначается автоматически.
     *
     * @throws com.vtb.attacktree.graph.LinkRejectedException если связь недопустима; граф не меняется
     */
    public synchronized LinkDecision link(String sourceId, String targetId) {
        AttackTreeGraph current = snapshot;
        LinkDecision decision = new TopologyValidator(current).validateLink(sourceId, targetId);
        publish(current.withLink(sourceId, targetId, decision.getRequiredGate()));
        log.info("Связь {} -> {} добавлена{}", sourceId, targetId,
            decision.isGateChanged() ? ", шлюз " + sourceId + ": " + decision.getRequiredGate() : "");
        return decision;
    }

    /**
     * Удалить связь. Шлюз source не меняется.
     *
     * @return false, если связи не было
     */
    public synchronized boolean unlink(String sourceId, String targetId) {
        AttackTreeGraph current = snapshot;
        AttackTreeGraph updated = current.withoutLink(sourceId, targetId);
        if (updated == current) {
            return false;
        }
        publish(updated);
        log.info("Связь {} -> {} удалена", sourceId, targetId);
        return true;
    }

    /**
     * Удалить все связи, ведущие в узел (перед удалением поддерева)
     *
     * @return число удалённых связей
     */
    public synchronized int unlinkEverywhere(String targetId) {
        AttackTreeGraph updated = snapshot;
        int removed = 0;
        for (String parentId : updated.parentsOf(targetId)) {
            updated = updated.withoutLink(parentId, targetId);
            removed++;
        }
        if (removed > 0) {
            publish(updated);
            log.info("Узел {} отсоединён от {} родителей", targetId, removed);
        }
        return removed;
    }

    public synchronized void setConfigurationActive(String configurationId, boolean active) {
        publish(snapshot.withConfigurationActive(configurationId, active));
        log.info("Конфигурация {} {}", configurationId, active ? "активирована" : "деактивирована");
    }

    /**
     * Назначить листу профиль атакующего: заданные профилем поля потенциала перезаписываются
     */
    public synchronized AttackNode applyAttackerType(String leafId, AttackerType attackerType) {
        AttackTreeGraph current = snapshot;
        AttackNode leaf = current.node(leafId)
            .orElseThrow(() -> new IllegalArgumentException("Узел не найден: " + leafId));
        if (!leaf.isLeaf()) {
            throw new IllegalArgumentException("Профиль атакующего задаётся только у листьев: " + leafId);
        }
        AttackNode updated = leaf.toBuilder()
            .attackerType(attackerType)
            .attackPotential(attackerType.applyTo(leaf.getAttackPotential()))
            .build();
        publish(current.withNode(updated));
        log.info("Лист {}: профиль атакующего {}", leafId, attackerType.getDisplayName());
        return updated;
    }

    /**
     * Рассчитать метрики корня на текущем снимке
     */
    public Optional<NodeMetrics> evaluate(String rootId, boolean includeReusableSubtrees) {
        MetricsEngine engine = engine();
        if (cache == null) {
            return engine.evaluate(rootId, includeReusableSubtrees);
        }
        return cache.evaluate(engine, rootId, includeReusableSubtrees);
    }

    /**
     * Движок, привязанный к текущему снимку
     */
    public MetricsEngine engine() {
        return new MetricsEngine(snapshot, feasibilityMapper, limits);
    }

    private void publish(AttackTreeGraph updated) {
        snapshot = updated;
        if (cache != null) {
            cache.invalidate();
        }
    }
}
