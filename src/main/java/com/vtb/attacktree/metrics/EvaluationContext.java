package com.vtb.attacktree.metrics;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.NodeMetrics;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Состояние одного вызова evaluate: мемо-таблица и множество узлов на текущем стеке.
 * Создаётся заново на каждый вызов и не разделяется между вызовами и потоками:
 * мемоизированный результат зависит от режима и набора активных конфигураций.
 */
final class EvaluationContext {

    private final Set<String> activeConfigurations;
    private final boolean includeReusableSubtrees;
    private final Map<String, NodeMetrics> memo = new HashMap<>();
    private final Set<String> visiting = new HashSet<>();
    private boolean depthLimitReported;

    EvaluationContext(Set<String> activeConfigurations, boolean includeReusableSubtrees) {
        this.activeConfigurations = Collections.unmodifiableSet(new HashSet<>(activeConfigurations));
        this.includeReusableSubtrees = includeReusableSubtrees;
    }

    boolean includeReusableSubtrees() {
        return includeReusableSubtrees;
    }

    /**
     * Узел достижим, только если все требуемые им конфигурации активны
     */
    boolean isEnabled(AttackNode node) {
        return activeConfigurations.containsAll(node.getRequiredToeConfigurationIds());
    }

    boolean isVisiting(String nodeId) {
        return visiting.contains(nodeId);
    }

    int depth() {
        return visiting.size();
    }

    void enter(String nodeId) {
        visiting.add(nodeId);
    }

    void leave(String nodeId) {
        visiting.remove(nodeId);
    }

    boolean hasMemo(String nodeId) {
        return memo.containsKey(nodeId);
    }

    /** null - "нет результата" */
    NodeMetrics memo(String nodeId) {
        return memo.get(nodeId);
    }

    NodeMetrics remember(String nodeId, NodeMetrics result) {
        memo.put(nodeId, result);
        return result;
    }

    /**
     * true только при первом превышении глубины в этом вызове
     */
    boolean markDepthLimitReported() {
        if (depthLimitReported) {
            return false;
        }
        depthLimitReported = true;
        return true;
    }
}
