package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Результат вычисления узла: агрегированный потенциал, его балл и критические пути.
 * Каждый критический путь - последовательность id от вычисляемого узла до листьев включительно.
 * Списки путей неизменяемы.
 */
@Value
public class NodeMetrics {
    AttackPotential potential;
    int potentialScore;
    List<List<String>> criticalPaths;
    /** Список путей был обрезан по лимиту maxCriticalPaths */
    boolean truncated;

    @Builder
    public NodeMetrics(AttackPotential potential, int potentialScore,
                       List<List<String>> criticalPaths, boolean truncated) {
        this.potential = potential;
        this.potentialScore = potentialScore;
        this.criticalPaths = copyPaths(criticalPaths);
        this.truncated = truncated;
    }

    /**
     * Все узлы, лежащие на критических путях (для подсветки)
     */
    public Set<String> criticalNodeIds() {
        Set<String> nodes = new LinkedHashSet<>();
        for (List<String> path : criticalPaths) {
            nodes.addAll(path);
        }
        return nodes;
    }

    private static List<List<String>> copyPaths(List<List<String>> paths) {
        if (paths == null) {
            return List.of();
        }
        List<List<String>> copy = new ArrayList<>(paths.size());
        for (List<String> path : paths) {
            copy.add(List.copyOf(path));
        }
        return Collections.unmodifiableList(copy);
    }
}
