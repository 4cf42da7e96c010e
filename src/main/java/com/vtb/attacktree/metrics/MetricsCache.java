package com.vtb.attacktree.metrics;

import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.models.NodeMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Кэш результатов между вызовами evaluate.
 * Ключ: снимок графа (по ссылке), корень, режим и набор активных конфигураций.
 */
@Slf4j
public class MetricsCache {

    private final Map<CacheKey, Optional<NodeMetrics>> entries = new ConcurrentHashMap<>();

    public Optional<NodeMetrics> evaluate(MetricsEngine engine, String rootId, boolean includeReusableSubtrees) {
        AttackTreeGraph graph = engine.getGraph();
        Set<String> activeConfigurations = graph.activeConfigurationIds();
        CacheKey key = new CacheKey(graph, rootId, includeReusableSubtrees, activeConfigurations);
        return entries.computeIfAbsent(key,
            k -> engine.evaluate(rootId, includeReusableSubtrees, activeConfigurations));
    }

    public void invalidate() {
        if (!entries.isEmpty()) {
            log.debug("Сброс кэша метрик ({} записей)", entries.size());
        }
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    // AttackTreeGraph не переопределяет equals: снимки сравниваются по ссылке
    private record CacheKey(AttackTreeGraph graph,
                            String rootId,
                            boolean includeReusableSubtrees,
                            Set<String> activeConfigurations) {
    }
}
