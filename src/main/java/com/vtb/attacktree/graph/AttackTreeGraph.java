package com.vtb.attacktree.graph;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.LogicGate;
import com.vtb.attacktree.models.NodeRole;
import com.vtb.attacktree.models.ToeConfiguration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Неизменяемый индекс узлов дерева атак и конфигураций объекта оценки.
 * Мутации возвращают новый снимок графа, текущий снимок никогда не меняется.
 */
public final class AttackTreeGraph {

    private final Map<String, AttackNode> nodes;
    private final Map<String, ToeConfiguration> configurations;

    private AttackTreeGraph(Map<String, AttackNode> nodes, Map<String, ToeConfiguration> configurations) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.configurations = Collections.unmodifiableMap(configurations);
    }

    public static AttackTreeGraph of(List<AttackNode> nodes) {
        return of(nodes, List.of());
    }

    /**
     * Построить граф. Пространство id общее для всех узлов, дубликаты отклоняются.
     */
    public static AttackTreeGraph of(List<AttackNode> nodes, List<ToeConfiguration> configurations) {
        Map<String, AttackNode> index = new LinkedHashMap<>();
        for (AttackNode node : nodes) {
            if (index.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Дублирующийся идентификатор узла: " + node.getId());
            }
        }
        Map<String, ToeConfiguration> configIndex = new LinkedHashMap<>();
        for (ToeConfiguration configuration : configurations) {
            if (configIndex.putIfAbsent(configuration.getId(), configuration) != null) {
                throw new IllegalArgumentException("Дублирующийся идентификатор конфигурации: " + configuration.getId());
            }
        }
        return new AttackTreeGraph(index, configIndex);
    }

    public Optional<AttackNode> node(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Дочерние id в порядке вставки; для неизвестного узла - пустой список
     */
    public List<String> children(String id) {
        AttackNode node = id == null ? null : nodes.get(id);
        return node != null ? node.getChildren() : List.of();
    }

    public Collection<AttackNode> nodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Корни заданного вида в порядке следования в проекте
     */
    public List<AttackNode> roots(NodeRole role) {
        List<AttackNode> roots = new ArrayList<>();
        for (AttackNode node : nodes.values()) {
            if (node.getRole() == role) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Узлы, напрямую ссылающиеся на {@code id}
     */
    public List<String> parentsOf(String id) {
        List<String> parents = new ArrayList<>();
        for (AttackNode node : nodes.values()) {
            if (node.getChildren().contains(id)) {
                parents.add(node.getId());
            }
        }
        return parents;
    }

    /**
     * Есть ли среди детей узла корни деревьев обхода
     */
    public boolean hasCircumventChildren(String id) {
        for (String childId : children(id)) {
            if (isRole(childId, NodeRole.CIRCUMVENT_ROOT)) {
                return true;
            }
        }
        return false;
    }

    public boolean isRole(String id, NodeRole role) {
        AttackNode node = id == null ? null : nodes.get(id);
        return node != null && node.getRole() == role;
    }

    public Collection<ToeConfiguration> configurations() {
        return configurations.values();
    }

    public Set<String> activeConfigurationIds() {
        Set<String> active = new LinkedHashSet<>();
        for (ToeConfiguration configuration : configurations.values()) {
            if (configuration.isActive()) {
                active.add(configuration.getId());
            }
        }
        return active;
    }

    /**
     * Новый снимок с добавленной связью source -> target и (опционально) новым шлюзом source.
     * Проверки топологии выполняются заранее в {@link TopologyValidator}.
     */
    public AttackTreeGraph withLink(String sourceId, String targetId, LogicGate gate) {
        AttackNode source = require(sourceId);
        require(targetId);
        List<String> children = new ArrayList<>(source.getChildren());
        children.add(targetId);
        AttackNode updated = source.withChildren(children);
        if (gate != null && gate != source.getGate()) {
            updated = updated.withGate(gate);
        }
        return withNode(updated);
    }

    /**
     * Новый снимок без связи source -> target. Отсутствующая связь - no-op.
     */
    public AttackTreeGraph withoutLink(String sourceId, String targetId) {
        AttackNode source = require(sourceId);
        if (!source.getChildren().contains(targetId)) {
            return this;
        }
        List<String> children = new ArrayList<>(source.getChildren());
        children.removeIf(targetId::equals);
        return withNode(source.withChildren(children));
    }

    /**
     * Новый снимок с заменённым узлом (id должен существовать)
     */
    public AttackTreeGraph withNode(AttackNode replacement) {
        require(replacement.getId());
        Map<String, AttackNode> copy = new LinkedHashMap<>(nodes);
        copy.put(replacement.getId(), replacement);
        return new AttackTreeGraph(copy, new LinkedHashMap<>(configurations));
    }

    /**
     * Новый снимок с переключённой конфигурацией объекта оценки
     */
    public AttackTreeGraph withConfigurationActive(String configurationId, boolean active) {
        ToeConfiguration configuration = configurations.get(configurationId);
        if (configuration == null) {
            throw new IllegalArgumentException("Неизвестная конфигурация: " + configurationId);
        }
        Map<String, ToeConfiguration> copy = new LinkedHashMap<>(configurations);
        copy.put(configurationId, configuration.toBuilder().active(active).build());
        return new AttackTreeGraph(new LinkedHashMap<>(nodes), copy);
    }

    private AttackNode require(String id) {
        AttackNode node = id == null ? null : nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Узел не найден: " + id);
        }
        return node;
    }
}
