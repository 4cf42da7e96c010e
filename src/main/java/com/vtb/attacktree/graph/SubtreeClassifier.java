package com.vtb.attacktree.graph;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.NodeRole;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Принадлежность узлов переиспользуемым поддеревьям (обход защиты, технические деревья).
 * Чистые запросы: неизвестный id даёт false / empty, исключений нет.
 */
public class SubtreeClassifier {

    private final AttackTreeGraph graph;

    public SubtreeClassifier(AttackTreeGraph graph) {
        this.graph = graph;
    }

    public boolean isMemberOfCircumventSubtree(String nodeId) {
        return findOwningRoot(nodeId, NodeRole.CIRCUMVENT_ROOT).isPresent();
    }

    public boolean isMemberOfTechnicalSubtree(String nodeId) {
        return findOwningRoot(nodeId, NodeRole.TECHNICAL_ROOT).isPresent();
    }

    public Optional<String> findOwningCircumventRoot(String nodeId) {
        return findOwningRoot(nodeId, NodeRole.CIRCUMVENT_ROOT);
    }

    public Optional<String> findOwningTechnicalRoot(String nodeId) {
        return findOwningRoot(nodeId, NodeRole.TECHNICAL_ROOT);
    }

    /**
     * Узлы, напрямую использующие дерево обхода {@code circumventRootId}
     */
    public List<String> findParentsOfCircumventTree(String circumventRootId) {
        if (!graph.isRole(circumventRootId, NodeRole.CIRCUMVENT_ROOT)) {
            return List.of();
        }
        return graph.parentsOf(circumventRootId);
    }

    /**
     * Первый корень заданного вида (в порядке следования корней), из которого достижим узел.
     * Сам корень тоже считается членом своего поддерева.
     */
    public Optional<String> findOwningRoot(String nodeId, NodeRole rootRole) {
        if (!graph.contains(nodeId)) {
            return Optional.empty();
        }
        for (AttackNode root : graph.roots(rootRole)) {
            if (reaches(root.getId(), nodeId)) {
                return Optional.of(root.getId());
            }
        }
        return Optional.empty();
    }

    /**
     * BFS от {@code fromId} по дочерним связям, до первого совпадения с {@code targetId}
     */
    boolean reaches(String fromId, String targetId) {
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(fromId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (current.equals(targetId)) {
                return true;
            }
            for (String child : graph.children(current)) {
                if (!visited.contains(child)) {
                    queue.add(child);
                }
            }
        }
        return false;
    }
}
