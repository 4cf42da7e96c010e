package com.vtb.attacktree.graph;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.LinkDecision;
import com.vtb.attacktree.models.LogicGate;
import com.vtb.attacktree.models.NodeRole;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Проверка новой связи source -> target до её применения.
 *
 * Две независимые проверки: отсутствие цикла и правило присоединения дерева обхода
 * (ISO/SAE 21434, определение 4.9): атакующий должен выполнить и исходный шаг, и обход меры защиты,
 * поэтому дерево обхода допустимо только под AND, либо под OR, все дети которого - деревья обхода.
 * Валидатор сам граф не меняет, а возвращает решение о шлюзе, которое применяет вызывающая сторона.
 */
@Slf4j
public class TopologyValidator {

    private final AttackTreeGraph graph;
    private final SubtreeClassifier classifier;

    public TopologyValidator(AttackTreeGraph graph) {
        this(graph, new SubtreeClassifier(graph));
    }

    public TopologyValidator(AttackTreeGraph graph, SubtreeClassifier classifier) {
        this.graph = graph;
        this.classifier = classifier;
    }

    /**
     * true, если source == target или source достижим из target по существующим связям
     */
    public boolean wouldCreateCycle(String sourceId, String targetId) {
        if (sourceId == null || targetId == null) {
            return false;
        }
        if (sourceId.equals(targetId)) {
            return true;
        }

        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(targetId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(sourceId)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            queue.addAll(graph.children(current));
        }
        return false;
    }

    /**
     * Проверить связь и вернуть решение о шлюзе source.
     *
     * @throws LinkRejectedException если связь недопустима
     */
    public LinkDecision validateLink(String sourceId, String targetId) {
        Optional<AttackNode> sourceNode = graph.node(sourceId);
        if (sourceNode.isEmpty() || !graph.contains(targetId)) {
            throw reject(LinkRejectionReason.UNKNOWN_NODE, sourceId, targetId);
        }
        AttackNode source = sourceNode.get();

        if (source.isLeaf()) {
            throw reject(LinkRejectionReason.LEAF_CANNOT_HAVE_CHILDREN, sourceId, targetId);
        }
        if (source.getChildren().contains(targetId)) {
            throw reject(LinkRejectionReason.DUPLICATE_LINK, sourceId, targetId);
        }
        if (isSelfReference(sourceId, targetId)) {
            throw reject(LinkRejectionReason.SELF_REFERENCING_SUBTREE, sourceId, targetId);
        }
        if (wouldCreateCycle(sourceId, targetId)) {
            throw reject(LinkRejectionReason.WOULD_CREATE_CYCLE, sourceId, targetId);
        }

        LogicGate resolved = resolveGate(source, targetId);
        boolean changed = resolved != source.getGate();
        log.debug("Связь {} -> {} допустима, шлюз: {}{}", sourceId, targetId, resolved,
            changed ? " (изменён)" : "");
        return LinkDecision.builder()
            .sourceId(sourceId)
            .targetId(targetId)
            .requiredGate(resolved)
            .gateChanged(changed)
            .build();
    }

    /**
     * Допустимо ли присоединение target под source с точки зрения правила деревьев обхода
     */
    public boolean isCircumventAttachmentAllowed(String sourceId, String targetId) {
        Optional<AttackNode> source = graph.node(sourceId);
        if (source.isEmpty() || source.get().isLeaf()) {
            return false;
        }
        try {
            resolveGate(source.get(), targetId);
            return true;
        } catch (LinkRejectedException e) {
            return false;
        }
    }

    private LogicGate resolveGate(AttackNode source, String targetId) {
        List<String> childrenAfter = new ArrayList<>(source.getChildren());
        childrenAfter.add(targetId);
        LogicGate current = source.getGate();
        boolean targetIsCircumvent = graph.isRole(targetId, NodeRole.CIRCUMVENT_ROOT);

        if (targetIsCircumvent) {
            if (current == LogicGate.AND) {
                return LogicGate.AND;
            }
            if (current == LogicGate.OR) {
                boolean allCircumvent = childrenAfter.stream()
                    .allMatch(id -> graph.isRole(id, NodeRole.CIRCUMVENT_ROOT));
                if (allCircumvent) {
                    return LogicGate.OR;
                }
                throw reject(LinkRejectionReason.ILLEGAL_CIRCUMVENT_ATTACHMENT, source.getId(), targetId);
            }
            // шлюза ещё нет: присоединение неявно назначает AND
            return LogicGate.AND;
        }

        boolean hasCircumventChildren = graph.hasCircumventChildren(source.getId());
        if (current == LogicGate.OR && hasCircumventChildren) {
            // OR с деревьями обхода допустим только если ВСЕ дети - деревья обхода
            throw reject(LinkRejectionReason.ILLEGAL_CIRCUMVENT_ATTACHMENT, source.getId(), targetId);
        }
        if (current == null && source.isRoot() && childrenAfter.size() > 1) {
            return hasCircumventChildren ? LogicGate.AND : LogicGate.OR;
        }
        return current;
    }

    private boolean isSelfReference(String sourceId, String targetId) {
        Optional<AttackNode> target = graph.node(targetId);
        if (target.isEmpty() || !target.get().getRole().isReusableRoot()) {
            return false;
        }
        return classifier.findOwningRoot(sourceId, target.get().getRole())
            .map(targetId::equals)
            .orElse(false);
    }

    private LinkRejectedException reject(LinkRejectionReason reason, String sourceId, String targetId) {
        log.warn("Связь {} -> {} отклонена: {}", sourceId, targetId, reason);
        return new LinkRejectedException(reason, sourceId, targetId);
    }
}
