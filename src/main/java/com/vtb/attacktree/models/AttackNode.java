package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Узел дерева атак.
 *
 * Лист несёт потенциал атаки и не имеет ни шлюза, ни детей.
 * Промежуточный шаг (GATE) обязан иметь шлюз. Корень может быть без шлюза - тогда он вычисляется как AND.
 * Недопустимые сочетания отклоняются при создании.
 */
@Value
public class AttackNode {

    String id;
    String title;
    NodeRole role;
    LogicGate gate;
    AttackPotential attackPotential;
    AttackerType attackerType;
    List<String> children;
    Set<String> requiredToeConfigurationIds;

    @Builder(toBuilder = true)
    private AttackNode(String id,
                       String title,
                       NodeRole role,
                       LogicGate gate,
                       AttackPotential attackPotential,
                       AttackerType attackerType,
                       List<String> children,
                       Set<String> requiredToeConfigurationIds) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Идентификатор узла не может быть пустым");
        }
        NodeRole effectiveRole = role != null ? role : NodeRole.LEAF;
        List<String> effectiveChildren = children != null ? new ArrayList<>(children) : new ArrayList<>();

        if (effectiveRole == NodeRole.LEAF) {
            if (gate != null) {
                throw new IllegalArgumentException("Лист '" + id + "' не может иметь логический шлюз");
            }
            if (!effectiveChildren.isEmpty()) {
                throw new IllegalArgumentException("Лист '" + id + "' не может иметь дочерних узлов");
            }
        } else {
            if (effectiveRole == NodeRole.GATE && gate == null) {
                throw new IllegalArgumentException("Промежуточный узел '" + id + "' должен иметь шлюз AND или OR");
            }
            if (attackPotential != null) {
                throw new IllegalArgumentException("Потенциал атаки задаётся только у листьев, узел '" + id + "'");
            }
            if (attackerType != null && attackerType != AttackerType.NONE) {
                throw new IllegalArgumentException("Профиль атакующего задаётся только у листьев, узел '" + id + "'");
            }
        }

        this.id = id;
        this.title = title != null ? title : id;
        this.role = effectiveRole;
        this.gate = gate;
        this.attackPotential = effectiveRole == NodeRole.LEAF
            ? (attackPotential != null ? attackPotential : AttackPotential.ZERO)
            : null;
        this.attackerType = attackerType;
        this.children = Collections.unmodifiableList(effectiveChildren);
        this.requiredToeConfigurationIds = requiredToeConfigurationIds != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(requiredToeConfigurationIds))
            : Collections.emptySet();
    }

    public static AttackNode leaf(String id, AttackPotential potential) {
        return builder().id(id).role(NodeRole.LEAF).attackPotential(potential).build();
    }

    public static AttackNode gate(String id, LogicGate gate, String... children) {
        return builder().id(id).role(NodeRole.GATE).gate(gate).children(List.of(children)).build();
    }

    public static AttackNode root(String id, NodeRole role, LogicGate gate, String... children) {
        if (role == null || !role.isRoot()) {
            throw new IllegalArgumentException("Роль корня ожидалась для узла '" + id + "': " + role);
        }
        return builder().id(id).role(role).gate(gate).children(List.of(children)).build();
    }

    public boolean isLeaf() {
        return role == NodeRole.LEAF;
    }

    public boolean isRoot() {
        return role.isRoot();
    }

    /**
     * Шлюз, по которому узел вычисляется: корень без шлюза считается AND
     */
    public LogicGate effectiveGate() {
        return gate != null ? gate : LogicGate.AND;
    }

    public AttackNode withChildren(List<String> newChildren) {
        return toBuilder().children(newChildren).build();
    }

    public AttackNode withGate(LogicGate newGate) {
        return toBuilder().gate(newGate).build();
    }
}
