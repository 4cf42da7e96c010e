package com.vtb.attacktree.models;

import java.util.Collection;

/**
 * Роль узла в дереве атак.
 * В сохранённом формате роль корня восстанавливается по тегу.
 */
public enum NodeRole {
    LEAF(null, "Лист"),
    GATE(null, "Промежуточный шаг"),
    ATTACK_ROOT("attack-root", "Корень дерева атак"),
    CIRCUMVENT_ROOT("circumvent-root", "Корень дерева обхода"),
    TECHNICAL_ROOT("technical-root", "Корень технического дерева");

    private final String tag;
    private final String russianName;

    NodeRole(String tag, String russianName) {
        this.tag = tag;
        this.russianName = russianName;
    }

    public String getTag() {
        return tag;
    }

    public String getRussianName() {
        return russianName;
    }

    public boolean isRoot() {
        return tag != null;
    }

    /**
     * Переиспользуемые поддеревья: обход защиты и технические деревья
     */
    public boolean isReusableRoot() {
        return this == CIRCUMVENT_ROOT || this == TECHNICAL_ROOT;
    }

    /**
     * Восстановить роль по тегам и наличию шлюза.
     * Приоритет: attack-root, circumvent-root, technical-root.
     */
    public static NodeRole fromTags(Collection<String> tags, boolean hasGate) {
        if (tags != null) {
            for (NodeRole role : values()) {
                if (role.isRoot() && tags.contains(role.tag)) {
                    return role;
                }
            }
        }
        return hasGate ? GATE : LEAF;
    }
}
