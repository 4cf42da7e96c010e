package com.vtb.attacktree.graph;

/**
 * Причины отклонения новой связи в дереве атак
 */
public enum LinkRejectionReason {
    WOULD_CREATE_CYCLE("Связь создаст цикл"),
    ILLEGAL_CIRCUMVENT_ATTACHMENT("Дерево обхода может быть дочерним только у AND-узла "
        + "(или у OR-узла, все дети которого - деревья обхода)"),
    LEAF_CANNOT_HAVE_CHILDREN("Лист атаки не может иметь исходящих связей"),
    SELF_REFERENCING_SUBTREE("Поддерево не может ссылаться само на себя"),
    DUPLICATE_LINK("Связь уже существует"),
    UNKNOWN_NODE("Узел не найден");

    private final String description;

    LinkRejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
