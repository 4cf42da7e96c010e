package com.vtb.attacktree.models;

/**
 * Уровень риска угрозы (матрица осуществимость x ущерб)
 */
public enum RiskLevel {
    CRITICAL("Критический", 5),
    HIGH("Высокий", 4),
    MEDIUM("Средний", 3),
    LOW("Низкий", 2),
    NEGLIGIBLE("Незначительный", 1);

    private final String russianName;
    private final int priority;

    RiskLevel(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }
}
