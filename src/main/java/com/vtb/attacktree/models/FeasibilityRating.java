package com.vtb.attacktree.models;

/**
 * Осуществимость атаки (attack feasibility rating)
 */
public enum FeasibilityRating {
    HIGH("Высокая", 4),
    MEDIUM("Средняя", 3),
    LOW("Низкая", 2),
    VERY_LOW("Очень низкая", 1);

    private final String russianName;
    private final int score;

    FeasibilityRating(String russianName, int score) {
        this.russianName = russianName;
        this.score = score;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getScore() {
        return score;
    }
}
