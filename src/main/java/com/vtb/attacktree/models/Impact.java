package com.vtb.attacktree.models;

/**
 * Уровень ущерба сценария повреждения
 */
public enum Impact {
    NEGLIGIBLE("Negligible", 1),
    MODERATE("Moderate", 2),
    MAJOR("Major", 3),
    SEVERE("Severe", 4);

    private final String displayName;
    private final int score;

    Impact(String displayName, int score) {
        this.displayName = displayName;
        this.score = score;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getScore() {
        return score;
    }
}
