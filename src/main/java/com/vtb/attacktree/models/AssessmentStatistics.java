package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AssessmentStatistics {
    private int totalNodes;
    private int attackRoots;
    private int circumventRoots;
    private int technicalRoots;
    private int activeConfigurations;
    private int treesWithoutAttackPath;
    private long evaluationDurationMs;
}
