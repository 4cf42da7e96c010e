package com.vtb.attacktree.core;

import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.AssessmentStatistics;
import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.NodeRole;
import com.vtb.attacktree.models.RiskLevel;
import com.vtb.attacktree.models.ThreatAssessment;
import com.vtb.attacktree.models.TreeEvaluation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Полный анализ проекта из тестовых файлов
 */
class AttackTreeAnalyzerTest {

    private static AssessmentReport analyze(String path) {
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseFromFile(path);
        return new AttackTreeAnalyzer(loader).analyze();
    }

    @Test
    void testTreesInRoleOrder() {
        AssessmentReport report = analyze(AttackTreeLoaderTest.VEHICLE_PROJECT);

        List<String> rootIds = report.getTrees().stream().map(TreeEvaluation::getRootId).toList();
        assertEquals(List.of("ROOT1", "ROOT2", "CR1", "TR1"), rootIds);
        assertEquals(NodeRole.CIRCUMVENT_ROOT, report.getTrees().get(2).getRole());
    }

    @Test
    void testAttackTreeBothModes() {
        TreeEvaluation root1 = analyze(AttackTreeLoaderTest.VEHICLE_PROJECT).getTrees().get(0);

        assertEquals(12, root1.getInitial().getPotentialScore());
        assertEquals(List.of(List.of("ROOT1", "G1", "L1")), root1.getInitial().getCriticalPaths());
        assertEquals(FeasibilityRating.HIGH, root1.getInitialFeasibility());

        assertEquals(34, root1.getResidual().getPotentialScore());
        assertEquals(List.of(List.of("ROOT1", "G1", "L1", "CR1", "L3")), root1.getResidual().getCriticalPaths());
        assertEquals(FeasibilityRating.VERY_LOW, root1.getResidualFeasibility());
    }

    @Test
    void testReusableTrees() {
        AssessmentReport report = analyze(AttackTreeLoaderTest.VEHICLE_PROJECT);

        TreeEvaluation circumvent = report.getTrees().get(2);
        assertNull(circumvent.getInitial(), "Дерево обхода не считается в начальном режиме");
        assertNotNull(circumvent.getResidual());
        assertTrue(circumvent.hasAttackPath());

        TreeEvaluation technical = report.getTrees().get(3);
        assertEquals(AttackPotential.of(1, 0, 0, 1, 0), technical.getInitial().getPotential());
        assertEquals(List.of(List.of("TR1", "L5")), technical.getInitial().getCriticalPaths());
    }

    @Test
    void testThreatAssessments() {
        AssessmentReport report = analyze(AttackTreeLoaderTest.VEHICLE_PROJECT);

        ThreatAssessment t1 = report.getThreats().get(0);
        assertEquals(RiskLevel.CRITICAL, t1.getInitialRisk());
        assertEquals(RiskLevel.LOW, t1.getResidualRisk());

        ThreatAssessment t2 = report.getThreats().get(1);
        assertNull(t2.getInitialFeasibility(), "Bluetooth отключён - пути атаки нет");

        assertEquals(1, report.getThreatCountByFeasibility(FeasibilityRating.HIGH));
        assertFalse(report.hasHighFeasibilityThreats());
    }

    @Test
    void testStatistics() {
        AssessmentReport report = analyze(AttackTreeLoaderTest.VEHICLE_PROJECT);
        AssessmentStatistics stats = report.getStatistics();

        assertEquals("Шлюз кузовной электроники", report.getProjectName());
        assertNotNull(report.getGeneratedAt());
        assertEquals(10, stats.getTotalNodes());
        assertEquals(2, stats.getAttackRoots());
        assertEquals(1, stats.getCircumventRoots());
        assertEquals(1, stats.getTechnicalRoots());
        assertEquals(1, stats.getActiveConfigurations());
        assertEquals(1, stats.getTreesWithoutAttackPath());
    }

    @Test
    void testHighFeasibilityProject() {
        AssessmentReport report = analyze(AttackTreeLoaderTest.HIGH_THREAT_PROJECT);

        assertTrue(report.hasHighFeasibilityThreats());
        assertEquals(RiskLevel.HIGH, report.getThreats().get(0).getResidualRisk());
    }

    @Test
    void testNotLoaded() {
        assertThrows(IllegalStateException.class, () -> new AttackTreeAnalyzer(new AttackTreeLoader()).analyze());
    }
}
