package com.vtb.attacktree.integration;

import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.RiskLevel;
import com.vtb.attacktree.models.ThreatAssessment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CICDIntegrationTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private static AssessmentReport report(FeasibilityRating residual) {
        return AssessmentReport.builder()
            .projectName("CI")
            .threats(List.of(
                ThreatAssessment.builder()
                    .threatId("T1").name("Перехват")
                    .initialFeasibility(FeasibilityRating.HIGH)
                    .residualFeasibility(residual)
                    .residualRisk(RiskLevel.HIGH)
                    .build(),
                ThreatAssessment.builder().threatId("T2").name("Без дерева").build()))
            .build();
    }

    @Test
    void testExitCode() {
        assertEquals(1, CICDIntegration.getExitCode(report(FeasibilityRating.HIGH), true));
        assertEquals(0, CICDIntegration.getExitCode(report(FeasibilityRating.HIGH), false),
            "Без --fail-on-high сборка не падает");
        assertEquals(0, CICDIntegration.getExitCode(report(FeasibilityRating.LOW), true),
            "Мера защиты снижает осуществимость - сборка проходит");
        assertEquals(0, CICDIntegration.getExitCode(null, true));
    }

    @Test
    void testSummary() {
        CICDIntegration.printCISummary(report(FeasibilityRating.LOW));

        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Project: CI"));
        assertTrue(text.contains("HIGH:     1"));
        assertTrue(text.contains("TBD:      1"));
        assertTrue(text.contains("Total: 2 threats, 0 trees"));
    }

    @Test
    void testGitHubAnnotations() {
        CICDIntegration.printGitHubAnnotations(report(FeasibilityRating.HIGH));

        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("::error title=T1::Перехват"));
        assertFalse(text.contains("T2"), "Угрозы TBD не аннотируются");
    }
}
