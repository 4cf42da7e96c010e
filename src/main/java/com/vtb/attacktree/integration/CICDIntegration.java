package com.vtb.attacktree.integration;

import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.ThreatAssessment;
import lombok.extern.slf4j.Slf4j;

/**
 * Интеграция с CI/CD системами
 */
@Slf4j
public class CICDIntegration {

    private CICDIntegration() {}

    /**
     * Определить exit code на основе результатов анализа
     *
     * @param report результат анализа
     * @param failOnHigh прерывать ли сборку при угрозах с высокой осуществимостью
     * @return exit code (0 = успех, 1 = провал)
     */
    public static int getExitCode(AssessmentReport report, boolean failOnHigh) {
        if (report == null) {
            log.warn("Результат анализа null, возвращаем код успеха");
            return 0;
        }
        if (failOnHigh && report.hasHighFeasibilityThreats()) {
            log.error("Есть угрозы с высокой осуществимостью атаки. Сборка провалена.");
            return 1;
        }
        log.info("Угроз с высокой осуществимостью не обнаружено");
        return 0;
    }

    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(AssessmentReport report) {
        if (report == null) {
            log.warn("Результат анализа null, пропускаем вывод");
            return;
        }

        System.out.println("\n=== Attack Tree Assessment Summary ===");
        System.out.println("Project: " + (report.getProjectName() != null ? report.getProjectName() : "Unknown"));
        System.out.println("Date: " + (report.getGeneratedAt() != null ? report.getGeneratedAt() : "N/A"));
        System.out.println("\nThreats by feasibility:");
        for (FeasibilityRating rating : FeasibilityRating.values()) {
            System.out.printf("  %-9s %d%n", rating.name() + ":", report.getThreatCountByFeasibility(rating));
        }
        long undetermined = report.getThreats().stream()
            .filter(t -> t.getInitialFeasibility() == null)
            .count();
        System.out.println("  TBD:      " + undetermined);
        System.out.println("\nTotal: " + report.getThreats().size() + " threats, "
            + report.getTrees().size() + " trees");
        System.out.println("Duration: " + (report.getStatistics() != null
            ? report.getStatistics().getEvaluationDurationMs() : 0) + " ms");
        System.out.println("======================================\n");
    }

    /**
     * Аннотации GitHub Actions для угроз с высокой и средней осуществимостью
     */
    public static void printGitHubAnnotations(AssessmentReport report) {
        if (report == null || report.getThreats() == null) {
            return;
        }
        for (ThreatAssessment threat : report.getThreats()) {
            FeasibilityRating rating = threat.getResidualFeasibility();
            if (rating == null) {
                continue;
            }
            String level = switch (rating) {
                case HIGH -> "error";
                case MEDIUM -> "warning";
                default -> "notice";
            };
            System.out.printf("::%s title=%s::%s - feasibility %s, risk %s%n",
                level, threat.getThreatId(), threat.getName(), rating,
                threat.getResidualRisk() != null ? threat.getResidualRisk() : "TBD");
        }
    }
}
