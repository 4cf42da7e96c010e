package com.vtb.attacktree.cli;

import com.vtb.attacktree.core.AttackTreeAnalyzer;
import com.vtb.attacktree.core.AttackTreeLoader;
import com.vtb.attacktree.feasibility.ThresholdFeasibilityMapper;
import com.vtb.attacktree.integration.CICDIntegration;
import com.vtb.attacktree.metrics.MetricsEngine;
import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.NodeMetrics;
import com.vtb.attacktree.models.RiskLevel;
import com.vtb.attacktree.models.ThreatAssessment;
import com.vtb.attacktree.models.TreeEvaluation;
import com.vtb.attacktree.reports.HtmlReportGenerator;
import com.vtb.attacktree.reports.JsonReportGenerator;
import com.vtb.attacktree.web.AttackTreeWebApplication;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда движка деревьев атак
 */
@Slf4j
@Command(
    name = "attack-tree",
    mixinStandardHelpOptions = true,
    version = "VTB Attack Tree Engine 1.0.0",
    description = """

        VTB Attack Tree Engine

        Расчёт потенциала атаки и критических путей деревьев атак (ISO/SAE 21434)

        Возможности:
          • Начальный и остаточный риск (с деревьями обхода мер защиты)
          • Конфигурации объекта оценки
          • Оценка угроз по матрице риска
          • Отчеты JSON и HTML, режим CI/CD

        """
)
public class MainCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Путь к файлу проекта (JSON/YAML)"
    )
    private String projectPath;

    @Option(
        names = {"-r", "--root"},
        description = "Рассчитать только один узел (корень или промежуточный шаг)"
    )
    private String rootId;

    @Option(
        names = {"--residual"},
        description = "Для --root: учитывать деревья обхода мер защиты (остаточный риск)"
    )
    private boolean residual = false;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчетов (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";

    @Option(
        names = {"--json-only"},
        description = "Генерировать только JSON отчет"
    )
    private boolean jsonOnly = false;

    @Option(
        names = {"--fail-on-high"},
        description = "Завершиться с ошибкой, если есть угрозы с высокой осуществимостью (для CI/CD)"
    )
    private boolean failOnHigh = false;

    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;

    @Option(
        names = {"--web"},
        description = "Запустить REST API (http://localhost:8080/api/v1)"
    )
    private boolean webMode = false;

    @Option(
        names = {"--port"},
        description = "Порт для REST API (по умолчанию: 8080)"
    )
    private int webPort = 8080;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        printBanner();

        if (webMode) {
            log.info("Запуск REST API на порту {}...", webPort);
            AttackTreeWebApplication.main(new String[] {"--server.port=" + webPort});
            return 0;
        }

        if (projectPath == null) {
            log.error("Не указан файл проекта");
            return 2;
        }

        try {
            AttackTreeLoader loader = new AttackTreeLoader();
            loader.parseFromFile(projectPath);

            if (rootId != null) {
                return evaluateSingle(loader);
            }

            AssessmentReport report = new AttackTreeAnalyzer(loader).analyze();

            Path outputPath = Paths.get(outputDir);
            Files.createDirectories(outputPath);
            new JsonReportGenerator().generate(report, outputPath.resolve("attack-tree-report.json"));
            if (!jsonOnly) {
                new HtmlReportGenerator().generate(report, outputPath.resolve("attack-tree-report.html"));
            }

            if (ciMode) {
                CICDIntegration.printCISummary(report);
                CICDIntegration.printGitHubAnnotations(report);
            } else {
                printDetailedResults(report);
            }
            return CICDIntegration.getExitCode(report, failOnHigh);

        } catch (Exception e) {
            log.error("Ошибка при анализе проекта: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int evaluateSingle(AttackTreeLoader loader) {
        MetricsEngine engine = new MetricsEngine(loader.getGraph());
        Optional<NodeMetrics> metrics = engine.evaluate(rootId, residual);

        System.out.println();
        System.out.println("Узел: " + rootId + " (режим: " + (residual ? "остаточный" : "начальный") + ")");
        if (metrics.isEmpty()) {
            System.out.println("Пути атаки нет");
            return 0;
        }
        NodeMetrics result = metrics.get();
        FeasibilityRating rating = new ThresholdFeasibilityMapper().ratingOf(result.getPotentialScore());
        System.out.println("AP = " + result.getPotentialScore() + " " + result.getPotential());
        System.out.println("Осуществимость: " + rating.getRussianName());
        System.out.println("Критические пути (" + result.getCriticalPaths().size()
            + (result.isTruncated() ? ", обрезано" : "") + "):");
        for (List<String> path : result.getCriticalPaths()) {
            System.out.println("   " + String.join(" → ", path));
        }
        System.out.println();
        return 0;
    }

    /**
     * Вывести детальные результаты
     */
    private void printDetailedResults(AssessmentReport report) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("VTB ATTACK TREE REPORT");
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Проект: " + report.getProjectName());
        System.out.println("Дата: " + report.getGeneratedAt());
        System.out.println("Время расчёта: " + report.getStatistics().getEvaluationDurationMs() + " мс");
        System.out.println();

        System.out.println("СТАТИСТИКА:");
        System.out.println("   Узлов: " + report.getStatistics().getTotalNodes());
        System.out.println("   Деревьев атак: " + report.getStatistics().getAttackRoots());
        System.out.println("   Деревьев обхода: " + report.getStatistics().getCircumventRoots());
        System.out.println("   Технических деревьев: " + report.getStatistics().getTechnicalRoots());
        System.out.println("   Без пути атаки: " + report.getStatistics().getTreesWithoutAttackPath());
        System.out.println();

        System.out.println("ДЕРЕВЬЯ:");
        for (TreeEvaluation tree : report.getTrees()) {
            System.out.printf("   %-30s начальный: %-6s остаточный: %s%n",
                tree.getRootId(), score(tree.getInitial()), score(tree.getResidual()));
        }
        System.out.println();

        if (!report.getThreats().isEmpty()) {
            System.out.println("УГРОЗЫ:");
            for (ThreatAssessment threat : report.getThreats()) {
                System.out.printf("   [%s -> %s] %s%n",
                    riskLabel(threat.getInitialRisk()), riskLabel(threat.getResidualRisk()), threat.getName());
            }
            System.out.println();
        }

        System.out.println("Отчеты сохранены в: " + outputDir);
        System.out.println("=".repeat(80));
        System.out.println();
    }

    private String score(NodeMetrics metrics) {
        return metrics != null ? String.valueOf(metrics.getPotentialScore()) : "TBD";
    }

    private String riskLabel(RiskLevel risk) {
        return risk != null ? risk.name() : "TBD";
    }

    /**
     * Вывести баннер
     */
    private void printBanner() {
        if (ciMode) return;
        System.out.println("""
            ╔═══════════════════════════════════════════════════════════╗
            ║     VTB Attack Tree Engine v1.0.0                         ║
            ║     Потенциал атаки и критические пути                    ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
