package com.vtb.attacktree.reports;

import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.AssessmentStatistics;
import com.vtb.attacktree.models.FeasibilityRating;
import com.vtb.attacktree.models.NodeMetrics;
import com.vtb.attacktree.models.RiskLevel;
import com.vtb.attacktree.models.ThreatAssessment;
import com.vtb.attacktree.models.TreeEvaluation;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Генератор HTML отчетов: таблица угроз и критические пути каждого дерева
 */
@Slf4j
public class HtmlReportGenerator implements ReportGenerator {

    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");
    private static final int MAX_PATHS_PER_TREE = 20;

    @Override
    public void generate(AssessmentReport report, Path outputPath) throws IOException {
        log.info("Генерация HTML отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("AssessmentReport не может быть null");
        }

        Files.writeString(outputPath, generateHtml(report));

        log.info("HTML отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "html";
    }

    String generateHtml(AssessmentReport report) {
        StringBuilder html = new StringBuilder();
        AssessmentStatistics stats = report.getStatistics() != null
            ? report.getStatistics()
            : AssessmentStatistics.builder().build();

        html.append("<!DOCTYPE html>\n<html lang=\"ru\">\n<head>\n")
            .append("<meta charset=\"UTF-8\">\n")
            .append("<title>Деревья атак: ").append(escapeHtml(report.getProjectName())).append("</title>\n")
            .append("<style>\n")
            .append("body { font-family: sans-serif; margin: 2em; color: #222; }\n")
            .append("table { border-collapse: collapse; margin-bottom: 2em; }\n")
            .append("th, td { border: 1px solid #ccc; padding: 4px 10px; text-align: left; }\n")
            .append(".high { background: #f8d7da; } .medium { background: #fff3cd; }\n")
            .append(".low { background: #d1ecf1; } .very-low { background: #d4edda; }\n")
            .append(".tbd { color: #888; font-style: italic; }\n")
            .append("</style>\n</head>\n<body>\n");

        html.append("<h1>").append(escapeHtml(report.getProjectName())).append("</h1>\n");
        if (report.getGeneratedAt() != null) {
            html.append("<p>Дата: ").append(report.getGeneratedAt().format(DATE_FORMATTER)).append("</p>\n");
        }
        html.append("<p>Узлов: ").append(stats.getTotalNodes())
            .append(", деревьев атак: ").append(stats.getAttackRoots())
            .append(", деревьев обхода: ").append(stats.getCircumventRoots())
            .append(", технических деревьев: ").append(stats.getTechnicalRoots())
            .append(", без пути атаки: ").append(stats.getTreesWithoutAttackPath())
            .append("</p>\n");

        appendThreats(html, report.getThreats());
        appendTrees(html, report.getTrees());

        html.append("</body>\n</html>\n");
        return html.toString();
    }

    private void appendThreats(StringBuilder html, List<ThreatAssessment> threats) {
        if (threats == null || threats.isEmpty()) {
            return;
        }
        html.append("<h2>Угрозы</h2>\n<table>\n<tr><th>Угроза</th><th>Дерево</th><th>Ущерб</th>")
            .append("<th>AP</th><th>Осуществимость</th><th>Риск</th>")
            .append("<th>AP (с обходом)</th><th>Осуществимость (с обходом)</th><th>Риск (с обходом)</th></tr>\n");
        for (ThreatAssessment threat : threats) {
            html.append("<tr><td>").append(escapeHtml(threat.getName())).append("</td>")
                .append("<td>").append(escapeHtml(threat.getRootId())).append("</td>")
                .append("<td>").append(threat.getImpact() != null ? threat.getImpact().getDisplayName() : "").append("</td>")
                .append(scoreCell(threat.getInitialScore()))
                .append(feasibilityCell(threat.getInitialFeasibility()))
                .append(riskCell(threat.getInitialRisk()))
                .append(scoreCell(threat.getResidualScore()))
                .append(feasibilityCell(threat.getResidualFeasibility()))
                .append(riskCell(threat.getResidualRisk()))
                .append("</tr>\n");
        }
        html.append("</table>\n");
    }

    private void appendTrees(StringBuilder html, List<TreeEvaluation> trees) {
        if (trees == null || trees.isEmpty()) {
            return;
        }
        html.append("<h2>Деревья</h2>\n");
        for (TreeEvaluation tree : trees) {
            html.append("<h3>").append(escapeHtml(tree.getTitle()))
                .append(" <small>(").append(escapeHtml(tree.getRootId())).append(", ")
                .append(tree.getRole() != null ? tree.getRole().getRussianName() : "").append(")</small></h3>\n");
            appendMetrics(html, "Начальный риск", tree.getInitial(), tree.getInitialFeasibility());
            appendMetrics(html, "С учётом обхода мер защиты", tree.getResidual(), tree.getResidualFeasibility());
        }
    }

    private void appendMetrics(StringBuilder html, String label, NodeMetrics metrics, FeasibilityRating rating) {
        html.append("<h4>").append(label).append("</h4>\n");
        if (metrics == null) {
            html.append("<p class=\"tbd\">Пути атаки нет</p>\n");
            return;
        }
        html.append("<p>AP = ").append(metrics.getPotentialScore())
            .append(" (").append(metrics.getPotential()).append("), осуществимость: ")
            .append(rating != null ? rating.getRussianName() : "-").append("</p>\n<ol>\n");
        List<List<String>> paths = metrics.getCriticalPaths();
        int limit = Math.min(MAX_PATHS_PER_TREE, paths.size());
        for (int i = 0; i < limit; i++) {
            html.append("<li>").append(escapeHtml(String.join(" → ", paths.get(i)))).append("</li>\n");
        }
        html.append("</ol>\n");
        if (paths.size() > limit || metrics.isTruncated()) {
            html.append("<p class=\"tbd\">Показаны не все критические пути</p>\n");
        }
    }

    private String scoreCell(Integer score) {
        return score != null ? "<td>" + score + "</td>" : "<td class=\"tbd\">TBD</td>";
    }

    private String feasibilityCell(FeasibilityRating rating) {
        if (rating == null) {
            return "<td class=\"tbd\">TBD</td>";
        }
        String css = rating.name().toLowerCase().replace('_', '-');
        return "<td class=\"" + css + "\">" + rating.getRussianName() + "</td>";
    }

    private String riskCell(RiskLevel risk) {
        return risk != null ? "<td>" + risk.getRussianName() + "</td>" : "<td class=\"tbd\">TBD</td>";
    }

    private static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
