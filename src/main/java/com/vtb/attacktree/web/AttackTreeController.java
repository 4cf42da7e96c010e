package com.vtb.attacktree.web;

import com.vtb.attacktree.core.AttackTreeAnalyzer;
import com.vtb.attacktree.core.AttackTreeLoadException;
import com.vtb.attacktree.core.AttackTreeLoader;
import com.vtb.attacktree.feasibility.FeasibilityMapper;
import com.vtb.attacktree.feasibility.ThresholdFeasibilityMapper;
import com.vtb.attacktree.graph.LinkRejectedException;
import com.vtb.attacktree.graph.TopologyValidator;
import com.vtb.attacktree.metrics.MetricsEngine;
import com.vtb.attacktree.models.AssessmentReport;
import com.vtb.attacktree.models.LinkDecision;
import com.vtb.attacktree.models.NodeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST API контроллер: расчёт деревьев атак и проверка связей.
 * Документ проекта (JSON или YAML) передаётся в теле запроса.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class AttackTreeController {

    private final FeasibilityMapper feasibilityMapper = new ThresholdFeasibilityMapper();

    /**
     * Рассчитать проект целиком или один узел
     *
     * POST /api/v1/evaluate[?rootId=...&residual=true]
     */
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(
            @RequestBody String document,
            @RequestParam(value = "rootId", required = false) String rootId,
            @RequestParam(value = "residual", defaultValue = "false") boolean residual) {
        try {
            AttackTreeLoader loader = new AttackTreeLoader();
            loader.parseContent(document, "request");

            if (rootId == null || rootId.isBlank()) {
                AssessmentReport report = new AttackTreeAnalyzer(loader).analyze();
                return ResponseEntity.ok(report);
            }

            MetricsEngine engine = new MetricsEngine(loader.getGraph());
            Optional<NodeMetrics> metrics = engine.evaluate(rootId, residual);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("rootId", rootId);
            response.put("residual", residual);
            response.put("hasAttackPath", metrics.isPresent());
            response.put("metrics", metrics.orElse(null));
            response.put("feasibility", metrics
                .map(m -> feasibilityMapper.ratingOf(m.getPotentialScore()))
                .orElse(null));
            return ResponseEntity.ok(response);

        } catch (AttackTreeLoadException | IllegalArgumentException e) {
            log.warn("Некорректный запрос на расчёт: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Ошибка расчёта: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Ошибка расчёта: " + e.getMessage()));
        }
    }

    /**
     * Проверить связь source -> target без изменения проекта
     *
     * POST /api/v1/links/validate?source=...&target=...
     */
    @PostMapping("/links/validate")
    public ResponseEntity<?> validateLink(
            @RequestBody String document,
            @RequestParam("source") String source,
            @RequestParam("target") String target) {
        try {
            AttackTreeLoader loader = new AttackTreeLoader();
            loader.parseContent(document, "request");

            LinkDecision decision = new TopologyValidator(loader.getGraph()).validateLink(source, target);
            return ResponseEntity.ok(decision);

        } catch (LinkRejectedException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getReason().getDescription());
            body.put("reason", e.getReason().name());
            body.put("source", e.getSourceId());
            body.put("target", e.getTargetId());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        } catch (AttackTreeLoadException | IllegalArgumentException e) {
            log.warn("Некорректный запрос на проверку связи: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "UP");
        status.put("engine", "VTB Attack Tree Engine");
        status.put("version", "1.0.0");
        return ResponseEntity.ok(status);
    }
}
