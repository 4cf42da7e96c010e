package com.vtb.attacktree.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.attacktree.core.document.NeedRecord;
import com.vtb.attacktree.core.document.ProjectDocument;
import com.vtb.attacktree.core.document.ThreatRecord;
import com.vtb.attacktree.core.document.ToeConfigurationRecord;
import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.AttackerType;
import com.vtb.attacktree.models.Impact;
import com.vtb.attacktree.models.LogicGate;
import com.vtb.attacktree.models.NodeRole;
import com.vtb.attacktree.models.Threat;
import com.vtb.attacktree.models.ToeConfiguration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Загрузчик сохранённого проекта (JSON или YAML) в граф дерева атак.
 *
 * Узлы хранятся плоским списком: роль корня восстанавливается по тегу,
 * лист - узел типа attack без шлюза и без тега корня.
 */
@Slf4j
public class AttackTreeLoader {

    private static final String ATTACK_TYPE = "attack";

    private final ObjectMapper jsonMapper = configure(new ObjectMapper());
    private final ObjectMapper yamlMapper = configure(new ObjectMapper(new YAMLFactory()));

    @Getter
    private AttackTreeGraph graph;
    @Getter
    private List<Threat> threats = new ArrayList<>();
    @Getter
    private String projectName;
    @Getter
    private String source;

    /**
     * Загрузить проект из файла. Формат определяется по расширению (.json, иначе YAML).
     */
    public void parseFromFile(String filePath) {
        log.info("Загрузка проекта из файла: {}", filePath);

        File file = new File(filePath);
        if (!file.exists()) {
            throw new IllegalArgumentException("Файл не найден: " + filePath);
        }

        ObjectMapper mapper = isJson(filePath) ? jsonMapper : yamlMapper;
        try {
            apply(mapper.readValue(file, ProjectDocument.class), file.getAbsolutePath());
        } catch (IOException e) {
            throw new AttackTreeLoadException("Не удалось прочитать проект " + filePath + ": " + e.getMessage(), e);
        }
    }

    public void parse(InputStream input, String sourceName) {
        ObjectMapper mapper = isJson(sourceName) ? jsonMapper : yamlMapper;
        try {
            apply(mapper.readValue(input, ProjectDocument.class), sourceName);
        } catch (IOException e) {
            throw new AttackTreeLoadException("Не удалось прочитать проект " + sourceName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить проект из строки (тело HTTP-запроса). JSON распознаётся по первой фигурной скобке.
     */
    public void parseContent(String content, String sourceName) {
        if (content == null || content.isBlank()) {
            throw new AttackTreeLoadException("Пустой документ проекта");
        }
        ObjectMapper mapper = content.stripLeading().startsWith("{") ? jsonMapper : yamlMapper;
        try {
            apply(mapper.readValue(content, ProjectDocument.class), sourceName);
        } catch (JsonProcessingException e) {
            throw new AttackTreeLoadException("Некорректный документ проекта: " + e.getOriginalMessage(), e);
        }
    }

    public void parseDocument(ProjectDocument document, String sourceName) {
        apply(document, sourceName);
    }

    private void apply(ProjectDocument document, String sourceName) {
        if (document == null) {
            throw new AttackTreeLoadException("Пустой документ проекта: " + sourceName);
        }

        List<AttackNode> nodes = new ArrayList<>();
        int skipped = 0;
        for (NeedRecord need : orEmpty(document.getNeeds())) {
            if (need == null) {
                throw new AttackTreeLoadException("Пустая запись узла в документе: " + sourceName);
            }
            if (need.getType() != null && !ATTACK_TYPE.equalsIgnoreCase(need.getType())) {
                skipped++;
                continue;
            }
            nodes.add(toNode(need));
        }

        List<ToeConfiguration> configurations = new ArrayList<>();
        for (ToeConfigurationRecord record : orEmpty(document.getToeConfigurations())) {
            if (record == null) {
                throw new AttackTreeLoadException("Пустая запись конфигурации в документе: " + sourceName);
            }
            configurations.add(toConfiguration(record));
        }

        AttackTreeGraph loaded;
        try {
            loaded = AttackTreeGraph.of(nodes, configurations);
        } catch (IllegalArgumentException e) {
            throw new AttackTreeLoadException(e.getMessage(), e);
        }
        reportDanglingLinks(loaded);

        List<Threat> loadedThreats = new ArrayList<>();
        for (ThreatRecord record : orEmpty(document.getThreats())) {
            if (record == null) {
                throw new AttackTreeLoadException("Пустая запись угрозы в документе: " + sourceName);
            }
            loadedThreats.add(toThreat(record));
        }

        this.graph = loaded;
        this.threats = loadedThreats;
        this.projectName = document.getName() != null ? document.getName() : sourceName;
        this.source = sourceName;

        log.info("Проект '{}' загружен: узлов {}, конфигураций {}, угроз {}{}",
            projectName, loaded.size(), configurations.size(), loadedThreats.size(),
            skipped > 0 ? ", пропущено записей другого типа: " + skipped : "");
    }

    static AttackNode toNode(NeedRecord need) {
        if (need.getId() == null || need.getId().isBlank()) {
            throw new AttackTreeLoadException("Узел без идентификатора");
        }
        LogicGate gate;
        AttackerType attackerType;
        try {
            gate = LogicGate.fromValue(need.getLogicGate());
            attackerType = parseAttackerType(need.getAttackerType());
        } catch (IllegalArgumentException e) {
            throw new AttackTreeLoadException("Узел " + need.getId() + ": " + e.getMessage(), e);
        }

        NodeRole role = NodeRole.fromTags(need.getTags(), gate != null);
        List<String> links = need.getLinks() != null ? need.getLinks() : List.of();
        if (role == NodeRole.LEAF && !links.isEmpty()) {
            throw new AttackTreeLoadException("Лист " + need.getId()
                + " имеет связи, но не имеет шлюза: задайте logic_gate");
        }

        AttackNode.AttackNodeBuilder builder = AttackNode.builder()
            .id(need.getId())
            .title(need.getTitle())
            .role(role)
            .gate(gate)
            .children(links)
            .requiredToeConfigurationIds(need.getToeConfigurationIds() != null
                ? new LinkedHashSet<>(need.getToeConfigurationIds())
                : Set.of());

        if (role == NodeRole.LEAF) {
            AttackPotential potential = need.getAttackPotential();
            if (attackerType != null && attackerType != AttackerType.NONE) {
                potential = attackerType.applyTo(potential);
            }
            builder.attackPotential(potential).attackerType(attackerType);
        } else if (need.getAttackPotential() != null) {
            log.debug("Потенциал атаки у не-листа {} проигнорирован", need.getId());
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new AttackTreeLoadException(e.getMessage(), e);
        }
    }

    /**
     * Профиль атакующего: по имени константы (EXPERT) или по отображаемому имени (Expert Attacker)
     */
    static AttackerType parseAttackerType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (AttackerType type : AttackerType.values()) {
            if (type.name().equalsIgnoreCase(value) || type.getDisplayName().equalsIgnoreCase(value)) {
                return type;
            }
        }
        if ("None".equalsIgnoreCase(value)) {
            return AttackerType.NONE;
        }
        throw new IllegalArgumentException("Неизвестный профиль атакующего: " + value);
    }

    private static ToeConfiguration toConfiguration(ToeConfigurationRecord record) {
        if (record.getId() == null || record.getId().isBlank()) {
            throw new AttackTreeLoadException("Конфигурация без идентификатора");
        }
        return ToeConfiguration.builder()
            .id(record.getId())
            .name(record.getName() != null ? record.getName() : record.getId())
            .description(record.getDescription())
            .active(record.getActive() == null || record.getActive())
            .build();
    }

    private static Threat toThreat(ThreatRecord record) {
        if (record.getId() == null || record.getId().isBlank()) {
            throw new AttackTreeLoadException("Угроза без идентификатора");
        }
        Impact impact = Impact.NEGLIGIBLE;
        if (record.getImpact() != null && !record.getImpact().isBlank()) {
            impact = parseImpact(record.getImpact());
        }
        return Threat.builder()
            .id(record.getId())
            .name(record.getName() != null ? record.getName() : record.getId())
            .rootId(record.getRootId() != null ? record.getRootId() : record.getId())
            .impact(impact)
            .build();
    }

    private static Impact parseImpact(String value) {
        for (Impact impact : Impact.values()) {
            if (impact.name().equalsIgnoreCase(value) || impact.getDisplayName().equalsIgnoreCase(value)) {
                return impact;
            }
        }
        throw new AttackTreeLoadException("Неизвестный уровень ущерба: " + value);
    }

    private static void reportDanglingLinks(AttackTreeGraph graph) {
        Set<String> reported = new HashSet<>();
        for (AttackNode node : graph.nodes()) {
            for (String child : node.getChildren()) {
                if (!graph.contains(child) && reported.add(child)) {
                    log.warn("Узел {} ссылается на отсутствующий узел {}: ветка не будет учитываться",
                        node.getId(), child);
                }
            }
        }
    }

    private static boolean isJson(String name) {
        return name != null && name.toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // "needs": null в документе равносилен пустому списку
    private static <T> List<T> orEmpty(List<T> records) {
        return records != null ? records : List.of();
    }
}
