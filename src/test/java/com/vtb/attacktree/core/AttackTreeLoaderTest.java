package com.vtb.attacktree.core;

import com.vtb.attacktree.graph.AttackTreeGraph;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.AttackerType;
import com.vtb.attacktree.models.Impact;
import com.vtb.attacktree.models.LogicGate;
import com.vtb.attacktree.models.NodeRole;
import com.vtb.attacktree.models.Threat;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для AttackTreeLoader
 */
class AttackTreeLoaderTest {

    static final String VEHICLE_PROJECT = "src/test/resources/projects/vehicle-project.json";
    static final String HIGH_THREAT_PROJECT = "src/test/resources/projects/high-threat.yaml";

    @Test
    void testParseJsonProject() {
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseFromFile(VEHICLE_PROJECT);

        AttackTreeGraph graph = loader.getGraph();
        assertNotNull(graph, "Граф должен быть построен");
        assertEquals("Шлюз кузовной электроники", loader.getProjectName());
        assertEquals(10, graph.size(), "Записи не типа attack пропускаются");
        assertFalse(graph.contains("RISK-1"));

        assertEquals(NodeRole.ATTACK_ROOT, graph.node("ROOT1").orElseThrow().getRole());
        assertEquals(NodeRole.CIRCUMVENT_ROOT, graph.node("CR1").orElseThrow().getRole());
        assertEquals(NodeRole.TECHNICAL_ROOT, graph.node("TR1").orElseThrow().getRole());
        assertEquals(NodeRole.GATE, graph.node("G1").orElseThrow().getRole());
        assertEquals(LogicGate.OR, graph.node("G1").orElseThrow().getGate());
        assertTrue(graph.node("L1").orElseThrow().isLeaf());
        assertEquals(List.of("G1", "CR1"), graph.children("ROOT1"));
    }

    @Test
    void testAttackerPresetAppliedOnLoad() {
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseFromFile(VEHICLE_PROJECT);

        AttackNode leaf = loader.getGraph().node("L5").orElseThrow();
        assertEquals(AttackerType.REMOTE_SCRIPT_KIDDY, leaf.getAttackerType());
        assertEquals(AttackPotential.of(1, 0, 0, 1, 0), leaf.getAttackPotential(),
            "Профиль перезаписывает экспертизу, знания и оборудование");
    }

    @Test
    void testConfigurationsAndThreats() {
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseFromFile(VEHICLE_PROJECT);

        assertEquals(Set.of("cfg-base"), loader.getGraph().activeConfigurationIds());
        assertEquals(Set.of("cfg-bt"), loader.getGraph().node("L4").orElseThrow().getRequiredToeConfigurationIds());

        List<Threat> threats = loader.getThreats();
        assertEquals(2, threats.size());
        assertEquals("ROOT1", threats.get(0).getRootId());
        assertEquals(Impact.SEVERE, threats.get(0).getImpact(), "Ущерб по отображаемому имени");
        assertEquals(Impact.MAJOR, threats.get(1).getImpact(), "Ущерб по имени константы");
    }

    @Test
    void testParseYamlProject() {
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseFromFile(HIGH_THREAT_PROJECT);

        assertEquals("Телематический блок", loader.getProjectName());
        assertEquals(3, loader.getGraph().size());
        assertEquals(LogicGate.OR, loader.getGraph().node("ATK").orElseThrow().getGate());
    }

    @Test
    void testLeafWithLinksRejected() {
        AttackTreeLoader loader = new AttackTreeLoader();

        AttackTreeLoadException e = assertThrows(AttackTreeLoadException.class,
            () -> loader.parseFromFile("src/test/resources/projects/leaf-with-links.yaml"));
        assertTrue(e.getMessage().contains("BROKEN"), "Сообщение должно называть узел");
    }

    @Test
    void testParseInvalidFile() {
        AttackTreeLoader loader = new AttackTreeLoader();

        assertThrows(IllegalArgumentException.class, () -> loader.parseFromFile("nonexistent.yaml"),
            "Должна быть ошибка при несуществующем файле");
    }

    @Test
    void testParseContent() {
        String json = """
            {"name": "inline",
             "needs": [
               {"id": "R", "tags": ["attack-root"], "links": ["L"]},
               {"id": "L", "attackPotential": {"time": 1}}
             ],
             "threats": [{"id": "R", "name": "Угроза"}]}
            """;
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parseContent(json, "request");

        AttackNode root = loader.getGraph().node("R").orElseThrow();
        assertNull(root.getGate(), "Корень может быть без шлюза");
        assertEquals(AttackPotential.of(1, 0, 0, 0, 0), loader.getGraph().node("L").orElseThrow().getAttackPotential());
        assertEquals("R", loader.getThreats().get(0).getRootId(), "Без rootId корнем считается id угрозы");
        assertEquals(Impact.NEGLIGIBLE, loader.getThreats().get(0).getImpact());
    }

    @Test
    void testMalformedContent() {
        AttackTreeLoader loader = new AttackTreeLoader();

        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent("{\"needs\": [", "request"));
        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent("  ", "request"));
        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent(
            "{\"needs\": [{\"id\": \"G\", \"logic_gate\": \"XOR\", \"links\": [\"L\"]}]}", "request"));
        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent(
            "{\"needs\": [{\"id\": \"L\", \"attackPotential\": {\"time\": -1}}]}", "request"),
            "Отрицательный потенциал недопустим");
        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent(
            "{\"needs\": [{\"id\": \"A\"}, {\"id\": \"A\"}]}", "request"));
    }

    @Test
    void testParseStream() {
        String yaml = """
            needs:
              - id: R
                tags: [technical-root]
                logic_gate: AND
                links: [L]
              - id: L
                attackerType: EXPERT
            """;
        InputStream input = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
        AttackTreeLoader loader = new AttackTreeLoader();
        loader.parse(input, "inline.yaml");

        assertEquals("inline.yaml", loader.getProjectName(), "Без имени проекта используется источник");
        assertEquals(AttackPotential.of(0, 6, 3, 0, 4), loader.getGraph().node("L").orElseThrow().getAttackPotential());
    }

    @Test
    void testParseAttackerType() {
        assertEquals(AttackerType.ADVANCED, AttackTreeLoader.parseAttackerType("Advanced Attacker"));
        assertEquals(AttackerType.PRO_WORKSHOP, AttackTreeLoader.parseAttackerType("pro_workshop"));
        assertEquals(AttackerType.NONE, AttackTreeLoader.parseAttackerType("None"));
        assertNull(AttackTreeLoader.parseAttackerType(null));
        assertThrows(IllegalArgumentException.class, () -> AttackTreeLoader.parseAttackerType("Hacker"));
    }

    @Test
    void testNullSectionsTreatedAsEmpty() {
        AttackTreeLoader loader = new AttackTreeLoader();

        loader.parseContent("{\"name\": \"Пусто\", \"needs\": null, \"toeConfigurations\": null, \"threats\": null}",
            "request");

        assertEquals(0, loader.getGraph().size());
        assertTrue(loader.getThreats().isEmpty());
        assertEquals("Пусто", loader.getProjectName());
    }

    @Test
    void testNullRecordRejected() {
        AttackTreeLoader loader = new AttackTreeLoader();

        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent("{\"needs\": [null]}", "request"));
        assertThrows(AttackTreeLoadException.class, () -> loader.parseContent("{\"threats\": [null]}", "request"));
    }
}
