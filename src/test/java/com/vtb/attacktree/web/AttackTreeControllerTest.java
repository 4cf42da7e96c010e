package com.vtb.attacktree.web;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AttackTreeController.class)
class AttackTreeControllerTest {

    private static String vehicleProject;
    private static String highThreatProject;

    @Autowired
    private MockMvc mockMvc;

    @BeforeAll
    static void loadProjects() throws Exception {
        vehicleProject = Files.readString(Path.of("src/test/resources/projects/vehicle-project.json"));
        highThreatProject = Files.readString(Path.of("src/test/resources/projects/high-threat.yaml"));
    }

    @Test
    void testEvaluateProject() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate").contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.projectName").value("Шлюз кузовной электроники"))
            .andExpect(jsonPath("$.trees", hasSize(4)))
            .andExpect(jsonPath("$.trees[0].initial.potentialScore").value(12))
            .andExpect(jsonPath("$.threats[0].initialRisk").value("CRITICAL"));
    }

    @Test
    void testEvaluateSingleRootYaml() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate").param("rootId", "ATK").param("residual", "true")
                .contentType(MediaType.TEXT_PLAIN).content(highThreatProject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hasAttackPath").value(true))
            .andExpect(jsonPath("$.metrics.potentialScore").value(4))
            .andExpect(jsonPath("$.feasibility").value("HIGH"));
    }

    @Test
    void testEvaluateCircumventRootInitial() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate").param("rootId", "CR1")
                .contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hasAttackPath").value(false));
    }

    @Test
    void testEvaluateBadRequests() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate").param("rootId", "NOPE")
                .contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());

        mockMvc.perform(post("/api/v1/evaluate").contentType(MediaType.APPLICATION_JSON).content("{\"needs\": ["))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testValidateLinkAccepted() throws Exception {
        mockMvc.perform(post("/api/v1/links/validate").param("source", "ROOT2").param("target", "L1")
                .contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.requiredGate").value("AND"))
            .andExpect(jsonPath("$.gateChanged").value(false));
    }

    @Test
    void testValidateLinkRejected() throws Exception {
        mockMvc.perform(post("/api/v1/links/validate").param("source", "G1").param("target", "CR1")
                .contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("ILLEGAL_CIRCUMVENT_ATTACHMENT"))
            .andExpect(jsonPath("$.source").value("G1"));

        mockMvc.perform(post("/api/v1/links/validate").param("source", "L3").param("target", "ROOT1")
                .contentType(MediaType.APPLICATION_JSON).content(vehicleProject))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.reason").value("LEAF_CANNOT_HAVE_CHILDREN"));
    }

    @Test
    void testValidateLinkMalformedDocument() throws Exception {
        mockMvc.perform(post("/api/v1/links/validate").param("source", "A").param("target", "B")
                .contentType(MediaType.TEXT_PLAIN).content("   "))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void testEvaluateNullSections() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate").contentType(MediaType.APPLICATION_JSON)
                .content("{\"needs\": null, \"threats\": null}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trees", hasSize(0)));

        mockMvc.perform(post("/api/v1/evaluate").contentType(MediaType.APPLICATION_JSON)
                .content("{\"needs\": [null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").exists());
    }
}
