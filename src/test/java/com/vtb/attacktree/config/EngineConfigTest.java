package com.vtb.attacktree.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты загрузки engine-config.yaml
 */
class EngineConfigTest {

    @Test
    void testLoadFromClasspath() {
        EngineConfig config = EngineConfig.load();

        assertNotNull(config.getFeasibility());
        assertEquals(13, config.getFeasibility().getHighMax());
        assertEquals(19, config.getFeasibility().getMediumMax());
        assertEquals(24, config.getFeasibility().getLowMax());
        assertEquals(99, config.getFeasibility().getInfeasibleValue());
        assertEquals(512, config.getEvaluation().getMaxDepth());
        assertEquals(10_000, config.getEvaluation().getMaxCriticalPaths());
        assertTrue(config.getEvaluation().isCacheEnabled());
        assertSame(config, EngineConfig.load(), "Конфигурация загружается один раз");
    }

    @Test
    void testPartialFileFilledWithDefaults() {
        EngineConfig config = EngineConfig.loadResource("engine-config-partial.yaml");

        assertEquals(10, config.getFeasibility().getHighMax());
        assertEquals(19, config.getFeasibility().getMediumMax(), "Отсутствующее значение берётся по умолчанию");
        assertEquals(64, config.getEvaluation().getMaxDepth());
        assertFalse(config.getEvaluation().isCacheEnabled());
        assertEquals(10_000, config.getEvaluation().getMaxCriticalPaths());
    }

    @Test
    void testMissingResource() {
        assertThrows(IllegalStateException.class, () -> EngineConfig.loadResource("no-such-config.yaml"));
    }

    @Test
    void testInconsistentThresholdsRepaired() {
        EngineConfig.Feasibility feasibility = new EngineConfig.Feasibility();
        feasibility.setHighMax(30);
        feasibility.setMediumMax(20);

        feasibility.ensureDefaults();

        assertTrue(feasibility.getMediumMax() >= feasibility.getHighMax());
        assertTrue(feasibility.getLowMax() >= feasibility.getMediumMax());
    }

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(512, config.getEvaluation().getMaxDepth());
        assertEquals(99, config.getFeasibility().getInfeasibleValue());
    }
}
