package com.vtb.attacktree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация движка из YAML файла (engine-config.yaml в classpath)
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    static final String RESOURCE_NAME = "engine-config.yaml";

    private Feasibility feasibility;
    private Evaluation evaluation;

    private static EngineConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized EngineConfig load() {
        if (instance == null) {
            instance = loadResource(RESOURCE_NAME);
        }
        return instance;
    }

    /**
     * Конфигурация со значениями по умолчанию, без чтения файла (для тестов и встраивания)
     */
    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.ensureDefaults();
        return config;
    }

    static EngineConfig loadResource(String resourceName) {
        InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourceName);
        if (is == null) {
            throw new IllegalStateException(resourceName + " не найден в classpath");
        }
        try (is) {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            EngineConfig config = mapper.readValue(is, EngineConfig.class);
            config.ensureDefaults();
            log.debug("Конфигурация движка загружена: {}", config);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    void ensureDefaults() {
        if (feasibility == null) {
            feasibility = new Feasibility();
        }
        feasibility.ensureDefaults();
        if (evaluation == null) {
            evaluation = new Evaluation();
        }
        evaluation.ensureDefaults();
    }

    /**
     * Пороги перевода суммарного потенциала атаки в рейтинг осуществимости
     */
    @Data
    public static class Feasibility {
        private static final int DEFAULT_HIGH_MAX = 13;
        private static final int DEFAULT_MEDIUM_MAX = 19;
        private static final int DEFAULT_LOW_MAX = 24;
        private static final int DEFAULT_INFEASIBLE_VALUE = 99;

        private Integer highMax;
        private Integer mediumMax;
        private Integer lowMax;
        private Integer infeasibleValue;

        public void ensureDefaults() {
            if (highMax == null || highMax < 0) {
                highMax = DEFAULT_HIGH_MAX;
            }
            if (mediumMax == null || mediumMax < highMax) {
                mediumMax = Math.max(DEFAULT_MEDIUM_MAX, highMax);
            }
            if (lowMax == null || lowMax < mediumMax) {
                lowMax = Math.max(DEFAULT_LOW_MAX, mediumMax);
            }
            if (infeasibleValue == null || infeasibleValue <= 0) {
                infeasibleValue = DEFAULT_INFEASIBLE_VALUE;
            }
        }
    }

    /**
     * Ограничения вычисления для больших и враждебных графов
     */
    @Data
    public static class Evaluation {
        private static final int DEFAULT_MAX_DEPTH = 512;
        private static final int DEFAULT_MAX_CRITICAL_PATHS = 10_000;

        private Integer maxDepth;
        private Integer maxCriticalPaths;
        private Boolean cacheEnabled;

        public void ensureDefaults() {
            if (maxDepth == null || maxDepth <= 0) {
                maxDepth = DEFAULT_MAX_DEPTH;
            }
            if (maxCriticalPaths == null || maxCriticalPaths <= 0) {
                maxCriticalPaths = DEFAULT_MAX_CRITICAL_PATHS;
            }
            if (cacheEnabled == null) {
                cacheEnabled = Boolean.TRUE;
            }
        }

        public boolean isCacheEnabled() {
            return Boolean.TRUE.equals(cacheEnabled);
        }
    }
}
