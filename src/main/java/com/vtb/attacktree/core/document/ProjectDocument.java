package com.vtb.attacktree.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Сохранённый проект в формате хост-приложения (JSON/YAML).
 * Читаются только поля, нужные движку; остальное игнорируется.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectDocument {
    private String name;
    private List<NeedRecord> needs = new ArrayList<>();
    private List<ToeConfigurationRecord> toeConfigurations = new ArrayList<>();
    private List<ThreatRecord> threats = new ArrayList<>();
}
