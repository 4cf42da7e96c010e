package com.vtb.attacktree.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vtb.attacktree.models.AttackPotential;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Плоская запись узла: роль корня закодирована тегом, шлюз - необязательным полем logic_gate
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NeedRecord {
    private String id;
    private String type;
    private String title;
    @JsonProperty("logic_gate")
    private String logicGate;
    private AttackPotential attackPotential;
    private String attackerType;
    private List<String> links = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private List<String> toeConfigurationIds = new ArrayList<>();
}
