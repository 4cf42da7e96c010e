package com.vtb.attacktree.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Угроза. Если rootId не задан, корнем дерева считается узел с тем же id
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreatRecord {
    private String id;
    private String name;
    private String rootId;
    private String impact;
}
