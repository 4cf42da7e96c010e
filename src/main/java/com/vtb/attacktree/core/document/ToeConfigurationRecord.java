package com.vtb.attacktree.core.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToeConfigurationRecord {
    private String id;
    private String name;
    private String description;
    private Boolean active;
}
