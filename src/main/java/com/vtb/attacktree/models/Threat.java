package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Value;

/**
 * Угроза, оцениваемая деревом атак с корнем {@code rootId}
 */
@Value
@Builder
public class Threat {
    String id;
    String name;
    String rootId;
    @Builder.Default
    Impact impact = Impact.NEGLIGIBLE;
}
