package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Value;

/**
 * Решение валидатора о допустимости связи source -> target.
 * {@code requiredGate} - шлюз, который вызывающая сторона должна установить у source
 * (null - оставить как есть).
 */
@Value
@Builder
public class LinkDecision {
    String sourceId;
    String targetId;
    LogicGate requiredGate;
    boolean gateChanged;
}
