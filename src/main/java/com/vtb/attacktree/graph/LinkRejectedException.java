package com.vtb.attacktree.graph;

import lombok.Getter;

/**
 * Мутация графа отклонена валидатором; мутация не должна применяться
 */
@Getter
public class LinkRejectedException extends RuntimeException {

    private final LinkRejectionReason reason;
    private final String sourceId;
    private final String targetId;

    public LinkRejectedException(LinkRejectionReason reason, String sourceId, String targetId) {
        super(String.format("%s: %s -> %s", reason.getDescription(), sourceId, targetId));
        this.reason = reason;
        this.sourceId = sourceId;
        this.targetId = targetId;
    }
}
