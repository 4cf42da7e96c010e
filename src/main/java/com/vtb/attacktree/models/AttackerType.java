package com.vtb.attacktree.models;

/**
 * Типовые профили атакующего.
 * Профиль перезаписывает только заданные поля потенциала листа, остальные сохраняются.
 */
public enum AttackerType {
    NONE("Не задан", null, null, null),
    EXPERT("Expert Attacker", 6, 3, 4),
    ADVANCED("Advanced Attacker", 6, 0, 4),
    PRO_WORKSHOP("Professional Workshop", 3, 3, 4),
    LOCAL_LAYMAN("Local Layman", 0, 0, 4),
    REMOTE_SCRIPT_KIDDY("Remote Script Kiddy", 0, 0, 0);

    private final String displayName;
    private final Integer expertise;
    private final Integer knowledge;
    private final Integer equipment;

    AttackerType(String displayName, Integer expertise, Integer knowledge, Integer equipment) {
        this.displayName = displayName;
        this.expertise = expertise;
        this.knowledge = knowledge;
        this.equipment = equipment;
    }

    public String getDisplayName() {
        return displayName;
    }

    public AttackPotential applyTo(AttackPotential potential) {
        AttackPotential base = potential != null ? potential : AttackPotential.ZERO;
        return base.toBuilder()
            .expertise(expertise != null ? expertise : base.getExpertise())
            .knowledge(knowledge != null ? knowledge : base.getKnowledge())
            .equipment(equipment != null ? equipment : base.getEquipment())
            .build();
    }
}
