package com.vtb.attacktree.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttackerTypeTest {

    @Test
    void testPresetOverridesOnlyItsFields() {
        AttackPotential original = AttackPotential.of(7, 1, 1, 9, 1);

        AttackPotential expert = AttackerType.EXPERT.applyTo(original);

        assertEquals(7, expert.getTime(), "Время профилем не задаётся");
        assertEquals(9, expert.getAccess(), "Окно доступа профилем не задаётся");
        assertEquals(6, expert.getExpertise());
        assertEquals(3, expert.getKnowledge());
        assertEquals(4, expert.getEquipment());
    }

    @Test
    void testNoneKeepsPotential() {
        AttackPotential original = AttackPotential.of(1, 2, 3, 4, 5);

        assertEquals(original, AttackerType.NONE.applyTo(original));
    }

    @Test
    void testScriptKiddyOnMissingPotential() {
        assertEquals(AttackPotential.ZERO, AttackerType.REMOTE_SCRIPT_KIDDY.applyTo(null));
    }
}
