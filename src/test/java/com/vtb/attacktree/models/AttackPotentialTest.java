package com.vtb.attacktree.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для AttackPotential
 */
class AttackPotentialTest {

    @Test
    void testMaxIsFieldWise() {
        AttackPotential a = AttackPotential.of(1, 6, 0, 4, 2);
        AttackPotential b = AttackPotential.of(3, 2, 5, 1, 2);

        assertEquals(AttackPotential.of(3, 6, 5, 4, 2), a.max(b), "AND берёт худшее значение по каждому полю");
    }

    @Test
    void testMinMayProduceNewTuple() {
        AttackPotential a = AttackPotential.of(10, 0, 0, 0, 0);
        AttackPotential b = AttackPotential.of(0, 10, 0, 0, 0);

        AttackPotential min = a.min(b);
        assertEquals(AttackPotential.ZERO, min);
        assertNotEquals(a, min, "Минимум не обязан совпадать с исходными кортежами");
        assertNotEquals(b, min);
    }

    @Test
    void testSumAndMarker() {
        AttackPotential potential = AttackPotential.of(1, 2, 3, 4, 99);

        assertEquals(109, potential.sum());
        assertTrue(potential.hasFieldEqualTo(99));
        assertFalse(AttackPotential.of(1, 2, 3, 4, 5).hasFieldEqualTo(99));
    }

    @Test
    void testNegativeFieldRejected() {
        assertThrows(IllegalArgumentException.class, () -> AttackPotential.of(0, -1, 0, 0, 0),
            "Отрицательный балл недопустим");
    }

    @Test
    void testToBuilderKeepsOtherFields() {
        AttackPotential potential = AttackPotential.of(1, 2, 3, 4, 5).toBuilder().knowledge(7).build();

        assertEquals(AttackPotential.of(1, 2, 7, 4, 5), potential);
    }

    @Test
    void testSumDoesNotOverflow() {
        AttackPotential huge = AttackPotential.of(Integer.MAX_VALUE, Integer.MAX_VALUE, 0, 0, 0);

        assertEquals(Integer.MAX_VALUE, huge.sum(), "Сумма ограничивается сверху, а не переполняется");
    }
}
