package com.vtb.attacktree.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Потенциал атаки (ISO/SAE 21434): время, экспертиза, знание объекта,
 * окно доступа и оборудование. Каждое поле - неотрицательный балл.
 */
@Value
public class AttackPotential {

    public static final AttackPotential ZERO = new AttackPotential(0, 0, 0, 0, 0);

    int time;
    int expertise;
    int knowledge;
    int access;
    int equipment;

    @Builder(toBuilder = true)
    @JsonCreator
    public AttackPotential(@JsonProperty("time") int time,
                           @JsonProperty("expertise") int expertise,
                           @JsonProperty("knowledge") int knowledge,
                           @JsonProperty("access") int access,
                           @JsonProperty("equipment") int equipment) {
        requireNonNegative("time", time);
        requireNonNegative("expertise", expertise);
        requireNonNegative("knowledge", knowledge);
        requireNonNegative("access", access);
        requireNonNegative("equipment", equipment);
        this.time = time;
        this.expertise = expertise;
        this.knowledge = knowledge;
        this.access = access;
        this.equipment = equipment;
    }

    public static AttackPotential of(int time, int expertise, int knowledge, int access, int equipment) {
        return new AttackPotential(time, expertise, knowledge, access, equipment);
    }

    /**
     * Покомпонентный максимум (AND: атакующий платит худшую цену по каждому полю)
     */
    public AttackPotential max(AttackPotential other) {
        return new AttackPotential(
            Math.max(time, other.time),
            Math.max(expertise, other.expertise),
            Math.max(knowledge, other.knowledge),
            Math.max(access, other.access),
            Math.max(equipment, other.equipment));
    }

    /**
     * Покомпонентный минимум (OR). Результат может не совпадать ни с одним из исходных кортежей.
     */
    public AttackPotential min(AttackPotential other) {
        return new AttackPotential(
            Math.min(time, other.time),
            Math.min(expertise, other.expertise),
            Math.min(knowledge, other.knowledge),
            Math.min(access, other.access),
            Math.min(equipment, other.equipment));
    }

    /**
     * Сумма полей; при переполнении int ограничивается Integer.MAX_VALUE
     */
    public int sum() {
        long total = (long) time + expertise + knowledge + access + equipment;
        return (int) Math.min(total, Integer.MAX_VALUE);
    }

    /**
     * Есть ли поле, равное маркеру "невыполнимо" (обычно 99)
     */
    public boolean hasFieldEqualTo(int marker) {
        return time == marker
            || expertise == marker
            || knowledge == marker
            || access == marker
            || equipment == marker;
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(
                "Поле потенциала атаки '" + field + "' не может быть отрицательным: " + value);
        }
    }
}
