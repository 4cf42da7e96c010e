package com.vtb.attacktree.models;

import java.util.Locale;

/**
 * Логика объединения дочерних шагов атаки
 */
public enum LogicGate {
    AND,
    OR;

    /**
     * Разобрать значение из документа проекта ("AND", "or", ...). null и пустая строка - нет шлюза.
     */
    public static LogicGate fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Неизвестный логический шлюз: " + value, e);
        }
    }
}
