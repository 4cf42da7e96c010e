package com.vtb.attacktree.core;

/**
 * Документ проекта не удалось прочитать или он некорректен
 */
public class AttackTreeLoadException extends RuntimeException {

    public AttackTreeLoadException(String message) {
        super(message);
    }

    public AttackTreeLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
