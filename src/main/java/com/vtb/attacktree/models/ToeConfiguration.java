package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Value;

/**
 * Конфигурация объекта оценки (вариант исполнения, версия и т.п.).
 * Узлы, требующие неактивную конфигурацию, исключаются из расчёта.
 */
@Value
@Builder(toBuilder = true)
public class ToeConfiguration {
    String id;
    String name;
    String description;
    boolean active;
}
