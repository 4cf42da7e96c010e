package com.vtb.attacktree.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * REST API движка деревьев атак
 *
 * Запуск:
 * java -jar attack-tree-engine.jar --web
 */
@SpringBootApplication
public class AttackTreeWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttackTreeWebApplication.class, args);
    }
}
