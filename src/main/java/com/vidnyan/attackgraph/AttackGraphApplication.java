package com.vidnyan.attackgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Attack graph engine.
 *
 * Generates attack graphs from a compiled threat modeling language and an
 * instance model, and computes what attackers can reach.
 */
@SpringBootApplication
public class AttackGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttackGraphApplication.class, args);
    }
}
