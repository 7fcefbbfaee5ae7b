package com.vidnyan.attackgraph.domain.model;

import java.util.List;

/**
 * Attacker declared in an instance model, with the attack steps it starts from.
 */
public record AttackerDefinition(
    long id,
    String name,
    List<EntryPoint> entryPoints
) {

    public AttackerDefinition {
        entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
    }

    /**
     * Attack steps of one asset the attacker is assumed to hold.
     */
    public record EntryPoint(Asset asset, List<String> attackSteps) {

        public EntryPoint {
            attackSteps = attackSteps == null ? List.of() : List.copyOf(attackSteps);
        }

        public List<String> fullNames() {
            return attackSteps.stream()
                    .map(step -> asset.name() + ":" + step)
                    .toList();
        }
    }
}
