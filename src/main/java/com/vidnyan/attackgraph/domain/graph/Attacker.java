package com.vidnyan.attackgraph.domain.graph;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An attacker placed on an attack graph.
 *
 * Reached steps are the ones the attacker has actively compromised; they
 * always include the entry points. Reachable steps are derived by
 * {@link ReachabilityCalculator}.
 */
@Slf4j
public class Attacker {

    @Getter
    private Long id;
    @Getter
    private final String name;

    private final Set<AttackStepNode> entryPoints = new LinkedHashSet<>();
    private final Set<AttackStepNode> reachedAttackSteps = new LinkedHashSet<>();
    private final Set<AttackStepNode> reachableAttackSteps = new LinkedHashSet<>();

    public Attacker(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Set<AttackStepNode> getEntryPoints() {
        return Collections.unmodifiableSet(entryPoints);
    }

    public Set<AttackStepNode> getReachedAttackSteps() {
        return Collections.unmodifiableSet(reachedAttackSteps);
    }

    public Set<AttackStepNode> getReachableAttackSteps() {
        return Collections.unmodifiableSet(reachableAttackSteps);
    }

    /**
     * Have this attacker compromise a node. No-op if already compromised.
     */
    public void compromise(AttackStepNode node) {
        log.debug("Attacker '{}' is compromising node '{}'", name, node.getFullName());
        if (!node.registerCompromise(this)) {
            log.debug("Attacker '{}' had already compromised node '{}', nothing to do",
                    name, node.getFullName());
            return;
        }
        reachedAttackSteps.add(node);
    }

    /**
     * Remove this attacker from the node's compromisers. No-op if it never compromised it.
     */
    public void undoCompromise(AttackStepNode node) {
        log.debug("Attacker '{}' is being removed from the compromisers of node '{}'",
                name, node.getFullName());
        if (!node.unregisterCompromise(this)) {
            log.debug("Attacker '{}' had not compromised node '{}', nothing to do",
                    name, node.getFullName());
            return;
        }
        reachedAttackSteps.remove(node);
        entryPoints.remove(node);
    }

    /**
     * Mark a node as an entry point. Entry points are always reached.
     */
    public void addEntryPoint(AttackStepNode node) {
        compromise(node);
        entryPoints.add(node);
    }

    /**
     * The attacker's starting set becomes exactly what it has compromised so far.
     */
    public void resetEntryPointsToReached() {
        entryPoints.clear();
        entryPoints.addAll(reachedAttackSteps);
    }

    /**
     * Undo every compromise of this attacker.
     */
    public void undoAllCompromises() {
        for (AttackStepNode node : Set.copyOf(reachedAttackSteps)) {
            undoCompromise(node);
        }
    }

    void assignId(long id) {
        this.id = id;
    }

    void markReachable(Collection<AttackStepNode> nodes) {
        reachableAttackSteps.addAll(nodes);
    }

    void clearReachable() {
        reachableAttackSteps.clear();
    }

    void forgetNode(AttackStepNode node) {
        entryPoints.remove(node);
        reachedAttackSteps.remove(node);
        reachableAttackSteps.remove(node);
    }

    @Override
    public String toString() {
        return "Attacker(" + id + ", " + name + ", reached=" + reachedAttackSteps.size() + ")";
    }
}
