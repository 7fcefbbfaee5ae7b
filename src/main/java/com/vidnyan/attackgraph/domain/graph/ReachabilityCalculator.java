package com.vidnyan.attackgraph.domain.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Computes which attack steps each attacker can reach from what it has compromised.
 *
 * Recomputed from scratch on every call. Propagation rules:
 * - a non-viable node is never reachable, even when compromised;
 * - OR-like steps (or, defense, exist, notExist) need any reachable parent;
 * - AND steps need every parent reachable.
 *
 * Worklist formulation: a node is expanded once, when it becomes reachable,
 * and an AND step is re-checked each time another of its parents converges.
 * The result is the least fixed point of the rules above.
 */
@Slf4j
public class ReachabilityCalculator {

    /**
     * Recompute {@code reachableBy} on every node and {@code reachableAttackSteps}
     * on every attacker of the graph.
     */
    public void calculate(AttackGraph graph) {
        for (AttackStepNode node : graph.getNodes()) {
            node.clearReachableBy();
        }

        for (Attacker attacker : graph.getAttackers()) {
            attacker.clearReachable();
            Set<AttackStepNode> reachable = reachableFrom(attacker.getReachedAttackSteps());
            for (AttackStepNode node : reachable) {
                node.markReachableBy(attacker);
            }
            attacker.markReachable(reachable);
            log.debug("Attacker '{}' can reach {} attack steps from {} compromised ones",
                    attacker.getName(), reachable.size(), attacker.getReachedAttackSteps().size());
        }
    }

    /**
     * Attack steps reachable from the given compromised steps.
     * Compromised viable steps are part of the result as they are already attained.
     */
    Set<AttackStepNode> reachableFrom(Collection<AttackStepNode> compromised) {
        Set<AttackStepNode> reached = new LinkedHashSet<>();
        Map<AttackStepNode, Integer> reachedParentCount = new HashMap<>();
        Deque<AttackStepNode> queue = new ArrayDeque<>();

        for (AttackStepNode seed : compromised) {
            if (seed.isViable() && reached.add(seed)) {
                queue.add(seed);
            }
        }

        while (!queue.isEmpty()) {
            AttackStepNode node = queue.poll();
            for (AttackStepNode child : node.getChildren()) {
                if (reached.contains(child) || !child.isViable()) {
                    continue;
                }
                if (child.getType().requiresAllParents()) {
                    int count = reachedParentCount.merge(child, 1, Integer::sum);
                    if (count < child.getParents().size()) {
                        continue;
                    }
                }
                reached.add(child);
                queue.add(child);
            }
        }
        return reached;
    }
}
