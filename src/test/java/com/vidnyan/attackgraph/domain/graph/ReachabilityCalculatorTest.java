package com.vidnyan.attackgraph.domain.graph;

import com.vidnyan.attackgraph.domain.language.AttackStepType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityCalculatorTest {

    private final ReachabilityCalculator calculator = new ReachabilityCalculator();

    private AttackGraph graph;
    private AttackStepNode n1;
    private AttackStepNode n2;
    private AttackStepNode n3;
    private AttackStepNode n4;

    // n1 -> n4, n2 -> n3 -> n4, n4 is an AND step with parents {n1, n3}
    @BeforeEach
    void setUp() {
        graph = new AttackGraph();
        n1 = graph.addNode(new AttackStepNode(AttackStepType.OR, "n1"));
        n2 = graph.addNode(new AttackStepNode(AttackStepType.OR, "n2"));
        n3 = graph.addNode(new AttackStepNode(AttackStepType.OR, "n3"));
        n4 = graph.addNode(new AttackStepNode(AttackStepType.AND, "n4"));
        graph.addEdge(n1, n4);
        graph.addEdge(n2, n3);
        graph.addEdge(n3, n4);
    }

    @Test
    void andStep_ShouldNeedEveryParent() {
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(n1.getId()), List.of());

        calculator.calculate(graph);

        assertEquals(Set.of(n1), attacker.getReachableAttackSteps());
        assertFalse(n4.isReachableBy(attacker));
    }

    @Test
    void andStep_ShouldConvergeThroughLongerBranch() {
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(n1.getId(), n2.getId()), List.of());

        calculator.calculate(graph);

        assertEquals(Set.of(n1, n2, n3, n4), attacker.getReachableAttackSteps());
        assertTrue(n3.isReachableBy(attacker));
        assertTrue(n4.isReachableBy(attacker));
    }

    @Test
    void nonViableStep_ShouldNeverBeReached() {
        n4.setViable(false);
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(n1.getId(), n2.getId()), List.of());

        calculator.calculate(graph);

        assertTrue(n3.isReachableBy(attacker));
        assertFalse(n4.isReachableBy(attacker));
        assertFalse(attacker.getReachableAttackSteps().contains(n4));
    }

    @Test
    void nonViableCompromisedStep_ShouldNotBeReachable() {
        n1.setViable(false);
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(n1.getId()), List.of());

        calculator.calculate(graph);

        assertTrue(n1.isCompromisedBy(attacker));
        assertTrue(attacker.getReachableAttackSteps().isEmpty());
    }

    @Test
    void recompute_ShouldReflectClearedCompromises() {
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(n1.getId(), n2.getId()), List.of());
        calculator.calculate(graph);
        assertFalse(attacker.getReachableAttackSteps().isEmpty());

        attacker.undoAllCompromises();
        calculator.calculate(graph);

        assertTrue(attacker.getReachableAttackSteps().isEmpty());
        for (AttackStepNode node : graph.getNodes()) {
            assertFalse(node.isReachableBy(attacker), node.getFullName());
        }
    }

    @Test
    void attackers_ShouldBeTrackedSeparately() {
        Attacker eve = graph.addAttacker(new Attacker("eve"), null, List.of(n2.getId()), List.of());
        Attacker mallory = graph.addAttacker(new Attacker("mallory"), null, List.of(n1.getId()), List.of());

        calculator.calculate(graph);

        assertEquals(Set.of(n2, n3), eve.getReachableAttackSteps());
        assertEquals(Set.of(n1), mallory.getReachableAttackSteps());
        assertEquals(Set.of(eve), n3.getReachableBy());
    }
}
