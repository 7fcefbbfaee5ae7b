package com.vidnyan.attackgraph.domain.graph;

import com.vidnyan.attackgraph.adapter.out.model.InMemoryInstanceModel;
import com.vidnyan.attackgraph.domain.language.AttackStepType;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.AttackerDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AttackGraphTest {

    private final Asset server = new Asset(0, "Server", "Application");
    private AttackGraph graph;

    @BeforeEach
    void setUp() {
        graph = new AttackGraph();
    }

    private AttackStepNode node(String name) {
        return graph.addNode(new AttackStepNode(AttackStepType.OR, name, server));
    }

    @Test
    void addNode_ShouldAssignSequentialIdsAndIndex() {
        AttackStepNode first = node("attemptAccess");
        AttackStepNode second = node("fullAccess");

        assertEquals(0L, first.getId());
        assertEquals(1L, second.getId());
        assertSame(second, graph.getNodeById(1).orElseThrow());
        assertSame(first, graph.getNodeByFullName("Server:attemptAccess").orElseThrow());
    }

    @Test
    void addNode_WithExplicitId_ShouldAdvanceCounter() {
        graph.addNode(new AttackStepNode(AttackStepType.OR, "a", server), 10L);
        AttackStepNode next = node("b");

        assertEquals(11L, next.getId());
    }

    @Test
    void addNode_ShouldRejectReusedIdOrFullName() {
        node("attemptAccess");

        assertThrows(IllegalArgumentException.class,
                () -> graph.addNode(new AttackStepNode(AttackStepType.OR, "other", server), 0L));
        assertThrows(IllegalArgumentException.class,
                () -> graph.addNode(new AttackStepNode(AttackStepType.AND, "attemptAccess", server)));
        assertEquals(1, graph.getNodes().size());
    }

    @Test
    void addNode_ShouldRejectNodeOwnedByAnotherGraph() {
        AttackStepNode owned = node("attemptAccess");
        AttackGraph other = new AttackGraph();

        assertThrows(IllegalArgumentException.class, () -> other.addNode(owned));
        assertEquals(0L, owned.getId());
        assertSame(owned, graph.getNodeById(0).orElseThrow());
        assertTrue(other.getNodes().isEmpty());
    }

    @Test
    void addNode_AfterRemoval_ShouldAcceptNodeAgain() {
        AttackStepNode moved = node("attemptAccess");
        graph.removeNode(moved);
        AttackGraph other = new AttackGraph();

        other.addNode(moved, 5L);

        assertEquals(5L, moved.getId());
        assertSame(moved, other.getNodeByFullName("Server:attemptAccess").orElseThrow());
    }

    @Test
    void addNode_WithTakenFullName_ShouldLeaveNodeUnassigned() {
        node("attemptAccess");
        AttackStepNode duplicate = new AttackStepNode(AttackStepType.AND, "attemptAccess", server);

        assertThrows(IllegalArgumentException.class, () -> graph.addNode(duplicate));
        assertNull(duplicate.getId());
    }

    @Test
    void fullName_WithoutAsset_ShouldUseId() {
        AttackStepNode node = graph.addNode(new AttackStepNode(AttackStepType.OR, "loose"), 7L);

        assertEquals("7:loose", node.getFullName());
        assertTrue(graph.getNodeByFullName("7:loose").isPresent());
    }

    @Test
    void addEdge_ShouldKeepParentsAndChildrenSymmetric() {
        AttackStepNode a = node("a");
        AttackStepNode b = node("b");

        graph.addEdge(a, b);
        graph.addEdge(a, b);

        assertEquals(List.of(b), List.copyOf(a.getChildren()));
        assertEquals(List.of(a), List.copyOf(b.getParents()));
        assertEquals(1, graph.stats().edgeCount());
    }

    @Test
    void addEdge_ShouldRejectForeignNodes() {
        AttackStepNode a = node("a");
        AttackStepNode foreign = new AttackStepNode(AttackStepType.OR, "foreign", server);

        assertThrows(IllegalArgumentException.class, () -> graph.addEdge(a, foreign));
    }

    @Test
    void removeNode_ShouldDetachAndDeindex() {
        AttackStepNode a = node("a");
        AttackStepNode b = node("b");
        AttackStepNode c = node("c");
        graph.addEdge(a, b);
        graph.addEdge(b, c);
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(b.getId()), List.of());
        long removedId = b.getId();

        graph.removeNode(b);

        assertTrue(a.getChildren().isEmpty());
        assertTrue(c.getParents().isEmpty());
        assertTrue(graph.getNodeById(removedId).isEmpty());
        assertNull(b.getId());
        assertTrue(graph.getNodeByFullName("Server:b").isEmpty());
        assertFalse(attacker.getReachedAttackSteps().contains(b));
        assertEquals(2, graph.getNodes().size());
    }

    @Test
    void addAttacker_ShouldCompromiseReachedStepsAndEntryPoints() {
        AttackStepNode a = node("a");
        AttackStepNode b = node("b");

        Attacker attacker = graph.addAttacker(new Attacker("eve"), 5L, List.of(a.getId()), List.of(b.getId()));

        assertEquals(5L, attacker.getId());
        assertTrue(a.isCompromisedBy(attacker));
        assertTrue(b.isCompromisedBy(attacker));
        assertEquals(List.of(b), List.copyOf(attacker.getEntryPoints()));
        assertTrue(attacker.getReachedAttackSteps().containsAll(List.of(a, b)));
        assertSame(attacker, graph.getAttackerByName("eve").orElseThrow());
    }

    @Test
    void addAttacker_ShouldRejectReusedIdAndUnknownSteps() {
        graph.addAttacker(new Attacker("eve"));

        assertThrows(IllegalArgumentException.class,
                () -> graph.addAttacker(new Attacker("mallory"), 0L, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> graph.addAttacker(new Attacker("eve")));
        assertThrows(IllegalArgumentException.class,
                () -> graph.addAttacker(new Attacker("trudy"), null, List.of(42L), List.of()));
    }

    @Test
    void removeAttacker_ShouldUndoAllCompromises() {
        AttackStepNode a = node("a");
        Attacker attacker = graph.addAttacker(new Attacker("eve"), null, List.of(a.getId()), List.of());

        graph.removeAttacker(attacker);

        assertFalse(a.isCompromised());
        assertTrue(graph.getAttackers().isEmpty());
        assertTrue(graph.getAttackerById(attacker.getId()).isEmpty());
    }

    @Test
    void attachAttackers_ShouldSkipMissingEntryPoints() {
        AttackStepNode access = node("attemptAccess");
        InMemoryInstanceModel model = InMemoryInstanceModel.builder("model")
                .addAsset(server)
                .addAttacker(new AttackerDefinition(3, "eve", List.of(
                        new AttackerDefinition.EntryPoint(server, List.of("attemptAccess", "doesNotExist")))))
                .build();

        List<Attacker> attackers = graph.attachAttackers(model);

        assertEquals(1, attackers.size());
        Attacker eve = attackers.get(0);
        assertEquals(3L, eve.getId());
        assertEquals(List.of(access), List.copyOf(eve.getEntryPoints()));
        assertTrue(access.isCompromisedBy(eve));
    }

    @Test
    void queries_ShouldFilterByNameAndType() {
        Asset other = new Asset(1, "Other", "Application");
        node("attemptAccess");
        graph.addNode(new AttackStepNode(AttackStepType.OR, "attemptAccess", other));
        graph.addNode(new AttackStepNode(AttackStepType.DEFENSE, "disabled", other));

        assertEquals(2, graph.getNodesByName("attemptAccess").size());
        assertEquals(1, graph.getNodesByType(AttackStepType.DEFENSE).size());
    }

    @Test
    void defenseHelpers_ShouldHonourStatusAndSuppressTag() {
        AttackStepNode enabled = graph.addNode(new AttackStepNode(AttackStepType.DEFENSE, "enabled", server));
        enabled.setDefenseStatus(1.0);
        AttackStepNode available = graph.addNode(new AttackStepNode(AttackStepType.DEFENSE, "available", server));
        available.setDefenseStatus(0.3);
        AttackStepNode suppressed = graph.addNode(new AttackStepNode(AttackStepType.DEFENSE, "suppressed", server));
        suppressed.setDefenseStatus(1.0);
        suppressed.getTags().add("suppress");

        assertTrue(enabled.isEnabledDefense());
        assertFalse(enabled.isAvailableDefense());
        assertTrue(available.isAvailableDefense());
        assertFalse(suppressed.isEnabledDefense());
        assertFalse(suppressed.isAvailableDefense());
        assertFalse(node("plain").isEnabledDefense());
    }
}
