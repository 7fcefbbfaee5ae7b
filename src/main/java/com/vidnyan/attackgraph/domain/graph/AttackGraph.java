package com.vidnyan.attackgraph.domain.graph;

import com.vidnyan.attackgraph.domain.language.AttackStepType;
import com.vidnyan.attackgraph.domain.model.AttackerDefinition;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Graph of attack step nodes and the attackers placed on it.
 *
 * The graph is the only owner of its nodes. Nodes are indexed by id and by
 * full name, attackers by id and by name. Edges are kept symmetric:
 * {@code b ∈ a.children ⇔ a ∈ b.parents}.
 *
 * Not thread-safe: a single writer is expected.
 */
@Slf4j
public final class AttackGraph {

    private final List<AttackStepNode> nodes = new ArrayList<>();
    private final Map<Long, AttackStepNode> nodesById = new HashMap<>();
    private final Map<String, AttackStepNode> nodesByFullName = new HashMap<>();

    private final List<Attacker> attackers = new ArrayList<>();
    private final Map<Long, Attacker> attackersById = new HashMap<>();
    private final Map<String, Attacker> attackersByName = new HashMap<>();

    private long nextNodeId = 0;
    private long nextAttackerId = 0;

    /**
     * Add a node with the next free id.
     */
    public AttackStepNode addNode(AttackStepNode node) {
        return addNode(node, null);
    }

    /**
     * Add a node. A null id takes the next free one.
     * @throws IllegalArgumentException if the node already belongs to a graph,
     *         or the id or the full name is already taken
     */
    public AttackStepNode addNode(AttackStepNode node, Long id) {
        if (node.getId() != null) {
            throw new IllegalArgumentException("Node " + node.getFullName() + " already belongs to a graph");
        }
        long nodeId = id != null ? id : nextNodeId;
        if (nodesById.containsKey(nodeId)) {
            throw new IllegalArgumentException(String.format(
                    "Node index %d already in use by %s, cannot add %s",
                    nodeId, nodesById.get(nodeId).getFullName(), node.getName()));
        }

        node.assignId(nodeId);
        String fullName = node.getFullName();
        if (nodesByFullName.containsKey(fullName)) {
            node.assignId(null);
            throw new IllegalArgumentException("Node full name already in use: " + fullName);
        }

        log.debug("Adding node {} with id {}", fullName, nodeId);
        nodes.add(node);
        nodesById.put(nodeId, node);
        nodesByFullName.put(fullName, node);
        nextNodeId = Math.max(nodeId + 1, nextNodeId);
        return node;
    }

    /**
     * Remove a node, detaching it from its parents and children and from every attacker.
     * The node loses its id and may be added to a graph again.
     */
    public void removeNode(AttackStepNode node) {
        requireOwned(node);
        log.debug("Removing node {}", node.getFullName());

        for (AttackStepNode child : List.copyOf(node.getChildren())) {
            removeEdge(node, child);
        }
        for (AttackStepNode parent : List.copyOf(node.getParents())) {
            removeEdge(parent, node);
        }
        for (Attacker attacker : attackers) {
            attacker.forgetNode(node);
            node.forgetAttacker(attacker);
        }

        nodes.remove(node);
        nodesById.remove(node.getId());
        nodesByFullName.remove(node.getFullName());
        node.assignId(null);
    }

    /**
     * Link parent → child in both directions. Linking twice has no effect.
     */
    public void addEdge(AttackStepNode parent, AttackStepNode child) {
        requireOwned(parent);
        requireOwned(child);
        parent.linkChild(child);
        child.linkParent(parent);
    }

    public void removeEdge(AttackStepNode parent, AttackStepNode child) {
        parent.unlinkChild(child);
        child.unlinkParent(parent);
    }

    /**
     * Add an attacker with the next free id and no compromises.
     */
    public Attacker addAttacker(Attacker attacker) {
        return addAttacker(attacker, null, List.of(), List.of());
    }

    /**
     * Add an attacker, compromising the given reached steps and registering the entry points.
     * @throws IllegalArgumentException if the id or name is already taken, or a step id is unknown
     */
    public Attacker addAttacker(
            Attacker attacker,
            Long id,
            Collection<Long> reachedStepIds,
            Collection<Long> entryPointIds
    ) {
        long attackerId = id != null ? id : nextAttackerId;
        if (attackersById.containsKey(attackerId)) {
            throw new IllegalArgumentException(String.format(
                    "Attacker index %d already in use by %s, cannot add %s",
                    attackerId, attackersById.get(attackerId).getName(), attacker.getName()));
        }
        if (attackersByName.containsKey(attacker.getName())) {
            throw new IllegalArgumentException("Attacker name already in use: " + attacker.getName());
        }

        List<AttackStepNode> reached = reachedStepIds.stream().map(this::requireNode).toList();
        List<AttackStepNode> entryPoints = entryPointIds.stream().map(this::requireNode).toList();

        attacker.assignId(attackerId);
        attackers.add(attacker);
        attackersById.put(attackerId, attacker);
        attackersByName.put(attacker.getName(), attacker);
        nextAttackerId = Math.max(attackerId + 1, nextAttackerId);

        reached.forEach(attacker::compromise);
        entryPoints.forEach(attacker::addEntryPoint);
        return attacker;
    }

    /**
     * Remove an attacker after undoing all of its compromises.
     */
    public void removeAttacker(Attacker attacker) {
        if (attackersById.get(attacker.getId()) != attacker) {
            throw new IllegalArgumentException("Attacker " + attacker.getName() + " is not part of the graph");
        }
        attacker.undoAllCompromises();
        for (AttackStepNode node : nodes) {
            node.forgetAttacker(attacker);
        }
        attackers.remove(attacker);
        attackersById.remove(attacker.getId());
        attackersByName.remove(attacker.getName());
    }

    /**
     * Create the attackers declared in the model and compromise their entry points.
     * Entry points naming a step that is not in the graph are skipped.
     */
    public List<Attacker> attachAttackers(InstanceModel model) {
        log.info("Attaching attackers from model '{}' to the graph", model.name());
        List<Attacker> attached = new ArrayList<>();

        for (AttackerDefinition definition : model.attackers()) {
            Attacker attacker = addAttacker(new Attacker(definition.name()), definition.id(), List.of(), List.of());

            for (AttackerDefinition.EntryPoint entryPoint : definition.entryPoints()) {
                for (String fullName : entryPoint.fullNames()) {
                    Optional<AttackStepNode> node = getNodeByFullName(fullName);
                    if (node.isEmpty()) {
                        log.warn("Failed to find entry point {} for attacker '{}'", fullName, attacker.getName());
                        continue;
                    }
                    attacker.compromise(node.get());
                }
            }
            attacker.resetEntryPointsToReached();
            attached.add(attacker);
        }
        return attached;
    }

    public List<AttackStepNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Attacker> getAttackers() {
        return Collections.unmodifiableList(attackers);
    }

    public Optional<AttackStepNode> getNodeById(long id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public Optional<AttackStepNode> getNodeByFullName(String fullName) {
        return Optional.ofNullable(nodesByFullName.get(fullName));
    }

    public Optional<Attacker> getAttackerById(long id) {
        return Optional.ofNullable(attackersById.get(id));
    }

    public Optional<Attacker> getAttackerByName(String name) {
        return Optional.ofNullable(attackersByName.get(name));
    }

    /**
     * All nodes for a given attack step name, across assets.
     */
    public List<AttackStepNode> getNodesByName(String name) {
        return nodes.stream()
                .filter(n -> n.getName().equals(name))
                .toList();
    }

    public List<AttackStepNode> getNodesByType(AttackStepType type) {
        return nodes.stream()
                .filter(n -> n.getType() == type)
                .toList();
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(
                nodes.size(),
                nodes.stream().mapToInt(n -> n.getChildren().size()).sum(),
                attackers.size()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int attackerCount) {}

    private void requireOwned(AttackStepNode node) {
        if (node.getId() == null || nodesById.get(node.getId()) != node) {
            throw new IllegalArgumentException("Node " + node.getName() + " is not part of the graph");
        }
    }

    private AttackStepNode requireNode(long id) {
        return getNodeById(id)
                .orElseThrow(() -> new IllegalArgumentException("No node with id " + id));
    }

    @Override
    public String toString() {
        return "AttackGraph(" + nodes.size() + " nodes, " + attackers.size() + " attackers)";
    }
}
