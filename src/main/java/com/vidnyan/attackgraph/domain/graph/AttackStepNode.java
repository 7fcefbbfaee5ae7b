package com.vidnyan.attackgraph.domain.graph;

import com.vidnyan.attackgraph.domain.language.AttackStepType;
import com.vidnyan.attackgraph.domain.model.Asset;
import lombok.Getter;
import lombok.Setter;

import java.util.*;

/**
 * One attack step of one asset.
 *
 * Nodes are owned by an {@link AttackGraph}: the graph assigns the id and
 * keeps parent/child edges symmetric. Equality is identity.
 */
@Getter
public class AttackStepNode {

    private Long id;
    private final AttackStepType type;
    private final String name;
    private final Asset asset;

    @Setter
    private Map<String, Object> ttc;
    @Setter
    private Double defenseStatus;
    @Setter
    private Boolean existenceStatus;
    @Setter
    private boolean viable = true;
    @Setter
    private boolean necessary = true;
    @Setter
    private String mitreInfo;

    private final Set<String> tags = new LinkedHashSet<>();
    private final Map<String, Object> extras = new LinkedHashMap<>();

    @Getter(lombok.AccessLevel.NONE)
    private final Set<AttackStepNode> children = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<AttackStepNode> parents = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<Attacker> compromisedBy = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<Attacker> reachableBy = new LinkedHashSet<>();

    public AttackStepNode(AttackStepType type, String name) {
        this(type, name, null);
    }

    public AttackStepNode(AttackStepType type, String name, Asset asset) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.asset = asset;
    }

    /**
     * {@code <asset name>:<step name>}, or {@code <id>:<step name>} for nodes
     * without an asset.
     */
    public String getFullName() {
        return asset != null ? asset.name() + ":" + name : id + ":" + name;
    }

    public Optional<Asset> asset() {
        return Optional.ofNullable(asset);
    }

    public Set<AttackStepNode> getChildren() {
        return Collections.unmodifiableSet(children);
    }

    public Set<AttackStepNode> getParents() {
        return Collections.unmodifiableSet(parents);
    }

    public Set<Attacker> getCompromisedBy() {
        return Collections.unmodifiableSet(compromisedBy);
    }

    public Set<Attacker> getReachableBy() {
        return Collections.unmodifiableSet(reachableBy);
    }

    public boolean isCompromised() {
        return !compromisedBy.isEmpty();
    }

    public boolean isCompromisedBy(Attacker attacker) {
        return compromisedBy.contains(attacker);
    }

    public boolean isReachableBy(Attacker attacker) {
        return reachableBy.contains(attacker);
    }

    /**
     * A defense that is fully enabled and not suppressed through tags.
     */
    public boolean isEnabledDefense() {
        return type == AttackStepType.DEFENSE
                && !tags.contains("suppress")
                && defenseStatus != null && defenseStatus == 1.0;
    }

    /**
     * A defense that could still be enabled and is not suppressed through tags.
     */
    public boolean isAvailableDefense() {
        return type == AttackStepType.DEFENSE
                && !tags.contains("suppress")
                && (defenseStatus == null || defenseStatus != 1.0);
    }

    public void compromise(Attacker attacker) {
        attacker.compromise(this);
    }

    public void undoCompromise(Attacker attacker) {
        attacker.undoCompromise(this);
    }

    // Edge and compromise mutators, used by AttackGraph and Attacker only

    void assignId(Long id) {
        this.id = id;
    }

    void linkChild(AttackStepNode child) {
        children.add(child);
    }

    void linkParent(AttackStepNode parent) {
        parents.add(parent);
    }

    void unlinkChild(AttackStepNode child) {
        children.remove(child);
    }

    void unlinkParent(AttackStepNode parent) {
        parents.remove(parent);
    }

    boolean registerCompromise(Attacker attacker) {
        return compromisedBy.add(attacker);
    }

    boolean unregisterCompromise(Attacker attacker) {
        return compromisedBy.remove(attacker);
    }

    void markReachableBy(Attacker attacker) {
        reachableBy.add(attacker);
    }

    void clearReachableBy() {
        reachableBy.clear();
    }

    void forgetAttacker(Attacker attacker) {
        compromisedBy.remove(attacker);
        reachableBy.remove(attacker);
    }

    @Override
    public String toString() {
        return "AttackStepNode(" + id + ", " + getFullName() + ", " + type.value() + ")";
    }
}
