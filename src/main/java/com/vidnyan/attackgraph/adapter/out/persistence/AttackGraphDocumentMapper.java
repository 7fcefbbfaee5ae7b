package com.vidnyan.attackgraph.adapter.out.persistence;

import com.vidnyan.attackgraph.adapter.out.persistence.AttackGraphDocument.AttackStepRecord;
import com.vidnyan.attackgraph.adapter.out.persistence.AttackGraphDocument.AttackerRecord;
import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.graph.AttackStepNode;
import com.vidnyan.attackgraph.domain.graph.Attacker;
import com.vidnyan.attackgraph.domain.language.AttackStepType;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Converts between {@link AttackGraph} and {@link AttackGraphDocument}.
 */
@Slf4j
class AttackGraphDocumentMapper {

    AttackGraphDocument toDocument(AttackGraph graph) {
        List<AttackStepRecord> steps = graph.getNodes().stream()
                .map(this::toRecord)
                .toList();
        List<AttackerRecord> attackers = graph.getAttackers().stream()
                .map(a -> new AttackerRecord(
                        a.getId(),
                        a.getName(),
                        fullNames(a.getEntryPoints()),
                        fullNames(a.getReachedAttackSteps())))
                .toList();
        return new AttackGraphDocument(steps, attackers);
    }

    private AttackStepRecord toRecord(AttackStepNode node) {
        return new AttackStepRecord(
                node.getId(),
                node.getType().value(),
                node.getName(),
                node.getTtc(),
                fullNames(node.getChildren()),
                fullNames(node.getParents()),
                node.getCompromisedBy().stream().map(Attacker::getName).toList(),
                node.asset().map(Asset::name).orElse(null),
                node.getDefenseStatus(),
                node.getExistenceStatus(),
                node.isViable(),
                node.isNecessary(),
                node.getMitreInfo(),
                node.getTags().isEmpty() ? null : List.copyOf(node.getTags()),
                node.getExtras().isEmpty() ? null : new LinkedHashMap<>(node.getExtras()));
    }

    /**
     * Rebuild a graph. With a model, assets are re-attached by name.
     * @param model may be null
     * @throws InvalidAttackGraphDocumentException on dangling references
     */
    AttackGraph fromDocument(AttackGraphDocument document, InstanceModel model) {
        AttackGraph graph = new AttackGraph();
        Map<String, AttackStepNode> bySavedName = new HashMap<>();

        for (AttackStepRecord record : document.attackSteps()) {
            AttackStepNode node = new AttackStepNode(
                    parseType(record), record.name(), resolveAsset(record, model));
            node.setTtc(record.ttc());
            node.setDefenseStatus(record.defenseStatus());
            node.setExistenceStatus(record.existenceStatus());
            node.setViable(record.viable() == null || record.viable());
            node.setNecessary(record.necessary() == null || record.necessary());
            node.setMitreInfo(record.mitreInfo());
            if (record.tags() != null) {
                node.getTags().addAll(record.tags());
            }
            if (record.extras() != null) {
                node.getExtras().putAll(record.extras());
            }
            graph.addNode(node, record.id());
            bySavedName.put(record.savedFullName(), node);
        }

        for (AttackStepRecord record : document.attackSteps()) {
            AttackStepNode node = bySavedName.get(record.savedFullName());
            for (String child : orEmpty(record.children())) {
                graph.addEdge(node, lookup(bySavedName, child, record));
            }
            for (String parent : orEmpty(record.parents())) {
                graph.addEdge(lookup(bySavedName, parent, record), node);
            }
        }

        for (AttackerRecord record : document.attackers()) {
            graph.addAttacker(
                    new Attacker(record.name()),
                    record.id(),
                    ids(orEmpty(record.reachedAttackSteps()), bySavedName, record.name()),
                    ids(orEmpty(record.entryPoints()), bySavedName, record.name()));
        }

        for (AttackStepRecord record : document.attackSteps()) {
            AttackStepNode node = bySavedName.get(record.savedFullName());
            for (String attackerName : orEmpty(record.compromisedBy())) {
                Attacker attacker = graph.getAttackerByName(attackerName)
                        .orElseThrow(() -> new InvalidAttackGraphDocumentException(
                                "Attack step " + record.savedFullName() + " is compromised by unknown attacker " + attackerName));
                attacker.compromise(node);
            }
        }

        log.debug("Loaded attack graph with {} nodes and {} attackers",
                graph.getNodes().size(), graph.getAttackers().size());
        return graph;
    }

    private static AttackStepType parseType(AttackStepRecord record) {
        try {
            return AttackStepType.fromValue(record.type());
        } catch (IllegalArgumentException e) {
            throw new InvalidAttackGraphDocumentException(
                    "Attack step " + record.savedFullName() + " has invalid type " + record.type());
        }
    }

    private static Asset resolveAsset(AttackStepRecord record, InstanceModel model) {
        if (model == null || record.asset() == null) {
            return null;
        }
        return model.getAssetByName(record.asset())
                .orElseThrow(() -> new InvalidAttackGraphDocumentException(
                        "Failed to find asset " + record.asset() + " for attack step " + record.savedFullName()
                                + " in model '" + model.name() + "'"));
    }

    private static AttackStepNode lookup(Map<String, AttackStepNode> bySavedName, String fullName, AttackStepRecord from) {
        AttackStepNode node = bySavedName.get(fullName);
        if (node == null) {
            throw new InvalidAttackGraphDocumentException(
                    "Attack step " + from.savedFullName() + " refers to unknown attack step " + fullName);
        }
        return node;
    }

    private static List<Long> ids(List<String> fullNames, Map<String, AttackStepNode> bySavedName, String attackerName) {
        List<Long> ids = new ArrayList<>();
        for (String fullName : fullNames) {
            AttackStepNode node = bySavedName.get(fullName);
            if (node == null) {
                throw new InvalidAttackGraphDocumentException(
                        "Attacker " + attackerName + " refers to unknown attack step " + fullName);
            }
            ids.add(node.getId());
        }
        return ids;
    }

    private static List<String> fullNames(Collection<AttackStepNode> nodes) {
        return nodes.stream().map(AttackStepNode::getFullName).toList();
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
