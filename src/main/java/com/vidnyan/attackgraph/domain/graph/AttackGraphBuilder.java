package com.vidnyan.attackgraph.domain.graph;

import com.vidnyan.attackgraph.domain.expression.StepExpressionEvaluator;
import com.vidnyan.attackgraph.domain.expression.StepExpressionResult;
import com.vidnyan.attackgraph.domain.language.AttackStepDefinition;
import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import com.vidnyan.attackgraph.domain.language.StepExpression;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Generates an attack graph from a language specification and an instance model.
 *
 * First pass: one node per (asset, attack step), with defense and existence
 * status resolved. Second pass: children of every node from its "reaches"
 * expressions. A reaches target that is not in the graph aborts the build.
 */
@Slf4j
public class AttackGraphBuilder {

    private final LanguageSpecification language;
    private final InstanceModel model;
    private final StepExpressionEvaluator evaluator;

    public AttackGraphBuilder(LanguageSpecification language, InstanceModel model) {
        this.language = language;
        this.model = model;
        this.evaluator = new StepExpressionEvaluator(language, model);
    }

    /**
     * Build a fresh graph. Can be called again to regenerate from the same inputs.
     * @throws StepExpressionResolutionException if a reaches target is missing
     */
    public AttackGraph build() {
        log.info("Generating attack graph for model '{}' with language {}", model.name(), language.id());
        AttackGraph graph = new AttackGraph();
        Map<AttackStepNode, AttackStepDefinition> definitions = new LinkedHashMap<>();

        for (Asset asset : model.assets()) {
            log.debug("Generating attack steps for asset {} of type {}", asset.name(), asset.type());
            for (AttackStepDefinition step : language.getAttackStepsForAssetType(asset.type()).values()) {
                AttackStepNode node = createNode(asset, step);
                graph.addNode(node);
                definitions.put(node, step);
            }
        }

        for (Map.Entry<AttackStepNode, AttackStepDefinition> entry : definitions.entrySet()) {
            linkChildren(graph, entry.getKey(), entry.getValue());
        }

        AttackGraph.Stats stats = graph.stats();
        log.info("Generated attack graph: {} nodes, {} edges", stats.nodeCount(), stats.edgeCount());
        return graph;
    }

    private AttackStepNode createNode(Asset asset, AttackStepDefinition step) {
        AttackStepNode node = new AttackStepNode(step.type(), step.name(), asset);
        node.setTtc(step.ttc());
        node.getTags().addAll(step.tags());
        step.mitreInfo().ifPresent(node::setMitreInfo);

        switch (step.type()) {
            case DEFENSE -> {
                double status = model.getProperty(asset, step.name())
                        .map(value -> parseDefenseStatus(node, value))
                        .orElseGet(() -> defaultDefenseStatus(step));
                log.debug("Setting the defense status of {} to {}", node.getFullName(), status);
                node.setDefenseStatus(status);
            }
            case EXIST, NOT_EXIST -> node.setExistenceStatus(resolveExistence(asset, step));
            case OR, AND -> {
                // Nothing to resolve before linking
            }
        }
        return node;
    }

    /**
     * The required assets exist when the first "requires" expression yields any asset.
     */
    private boolean resolveExistence(Asset asset, AttackStepDefinition step) {
        if (step.requires().isEmpty()) {
            log.warn("Attack step {}:{} of type {} has no requires expression",
                    asset.name(), step.name(), step.type().value());
            return false;
        }
        StepExpressionResult result = evaluator.evaluate(step.requires().get(0), List.of(asset));
        return !result.isEmpty();
    }

    private void linkChildren(AttackGraph graph, AttackStepNode node, AttackStepDefinition step) {
        log.debug("Determining children for attack step {}", node.getFullName());
        Asset asset = node.asset().orElseThrow();

        for (StepExpression expression : step.reaches()) {
            StepExpressionResult result = evaluator.evaluate(expression, List.of(asset));
            if (result.isEmpty()) {
                continue;
            }
            String attackStep = result.attackStep().orElseThrow(() -> new LanguageSpecificationException(
                    "Reaches expression of " + node.getFullName() + " does not end in an attack step: " + expression));

            for (Asset target : result.assets()) {
                String targetFullName = target.name() + ":" + attackStep;
                AttackStepNode targetNode = graph.getNodeByFullName(targetFullName)
                        .orElseThrow(() -> {
                            log.error("Failed to find target node {} to link with for attack step {}",
                                    targetFullName, node.getFullName());
                            return new StepExpressionResolutionException(node.getFullName(), targetFullName);
                        });
                graph.addEdge(node, targetNode);
            }
        }
    }

    private static double parseDefenseStatus(AttackStepNode node, Object value) {
        try {
            return toDefenseStatus(value);
        } catch (NumberFormatException e) {
            throw new LanguageSpecificationException(String.format(
                    "Defense %s has value '%s', expected a boolean or a number", node.getFullName(), value), e);
        }
    }

    static double toDefenseStatus(Object value) {
        if (value instanceof Boolean enabled) {
            return enabled ? 1.0 : 0.0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text) ? 1.0 : 0.0;
        }
        return Double.parseDouble(text);
    }

    /**
     * Default of a defense the model leaves unset, taken from its TTC:
     * {@code Enabled} is 1.0, {@code Bernoulli(p)} is p, anything else is 0.0.
     */
    static double defaultDefenseStatus(AttackStepDefinition step) {
        Map<String, Object> ttc = step.ttc();
        if (ttc == null) {
            return 0.0;
        }
        Object name = ttc.get("name");
        if ("Enabled".equals(name)) {
            return 1.0;
        }
        if ("Bernoulli".equals(name) && ttc.get("arguments") instanceof List<?> arguments
                && !arguments.isEmpty() && arguments.get(0) instanceof Number probability) {
            return probability.doubleValue();
        }
        return 0.0;
    }
}
