package com.vidnyan.attackgraph.domain.expression;

import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import com.vidnyan.attackgraph.domain.language.StepExpression;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.BinaryOperator;

/**
 * Resolves step expressions against an instance model.
 *
 * Every evaluation starts from a list of target assets (initially the asset
 * owning the attack step) and produces the assets the expression navigates to,
 * plus the attack step name when the expression ends in one.
 * Evaluation has no side effects on its inputs.
 *
 * Not thread-safe: variables being expanded are tracked per instance.
 */
@Slf4j
@RequiredArgsConstructor
public class StepExpressionEvaluator {

    // Upper bound on closure iterations
    private static final int MAX_TRANSITIVE_DEPTH = 10_000;

    private final LanguageSpecification language;
    private final InstanceModel model;

    // "assetType.variable" bindings on the current evaluation path
    private final Set<String> expandingVariables = new HashSet<>();

    /**
     * Evaluate an expression against a list of target assets.
     */
    public StepExpressionResult evaluate(StepExpression expression, List<Asset> targetAssets) {
        log.trace("Evaluating {} against {} assets", expression, targetAssets.size());

        return switch (expression.kind()) {
            case ATTACK_STEP -> new StepExpressionResult(
                    targetAssets, ((StepExpression.AttackStep) expression).name());
            case UNION -> {
                var union = (StepExpression.Union) expression;
                yield combine(union.lhs(), union.rhs(), targetAssets, StepExpressionEvaluator::union);
            }
            case INTERSECTION -> {
                var intersection = (StepExpression.Intersection) expression;
                yield combine(intersection.lhs(), intersection.rhs(), targetAssets,
                        StepExpressionEvaluator::intersection);
            }
            case DIFFERENCE -> {
                var difference = (StepExpression.Difference) expression;
                yield combine(difference.lhs(), difference.rhs(), targetAssets,
                        StepExpressionEvaluator::difference);
            }
            case VARIABLE -> evaluateVariable((StepExpression.Variable) expression, targetAssets);
            case FIELD -> StepExpressionResult.of(
                    followField(((StepExpression.Field) expression).name(), targetAssets));
            case TRANSITIVE -> evaluateTransitive((StepExpression.Transitive) expression, targetAssets);
            case SUB_TYPE -> evaluateSubType((StepExpression.SubType) expression, targetAssets);
            case COLLECT -> {
                var collect = (StepExpression.Collect) expression;
                StepExpressionResult left = evaluate(collect.lhs(), targetAssets);
                yield evaluate(collect.rhs(), left.assets());
            }
            case UNKNOWN -> {
                log.error("Unknown step expression type: {}", ((StepExpression.Unknown) expression).type());
                yield StepExpressionResult.empty();
            }
        };
    }

    private StepExpressionResult combine(
            StepExpression lhs,
            StepExpression rhs,
            List<Asset> targetAssets,
            BinaryOperator<List<Asset>> operator
    ) {
        List<Asset> left = evaluate(lhs, targetAssets).assets();
        List<Asset> right = evaluate(rhs, targetAssets).assets();
        return StepExpressionResult.of(operator.apply(left, right));
    }

    private StepExpressionResult evaluateVariable(StepExpression.Variable variable, List<Asset> targetAssets) {
        // Targets of different types may bind the variable differently
        Map<String, List<Asset>> targetsByType = new LinkedHashMap<>();
        for (Asset target : targetAssets) {
            if (!target.hasType()) {
                log.error("Requested variable '{}' from untyped target asset '{}', which cannot be resolved",
                        variable.name(), target.name());
                return StepExpressionResult.empty();
            }
            targetsByType.computeIfAbsent(target.type(), k -> new ArrayList<>()).add(target);
        }

        List<Asset> resolved = new ArrayList<>();
        String attackStepName = null;
        for (Map.Entry<String, List<Asset>> entry : targetsByType.entrySet()) {
            Optional<StepExpression> bound = language.getVariableForAssetType(entry.getKey(), variable.name());
            if (bound.isEmpty()) {
                log.error("Variable '{}' is not defined for asset type {}", variable.name(), entry.getKey());
                continue;
            }
            StepExpressionResult result = evaluateBinding(
                    entry.getKey(), variable.name(), bound.get(), entry.getValue());
            resolved.addAll(result.assets());
            if (result.attackStepName() != null) {
                attackStepName = result.attackStepName();
            }
        }
        return new StepExpressionResult(resolved, attackStepName);
    }

    /**
     * Evaluate a variable's bound expression, failing on a binding that refers back to itself.
     * @throws LanguageSpecificationException if the variable is already being expanded for this type
     */
    private StepExpressionResult evaluateBinding(
            String assetType,
            String variableName,
            StepExpression bound,
            List<Asset> targets
    ) {
        String key = assetType + "." + variableName;
        if (!expandingVariables.add(key)) {
            throw new LanguageSpecificationException(String.format(
                    "Variable '%s' of asset type %s refers back to itself", variableName, assetType));
        }
        try {
            return evaluate(bound, targets);
        } finally {
            expandingVariables.remove(key);
        }
    }

    private List<Asset> followField(String fieldName, List<Asset> targetAssets) {
        List<Asset> associated = new ArrayList<>();
        for (Asset target : targetAssets) {
            associated.addAll(model.getAssociatedAssetsByFieldName(target, fieldName));
        }
        return associated;
    }

    /**
     * Frontier-by-frontier closure. Every asset found at any depth is part of
     * the result; an asset already found is not expanded again, so cyclic
     * associations terminate.
     */
    private StepExpressionResult evaluateTransitive(StepExpression.Transitive transitive, List<Asset> targetAssets) {
        Set<Long> discovered = new HashSet<>();
        List<Asset> accumulated = new ArrayList<>();
        List<Asset> frontier = targetAssets;
        int depth = 0;

        while (!frontier.isEmpty()) {
            if (depth++ >= MAX_TRANSITIVE_DEPTH) {
                log.warn("Transitive expression {} stopped after {} iterations", transitive.inner(), MAX_TRANSITIVE_DEPTH);
                break;
            }
            List<Asset> next = new ArrayList<>();
            for (Asset asset : evaluate(transitive.inner(), frontier).assets()) {
                if (discovered.add(asset.id())) {
                    next.add(asset);
                }
            }
            accumulated.addAll(next);
            frontier = next;
        }
        return StepExpressionResult.of(accumulated);
    }

    private StepExpressionResult evaluateSubType(StepExpression.SubType subType, List<Asset> targetAssets) {
        List<Asset> selected = evaluate(subType.inner(), targetAssets).assets().stream()
                .filter(asset -> asset.hasType() && language.extendsAsset(asset.type(), subType.subType()))
                .toList();
        return StepExpressionResult.of(selected);
    }

    // Set algebra over asset ids. Result order follows the left operand, then the right one.

    static List<Asset> union(List<Asset> left, List<Asset> right) {
        Map<Long, Asset> result = new LinkedHashMap<>();
        left.forEach(asset -> result.putIfAbsent(asset.id(), asset));
        right.forEach(asset -> result.putIfAbsent(asset.id(), asset));
        return new ArrayList<>(result.values());
    }

    static List<Asset> intersection(List<Asset> left, List<Asset> right) {
        Set<Long> rightIds = ids(right);
        Map<Long, Asset> result = new LinkedHashMap<>();
        left.stream()
                .filter(asset -> rightIds.contains(asset.id()))
                .forEach(asset -> result.putIfAbsent(asset.id(), asset));
        return new ArrayList<>(result.values());
    }

    static List<Asset> difference(List<Asset> left, List<Asset> right) {
        Set<Long> rightIds = ids(right);
        Map<Long, Asset> result = new LinkedHashMap<>();
        left.stream()
                .filter(asset -> !rightIds.contains(asset.id()))
                .forEach(asset -> result.putIfAbsent(asset.id(), asset));
        return new ArrayList<>(result.values());
    }

    private static Set<Long> ids(List<Asset> assets) {
        Set<Long> ids = new HashSet<>();
        assets.forEach(asset -> ids.add(asset.id()));
        return ids;
    }
}
