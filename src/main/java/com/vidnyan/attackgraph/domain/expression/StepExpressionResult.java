package com.vidnyan.attackgraph.domain.expression;

import com.vidnyan.attackgraph.domain.model.Asset;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of evaluating a step expression: the resolved assets and,
 * when the expression ends in an attack step, its name.
 */
public record StepExpressionResult(
    List<Asset> assets,
    String attackStepName
) {

    public StepExpressionResult {
        assets = List.copyOf(assets);
    }

    public static StepExpressionResult of(List<Asset> assets) {
        return new StepExpressionResult(assets, null);
    }

    public static StepExpressionResult empty() {
        return new StepExpressionResult(List.of(), null);
    }

    public Optional<String> attackStep() {
        return Optional.ofNullable(attackStepName);
    }

    public boolean isEmpty() {
        return assets.isEmpty();
    }
}
