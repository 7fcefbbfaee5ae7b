package com.vidnyan.attackgraph.domain.graph;

import lombok.Getter;

/**
 * A "reaches" step expression resolved to an attack step that does not exist
 * in the graph. The language specification and the instance model disagree,
 * so the graph being built would be incomplete.
 */
@Getter
public class StepExpressionResolutionException extends RuntimeException {

    private final String sourceFullName;
    private final String targetFullName;

    public StepExpressionResolutionException(String sourceFullName, String targetFullName) {
        super(String.format("Failed to find target node %s to link with for attack step %s",
                targetFullName, sourceFullName));
        this.sourceFullName = sourceFullName;
        this.targetFullName = targetFullName;
    }
}
