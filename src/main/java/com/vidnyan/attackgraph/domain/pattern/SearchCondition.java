package com.vidnyan.attackgraph.domain.pattern;

import com.vidnyan.attackgraph.domain.graph.AttackStepNode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A predicate a node has to satisfy, repeated between {@code minRepeated}
 * and {@code maxRepeated} consecutive times along a path.
 */
public record SearchCondition(Predicate<AttackStepNode> predicate, int minRepeated, int maxRepeated) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public SearchCondition {
        Objects.requireNonNull(predicate, "predicate");
        if (minRepeated < 0 || maxRepeated < 1 || minRepeated > maxRepeated) {
            throw new IllegalArgumentException(
                    "Invalid repetition bounds " + minRepeated + ".." + maxRepeated);
        }
    }

    /**
     * Matches exactly one node.
     */
    public static SearchCondition of(Predicate<AttackStepNode> predicate) {
        return new SearchCondition(predicate, 1, 1);
    }

    public static SearchCondition repeated(Predicate<AttackStepNode> predicate, int minRepeated, int maxRepeated) {
        return new SearchCondition(predicate, minRepeated, maxRepeated);
    }

    /**
     * One or more nodes of any kind.
     */
    public static SearchCondition anyOneOrMore() {
        return new SearchCondition(node -> true, 1, UNBOUNDED);
    }

    public static SearchCondition nameIs(String name) {
        return of(node -> node.getName().equals(name));
    }

    public boolean matches(AttackStepNode node) {
        return predicate.test(node);
    }

    public boolean canMatchAgain(int matchCount) {
        return matchCount < maxRepeated;
    }

    public boolean mustMatchAgain(int matchCount) {
        return matchCount < minRepeated;
    }
}
