package com.vidnyan.attackgraph.domain.language;

/**
 * A step expression from the language specification.
 * Describes how to navigate from an asset to related assets and,
 * eventually, to the attack step that should be attached.
 *
 * Closed set of variants: adding a new one means adding a {@link Kind}
 * constant, which every exhaustive switch over {@link #kind()} must then handle.
 */
public sealed interface StepExpression permits
        StepExpression.AttackStep,
        StepExpression.Union,
        StepExpression.Intersection,
        StepExpression.Difference,
        StepExpression.Variable,
        StepExpression.Field,
        StepExpression.Transitive,
        StepExpression.SubType,
        StepExpression.Collect,
        StepExpression.Unknown {

    Kind kind();

    enum Kind {
        ATTACK_STEP,
        UNION,
        INTERSECTION,
        DIFFERENCE,
        VARIABLE,
        FIELD,
        TRANSITIVE,
        SUB_TYPE,
        COLLECT,
        UNKNOWN
    }

    /**
     * Leaves the targets unchanged and names the attack step to attach.
     */
    record AttackStep(String name) implements StepExpression {
        @Override
        public Kind kind() { return Kind.ATTACK_STEP; }
    }

    record Union(StepExpression lhs, StepExpression rhs) implements StepExpression {
        @Override
        public Kind kind() { return Kind.UNION; }
    }

    record Intersection(StepExpression lhs, StepExpression rhs) implements StepExpression {
        @Override
        public Kind kind() { return Kind.INTERSECTION; }
    }

    record Difference(StepExpression lhs, StepExpression rhs) implements StepExpression {
        @Override
        public Kind kind() { return Kind.DIFFERENCE; }
    }

    /**
     * Reference to a variable (a {@code let} binding) of the target asset type.
     */
    record Variable(String name) implements StepExpression {
        @Override
        public Kind kind() { return Kind.VARIABLE; }
    }

    /**
     * Association field navigation.
     */
    record Field(String name) implements StepExpression {
        @Override
        public Kind kind() { return Kind.FIELD; }
    }

    /**
     * Transitive closure of the inner expression, usually a {@link Field}.
     */
    record Transitive(StepExpression inner) implements StepExpression {
        @Override
        public Kind kind() { return Kind.TRANSITIVE; }
    }

    record SubType(StepExpression inner, String subType) implements StepExpression {
        @Override
        public Kind kind() { return Kind.SUB_TYPE; }
    }

    /**
     * Left-to-right composition: rhs is evaluated on the assets produced by lhs.
     */
    record Collect(StepExpression lhs, StepExpression rhs) implements StepExpression {
        @Override
        public Kind kind() { return Kind.COLLECT; }
    }

    /**
     * Expression type not understood by this engine. Evaluates to nothing.
     */
    record Unknown(String type) implements StepExpression {
        @Override
        public Kind kind() { return Kind.UNKNOWN; }
    }

    static StepExpression attackStep(String name) {
        return new AttackStep(name);
    }

    static StepExpression field(String name) {
        return new Field(name);
    }

    static StepExpression collect(StepExpression lhs, StepExpression rhs) {
        return new Collect(lhs, rhs);
    }
}
