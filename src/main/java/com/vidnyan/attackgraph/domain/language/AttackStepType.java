package com.vidnyan.attackgraph.domain.language;

import java.util.Arrays;

/**
 * Kinds of attack steps a language can declare.
 */
public enum AttackStepType {
    OR("or"),               // Compromised if any parent is compromised
    AND("and"),             // Compromised only if all parents are compromised
    DEFENSE("defense"),     // Mitigating control, enabled or disabled per asset
    EXIST("exist"),         // Conditioned on presence of related assets
    NOT_EXIST("notExist");  // Conditioned on absence of related assets

    private final String value;

    AttackStepType(String value) {
        this.value = value;
    }

    /**
     * Name used by compiled language specifications and persisted graphs.
     */
    public String value() {
        return value;
    }

    /**
     * AND steps are the only ones that need all parents to propagate.
     */
    public boolean requiresAllParents() {
        return this == AND;
    }

    public static AttackStepType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown attack step type: " + value));
    }
}
