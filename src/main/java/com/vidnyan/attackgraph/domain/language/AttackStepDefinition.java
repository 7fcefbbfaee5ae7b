package com.vidnyan.attackgraph.domain.language;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An attack step as declared on an asset type in the language specification.
 * Immutable value object.
 */
public record AttackStepDefinition(
    String name,
    AttackStepType type,
    Map<String, Object> ttc,
    List<String> tags,
    Map<String, Object> meta,
    List<StepExpression> requires,
    List<StepExpression> reaches,
    boolean reachesOverrides
) {

    public AttackStepDefinition {
        tags = tags == null ? List.of() : List.copyOf(tags);
        meta = meta == null ? Map.of() : meta;
        requires = requires == null ? List.of() : List.copyOf(requires);
        reaches = reaches == null ? List.of() : List.copyOf(reaches);
    }

    /**
     * MITRE ATT&CK reference from the step metadata, if any.
     */
    public Optional<String> mitreInfo() {
        Object mitre = meta.get("mitre");
        return mitre == null ? Optional.empty() : Optional.of(mitre.toString());
    }

    /**
     * Copy of this step whose reaches list is extended by a subtype declaration.
     */
    public AttackStepDefinition withAdditionalReaches(List<StepExpression> additional) {
        List<StepExpression> combined = new ArrayList<>(reaches);
        combined.addAll(additional);
        return new AttackStepDefinition(name, type, ttc, tags, meta, requires, combined, reachesOverrides);
    }

    public static Builder builder(String name, AttackStepType type) {
        return new Builder(name, type);
    }

    public static class Builder {
        private final String name;
        private final AttackStepType type;
        private Map<String, Object> ttc;
        private List<String> tags = List.of();
        private Map<String, Object> meta = Map.of();
        private List<StepExpression> requires = List.of();
        private List<StepExpression> reaches = List.of();
        private boolean reachesOverrides;

        private Builder(String name, AttackStepType type) {
            this.name = name;
            this.type = type;
        }

        public Builder ttc(Map<String, Object> ttc) { this.ttc = ttc; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder meta(Map<String, Object> meta) { this.meta = meta; return this; }
        public Builder requires(List<StepExpression> requires) { this.requires = requires; return this; }
        public Builder reaches(List<StepExpression> reaches) { this.reaches = reaches; return this; }
        public Builder reachesOverrides(boolean overrides) { this.reachesOverrides = overrides; return this; }

        public AttackStepDefinition build() {
            return new AttackStepDefinition(name, type, ttc, tags, meta, requires, reaches, reachesOverrides);
        }
    }
}
