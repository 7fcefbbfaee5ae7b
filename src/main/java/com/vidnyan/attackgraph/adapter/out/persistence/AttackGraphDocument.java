package com.vidnyan.attackgraph.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Persisted form of an attack graph. Steps and attackers refer to
 * attack steps by full name. Optional fields are omitted when unset.
 */
public record AttackGraphDocument(
    @JsonProperty("attack_steps") List<AttackStepRecord> attackSteps,
    @JsonProperty("attackers") List<AttackerRecord> attackers
) {

    public AttackGraphDocument {
        attackSteps = attackSteps == null ? List.of() : attackSteps;
        attackers = attackers == null ? List.of() : attackers;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AttackStepRecord(
        @JsonProperty("id") long id,
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("ttc") Map<String, Object> ttc,
        @JsonProperty("children") List<String> children,
        @JsonProperty("parents") List<String> parents,
        @JsonProperty("compromised_by") List<String> compromisedBy,
        @JsonProperty("asset") String asset,
        @JsonProperty("defense_status") Double defenseStatus,
        @JsonProperty("existence_status") Boolean existenceStatus,
        @JsonProperty("is_viable") Boolean viable,
        @JsonProperty("is_necessary") Boolean necessary,
        @JsonProperty("mitre_info") String mitreInfo,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("extras") Map<String, Object> extras
    ) {

        /**
         * Full name the step had when it was saved.
         */
        String savedFullName() {
            return (asset != null ? asset : String.valueOf(id)) + ":" + name;
        }
    }

    public record AttackerRecord(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("entry_points") List<String> entryPoints,
        @JsonProperty("reached_attack_steps") List<String> reachedAttackSteps
    ) {}
}
