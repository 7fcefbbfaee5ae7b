package com.vidnyan.attackgraph.adapter.out.language;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.attackgraph.domain.language.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Language specification backed by a compiled {@code langspec.json} document.
 *
 * Attack steps are flattened along the {@code superAsset} chain: supertype
 * steps come first; a redeclared step replaces the inherited one when its
 * reaches block overrides, otherwise its reaches are appended.
 */
@Slf4j
public class JsonLanguageSpecification implements LanguageSpecification {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String id;
    private final Map<String, AssetTypeSpec> assetTypes = new LinkedHashMap<>();
    private final List<Association> associations = new ArrayList<>();
    private final Map<String, Map<String, AttackStepDefinition>> flattenedSteps = new HashMap<>();

    private record AssetTypeSpec(
        String name,
        String superAsset,
        Map<String, StepExpression> variables,
        List<AttackStepDefinition> attackSteps
    ) {}

    public JsonLanguageSpecification(JsonNode root, ObjectMapper objectMapper) {
        StepExpressionParser parser = new StepExpressionParser();
        this.id = languageId(root);

        for (JsonNode asset : root.path("assets")) {
            AssetTypeSpec spec = parseAsset(asset, parser, objectMapper);
            assetTypes.put(spec.name(), spec);
        }
        for (JsonNode association : root.path("associations")) {
            associations.add(new Association(
                    association.path("name").asText(),
                    association.path("leftAsset").asText(),
                    association.path("leftField").asText(),
                    association.path("rightAsset").asText(),
                    association.path("rightField").asText()));
        }

        for (AssetTypeSpec spec : assetTypes.values()) {
            if (spec.superAsset() != null && !assetTypes.containsKey(spec.superAsset())) {
                throw new LanguageSpecificationException(
                        "Asset type " + spec.name() + " extends unknown asset type " + spec.superAsset());
            }
        }
        log.info("Parsed language {}: {} asset types, {} associations", id, assetTypes.size(), associations.size());
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean hasAssetType(String assetType) {
        return assetTypes.containsKey(assetType);
    }

    @Override
    public Map<String, AttackStepDefinition> getAttackStepsForAssetType(String assetType) {
        Map<String, AttackStepDefinition> cached = flattenedSteps.get(assetType);
        if (cached != null) {
            return cached;
        }
        Map<String, AttackStepDefinition> steps = new LinkedHashMap<>();
        for (AssetTypeSpec spec : lineage(assetType)) {
            for (AttackStepDefinition step : spec.attackSteps()) {
                AttackStepDefinition inherited = steps.get(step.name());
                if (inherited == null || step.reachesOverrides()) {
                    steps.put(step.name(), step);
                } else {
                    steps.put(step.name(), inherited.withAdditionalReaches(step.reaches()));
                }
            }
        }
        Map<String, AttackStepDefinition> result = Collections.unmodifiableMap(steps);
        flattenedSteps.put(assetType, result);
        return result;
    }

    @Override
    public List<Association> getAssociationsForAssetType(String assetType) {
        List<AssetTypeSpec> lineage = lineage(assetType);
        return associations.stream()
                .filter(a -> lineage.stream().anyMatch(spec -> a.involves(spec.name())))
                .toList();
    }

    @Override
    public Optional<StepExpression> getVariableForAssetType(String assetType, String variableName) {
        if (!hasAssetType(assetType)) {
            return Optional.empty();
        }
        List<AssetTypeSpec> lineage = lineage(assetType);
        for (int i = lineage.size() - 1; i >= 0; i--) {
            StepExpression expression = lineage.get(i).variables().get(variableName);
            if (expression != null) {
                return Optional.of(expression);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean extendsAsset(String assetType, String superType) {
        if (!hasAssetType(assetType)) {
            return Objects.equals(assetType, superType);
        }
        return lineage(assetType).stream().anyMatch(spec -> spec.name().equals(superType));
    }

    /**
     * The type and its supertypes, root first.
     */
    private List<AssetTypeSpec> lineage(String assetType) {
        Deque<AssetTypeSpec> chain = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        String current = assetType;
        while (current != null) {
            if (!seen.add(current)) {
                throw new LanguageSpecificationException("Inheritance cycle through asset type " + current);
            }
            AssetTypeSpec spec = requireAssetType(current);
            chain.addFirst(spec);
            current = spec.superAsset();
        }
        return new ArrayList<>(chain);
    }

    private AssetTypeSpec requireAssetType(String assetType) {
        AssetTypeSpec spec = assetTypes.get(assetType);
        if (spec == null) {
            throw new LanguageSpecificationException("Unknown asset type " + assetType + " in language " + id);
        }
        return spec;
    }

    private static String languageId(JsonNode root) {
        JsonNode defines = root.path("defines");
        String name = defines.path("id").asText("unknown");
        String version = defines.path("version").asText("");
        return version.isEmpty() ? name : name + "@" + version;
    }

    private static AssetTypeSpec parseAsset(JsonNode asset, StepExpressionParser parser, ObjectMapper objectMapper) {
        String name = asset.path("name").asText(null);
        if (name == null) {
            throw new LanguageSpecificationException("Asset type without a name: " + asset);
        }
        JsonNode superAsset = asset.get("superAsset");

        Map<String, StepExpression> variables = new LinkedHashMap<>();
        for (JsonNode variable : asset.path("variables")) {
            variables.put(variable.path("name").asText(), parser.parse(variable.get("stepExpression")));
        }

        List<AttackStepDefinition> steps = new ArrayList<>();
        for (JsonNode step : asset.path("attackSteps")) {
            String stepName = step.path("name").asText();
            AttackStepType type;
            try {
                type = AttackStepType.fromValue(step.path("type").asText());
            } catch (IllegalArgumentException e) {
                throw new LanguageSpecificationException(
                        "Attack step " + name + "." + stepName + " has an invalid type", e);
            }
            steps.add(AttackStepDefinition.builder(stepName, type)
                    .ttc(toMap(step.get("ttc"), objectMapper))
                    .tags(toStrings(step.path("tags")))
                    .meta(toMap(step.get("meta"), objectMapper))
                    .requires(expressions(step.get("requires"), parser))
                    .reaches(expressions(step.get("reaches"), parser))
                    .reachesOverrides(step.path("reaches").path("overrides").asBoolean(false))
                    .build());
        }

        return new AssetTypeSpec(
                name,
                superAsset == null || superAsset.isNull() || superAsset.asText().isEmpty() ? null : superAsset.asText(),
                variables,
                steps);
    }

    private static List<StepExpression> expressions(JsonNode block, StepExpressionParser parser) {
        if (block == null || block.isNull()) {
            return List.of();
        }
        List<StepExpression> result = new ArrayList<>();
        for (JsonNode expression : block.path("stepExpressions")) {
            result.add(parser.parse(expression));
        }
        return result;
    }

    private static Map<String, Object> toMap(JsonNode node, ObjectMapper objectMapper) {
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static List<String> toStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(value -> values.add(value.asText()));
        return values;
    }
}
