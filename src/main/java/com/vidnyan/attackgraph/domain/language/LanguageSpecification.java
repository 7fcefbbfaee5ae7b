package com.vidnyan.attackgraph.domain.language;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query interface over a compiled threat modeling language.
 * Implemented by adapters that read compiled specifications.
 */
public interface LanguageSpecification {

    /**
     * Identifier of the language, e.g. {@code org.mal-lang.coreLang}.
     */
    String id();

    /**
     * Check if the language declares the given asset type.
     */
    boolean hasAssetType(String assetType);

    /**
     * Attack steps of an asset type with inheritance already flattened.
     * Supertype steps come first, in declaration order, followed by steps the
     * type itself introduces.
     * @throws LanguageSpecificationException if the asset type is unknown
     */
    Map<String, AttackStepDefinition> getAttackStepsForAssetType(String assetType);

    /**
     * Associations of an asset type, including those inherited from supertypes.
     */
    List<Association> getAssociationsForAssetType(String assetType);

    /**
     * Step expression bound to a variable, looked up on the type and then its supertypes.
     */
    Optional<StepExpression> getVariableForAssetType(String assetType, String variableName);

    /**
     * True if {@code assetType} equals {@code superType} or inherits from it.
     */
    boolean extendsAsset(String assetType, String superType);
}
