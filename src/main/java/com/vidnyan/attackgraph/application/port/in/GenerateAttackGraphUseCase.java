package com.vidnyan.attackgraph.application.port.in;

import com.vidnyan.attackgraph.domain.graph.AttackGraph;

import java.nio.file.Path;

/**
 * Primary use case: generate an attack graph from a language specification and a model.
 */
public interface GenerateAttackGraphUseCase {

    /**
     * Run the generation workflow.
     * @param request Generation request parameters
     * @return the generated graph and statistics
     */
    GenerationResult generate(GenerationRequest request);

    /**
     * Generation request parameters.
     */
    record GenerationRequest(
        Path languagePath,
        Path modelPath,
        Path outputPath,          // null = do not save
        boolean attachAttackers,
        boolean calculateReachability
    ) {
        public static GenerationRequest of(Path languagePath, Path modelPath) {
            return new GenerationRequest(languagePath, modelPath, null, true, true);
        }
    }

    record GenerationResult(
        AttackGraph graph,
        GenerationStats stats
    ) {}

    /**
     * Generation statistics.
     */
    record GenerationStats(
        int assetCount,
        int nodeCount,
        int edgeCount,
        int attackerCount,
        int reachableStepCount,
        long totalDurationMs
    ) {}
}
