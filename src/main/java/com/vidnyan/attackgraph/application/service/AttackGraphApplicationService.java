package com.vidnyan.attackgraph.application.service;

import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase;
import com.vidnyan.attackgraph.application.port.out.AttackGraphRepository;
import com.vidnyan.attackgraph.application.port.out.InstanceModelLoader;
import com.vidnyan.attackgraph.application.port.out.LanguageSpecificationLoader;
import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.graph.AttackGraphBuilder;
import com.vidnyan.attackgraph.domain.graph.Attacker;
import com.vidnyan.attackgraph.domain.graph.ReachabilityCalculator;
import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Application service that orchestrates attack graph generation.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttackGraphApplicationService implements GenerateAttackGraphUseCase {

    private final LanguageSpecificationLoader languageLoader;
    private final InstanceModelLoader modelLoader;
    private final AttackGraphRepository graphRepository;
    private final ReachabilityCalculator reachabilityCalculator;

    @Override
    public GenerationResult generate(GenerationRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting attack graph generation for model: {}", request.modelPath());

        // Step 1: Load language specification
        log.info("Step 1: Loading language specification...");
        LanguageSpecification language = languageLoader.load(request.languagePath());
        log.info("Loaded language {}", language.id());

        // Step 2: Load instance model
        log.info("Step 2: Loading instance model...");
        InstanceModel model = modelLoader.load(request.modelPath(), language);
        log.info("Loaded model '{}': {} assets, {} attackers",
                model.name(), model.assets().size(), model.attackers().size());

        // Step 3: Build graph
        log.info("Step 3: Building attack graph...");
        AttackGraph graph = new AttackGraphBuilder(language, model).build();

        // Step 4: Attach attackers
        if (request.attachAttackers()) {
            log.info("Step 4: Attaching attackers...");
            List<Attacker> attackers = graph.attachAttackers(model);
            log.info("Attached {} attackers", attackers.size());
        } else {
            log.info("Step 4: Skipping attacker attachment");
        }

        // Step 5: Reachability
        int reachable = 0;
        if (request.calculateReachability()) {
            log.info("Step 5: Calculating reachability...");
            reachabilityCalculator.calculate(graph);
            reachable = (int) graph.getNodes().stream()
                    .filter(n -> !n.getReachableBy().isEmpty())
                    .count();
            log.info("{} attack steps are reachable by at least one attacker", reachable);
        } else {
            log.info("Step 5: Skipping reachability");
        }

        // Step 6: Save
        if (request.outputPath() != null) {
            log.info("Step 6: Saving attack graph to {}", request.outputPath());
            graphRepository.save(graph, request.outputPath());
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AttackGraph.Stats graphStats = graph.stats();
        GenerationStats stats = new GenerationStats(
                model.assets().size(),
                graphStats.nodeCount(),
                graphStats.edgeCount(),
                graphStats.attackerCount(),
                reachable,
                totalDuration.toMillis()
        );

        log.info("Generation complete: {} nodes, {} edges in {}ms",
                stats.nodeCount(), stats.edgeCount(), stats.totalDurationMs());

        return new GenerationResult(graph, stats);
    }
}
