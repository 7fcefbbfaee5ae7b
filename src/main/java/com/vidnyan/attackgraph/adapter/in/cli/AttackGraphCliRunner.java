package com.vidnyan.attackgraph.adapter.in.cli;

import com.vidnyan.attackgraph.AttackGraphProperties;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase.GenerationRequest;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase.GenerationResult;
import com.vidnyan.attackgraph.domain.graph.Attacker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI Runner for standalone attack graph generation.
 * Runs when atg.generate.language and atg.generate.model are set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttackGraphCliRunner implements CommandLineRunner {

    private final GenerateAttackGraphUseCase generateUseCase;
    private final AttackGraphProperties properties;

    @Override
    public void run(String... args) {
        AttackGraphProperties.Generate generate = properties.getGenerate();
        if (isBlank(generate.getLanguage()) || isBlank(generate.getModel())) {
            log.info("No input specified. Set atg.generate.language and atg.generate.model properties.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║                    Attack Graph Generator                    ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Language: {}", truncatePath(generate.getLanguage(), 50));
        log.info("║ Model:    {}", truncatePath(generate.getModel(), 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        GenerationRequest request = new GenerationRequest(
                Path.of(generate.getLanguage()),
                Path.of(generate.getModel()),
                isBlank(generate.getOutput()) ? null : Path.of(generate.getOutput()),
                properties.isAttachAttackers(),
                properties.isCalculateReachability());
        GenerationResult result = generateUseCase.generate(request);

        printResults(result);
        if (request.outputPath() != null) {
            log.info(" Written to: {}", request.outputPath());
        }
    }

    private void printResults(GenerationResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ATTACK GRAPH");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Assets:          {}", result.stats().assetCount());
        log.info(" Attack steps:    {}", result.stats().nodeCount());
        log.info(" Edges:           {}", result.stats().edgeCount());
        log.info(" Attackers:       {}", result.stats().attackerCount());
        log.info(" Reachable steps: {}", result.stats().reachableStepCount());
        log.info(" Duration:        {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        for (Attacker attacker : result.graph().getAttackers()) {
            log.info(" {}: {} entry points, {} reachable attack steps",
                    attacker.getName(),
                    attacker.getEntryPoints().size(),
                    attacker.getReachableAttackSteps().size());
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
