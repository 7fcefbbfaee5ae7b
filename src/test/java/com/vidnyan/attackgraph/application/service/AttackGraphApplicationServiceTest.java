package com.vidnyan.attackgraph.application.service;

import com.vidnyan.attackgraph.TestFixtures;
import com.vidnyan.attackgraph.adapter.out.persistence.FileAttackGraphRepository;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase.GenerationRequest;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase.GenerationResult;
import com.vidnyan.attackgraph.config.AttackGraphConfiguration;
import com.vidnyan.attackgraph.domain.graph.AttackStepNode;
import com.vidnyan.attackgraph.domain.graph.Attacker;
import com.vidnyan.attackgraph.domain.graph.ReachabilityCalculator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AttackGraphApplicationServiceTest {

    @TempDir
    Path tempDir;

    private final FileAttackGraphRepository repository = new FileAttackGraphRepository(
            AttackGraphConfiguration.jsonObjectMapper(), AttackGraphConfiguration.yamlMapper());

    private final AttackGraphApplicationService service = new AttackGraphApplicationService(
            TestFixtures.languageLoader(),
            TestFixtures.modelLoader(),
            repository,
            new ReachabilityCalculator());

    @Test
    void generate_ShouldBuildAttachAndComputeReachability() {
        Path output = tempDir.resolve("graph.yaml");
        GenerationRequest request = new GenerationRequest(
                TestFixtures.resource(TestFixtures.LANGUAGE),
                TestFixtures.resource(TestFixtures.MODEL),
                output,
                true,
                true);

        GenerationResult result = service.generate(request);

        assertEquals(7, result.stats().assetCount());
        assertEquals(32, result.stats().nodeCount());
        assertEquals(26, result.stats().edgeCount());
        assertEquals(1, result.stats().attackerCount());
        assertEquals(24, result.stats().reachableStepCount());
        assertTrue(Files.exists(output));

        Attacker attacker = result.graph().getAttackerByName("Remote Attacker").orElseThrow();
        AttackStepNode use = result.graph().getNodeByFullName("Admin Password:use").orElseThrow();
        AttackStepNode orphan = result.graph().getNodeByFullName("Orphan Data:attemptRead").orElseThrow();
        assertTrue(use.isReachableBy(attacker));
        assertFalse(orphan.isReachableBy(attacker));
        assertEquals(24, attacker.getReachableAttackSteps().size());

        assertEquals(32, repository.load(output, null).getNodes().size());
    }

    @Test
    void generate_ShouldSkipOptionalSteps() {
        GenerationRequest request = new GenerationRequest(
                TestFixtures.resource(TestFixtures.LANGUAGE),
                TestFixtures.resource(TestFixtures.MODEL),
                null,
                false,
                false);

        GenerationResult result = service.generate(request);

        assertEquals(0, result.stats().attackerCount());
        assertEquals(0, result.stats().reachableStepCount());
        assertTrue(result.graph().getNodes().stream().noneMatch(AttackStepNode::isCompromised));
    }
}
