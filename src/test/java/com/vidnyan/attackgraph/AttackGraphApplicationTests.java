package com.vidnyan.attackgraph;

import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase;
import com.vidnyan.attackgraph.application.port.in.GenerateAttackGraphUseCase.GenerationRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AttackGraphApplicationTests {

    @Autowired
    private GenerateAttackGraphUseCase generateUseCase;

    @Autowired
    private AttackGraphProperties properties;

    @Test
    void contextLoads_WithDefaultProperties() {
        assertTrue(properties.isAttachAttackers());
        assertTrue(properties.isCalculateReachability());
        assertNull(properties.getGenerate().getModel());
    }

    @Test
    void generate_ThroughWiredAdapters() {
        var result = generateUseCase.generate(GenerationRequest.of(
                TestFixtures.resource(TestFixtures.LANGUAGE),
                TestFixtures.resource(TestFixtures.MODEL)));

        assertEquals(32, result.stats().nodeCount());
        assertEquals(24, result.stats().reachableStepCount());
    }
}
