package com.twinforge;

import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.engine.RunEngine;
import com.twinforge.core.generation.MockGenerationCollaborator;
import com.twinforge.core.model.RunStatus;
import com.twinforge.core.model.Target;
import com.twinforge.core.planning.MockPlanningCollaborator;
import com.twinforge.core.state.RunState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole application with the offline providers and drives one run end to end.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class TwinforgeApplicationTest {

    @Autowired
    private RunEngine runEngine;

    @Autowired
    private TwinforgeProperties properties;

    @Autowired
    private PlanningCollaborator planningCollaborator;

    @Autowired
    private GenerationCollaborator generationCollaborator;

    @Test
    @DisplayName("selects the providers named in configuration")
    void selectsProviders() {
        assertInstanceOf(MockPlanningCollaborator.class, planningCollaborator);
        assertInstanceOf(MockGenerationCollaborator.class, generationCollaborator);
        assertEquals(3, properties.toRunConfig().maxIterations());
    }

    @Test
    @DisplayName("delivers the mock todo application in one iteration")
    void deliversEndToEnd() {
        RunState state = runEngine.runSync("Build a todo app", properties.toRunConfig());

        assertEquals(RunStatus.DELIVERED, state.status());
        assertEquals(1, state.iteration());
        assertTrue(state.outcome(Target.BACKEND).orElseThrow().passed());
        assertTrue(state.outcome(Target.FRONTEND).orElseThrow().passed());
        assertTrue(state.judgment().orElseThrow().compatible());
        assertEquals(RunStatus.DELIVERED, runEngine.getStatus(state.runId()).orElseThrow().status());
    }
}
