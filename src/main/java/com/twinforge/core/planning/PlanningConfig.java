package com.twinforge.core.planning;

import com.twinforge.core.collaborator.PlanningCollaborator;
import com.twinforge.core.llm.LlmService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlanningConfig {

    private static final String PROVIDER = "twinforge.planning.provider";

    @Bean
    @ConditionalOnProperty(name = PROVIDER, havingValue = "llm", matchIfMissing = true)
    public PlanningCollaborator llmPlanningCollaborator(LlmService llmService) {
        return new LlmPlanningCollaborator(llmService);
    }

    @Bean
    @ConditionalOnProperty(name = PROVIDER, havingValue = "mock")
    public PlanningCollaborator mockPlanningCollaborator() {
        return new MockPlanningCollaborator();
    }
}
