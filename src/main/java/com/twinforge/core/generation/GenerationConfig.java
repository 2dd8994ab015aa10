package com.twinforge.core.generation;

import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.config.TwinforgeProperties;
import com.twinforge.core.llm.LlmService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the single {@link GenerationCollaborator} for this process from
 * {@code twinforge.generation.provider}.
 */
@Configuration
public class GenerationConfig {

    private static final String PROVIDER = "twinforge.generation.provider";

    @Bean
    @ConditionalOnProperty(name = PROVIDER, havingValue = "llm", matchIfMissing = true)
    public GenerationCollaborator llmGenerationCollaborator(LlmService llmService, ArtifactParser parser) {
        return new LlmGenerationCollaborator(llmService, parser);
    }

    @Bean
    @ConditionalOnProperty(name = PROVIDER, havingValue = "cli")
    public GenerationCollaborator cliGenerationCollaborator(TwinforgeProperties properties, ArtifactParser parser) {
        return new CliGenerationCollaborator(properties.getGeneration().getCli(), parser);
    }

    @Bean
    @ConditionalOnProperty(name = PROVIDER, havingValue = "mock")
    public GenerationCollaborator mockGenerationCollaborator() {
        return new MockGenerationCollaborator();
    }
}
