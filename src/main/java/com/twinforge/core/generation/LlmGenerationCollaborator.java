package com.twinforge.core.generation;

import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.GenerationCollaborator;
import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.llm.LlmService;
import com.twinforge.core.model.ArtifactSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates files by prompting the chat model and parsing {@code FILE:} blocks out of the reply.
 * Parsed files are overlaid onto the prior artifact set so unchanged files survive a refinement.
 */
public class LlmGenerationCollaborator implements GenerationCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmGenerationCollaborator.class);

    private final LlmService llmService;
    private final ArtifactParser parser;

    public LlmGenerationCollaborator(LlmService llmService, ArtifactParser parser) {
        this.llmService = llmService;
        this.parser = parser;
    }

    @Override
    public ArtifactSet generate(GenerationRequest request) {
        String prompt = GenerationPromptBuilder.build(request);
        String reply;
        try {
            reply = llmService.textCall(GenerationPromptBuilder.systemPrompt(request.target()), prompt);
        } catch (RuntimeException e) {
            throw new CollaboratorException("LLM generation failed for " + request.target().wireName()
                    + ": " + e.getMessage(), e);
        }

        var files = parser.parse(reply);
        if (files.isEmpty()) {
            throw new CollaboratorException("Missing files: model reply for "
                    + request.target().wireName() + " contained no files");
        }
        log.info("Model generated {} file(s) for {}: {}", files.size(), request.target().wireName(), files.keySet());
        return request.priorArtifacts().overlay(new ArtifactSet(files));
    }

    @Override
    public String providerName() {
        return "llm";
    }
}
