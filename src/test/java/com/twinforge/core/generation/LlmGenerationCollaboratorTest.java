package com.twinforge.core.generation;

import com.twinforge.core.collaborator.CollaboratorException;
import com.twinforge.core.collaborator.GenerationRequest;
import com.twinforge.core.llm.LlmEmptyResponseException;
import com.twinforge.core.llm.LlmService;
import com.twinforge.core.model.ArtifactSet;
import com.twinforge.core.model.Contract;
import com.twinforge.core.model.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class LlmGenerationCollaboratorTest {

    private LlmService llmService;
    private LlmGenerationCollaborator collaborator;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        collaborator = new LlmGenerationCollaborator(llmService, new ArtifactParser());
    }

    private static GenerationRequest request(ArtifactSet prior) {
        return new GenerationRequest("run-1", Target.BACKEND, "Build a todo app", "",
                Contract.empty().sliceFor(Target.BACKEND), List.of(), List.of(), prior, 1, 2);
    }

    @Test
    @DisplayName("overlays parsed files onto the prior artifacts")
    void overlaysPrior() {
        when(llmService.textCall(anyString(), anyString()))
                .thenReturn("FILE: main.py\n```python\nprint('v2')\n```\n");
        var prior = new ArtifactSet(Map.of("main.py", "print('v1')", "requirements.txt", "fastapi"));

        ArtifactSet result = collaborator.generate(request(prior));

        assertEquals("print('v2')", result.files().get("main.py"));
        assertEquals("fastapi", result.files().get("requirements.txt"));
        verify(llmService).textCall(contains("backend developer"), contains("=== GOAL ==="));
    }

    @Test
    @DisplayName("a reply without files is a generation failure")
    void noFiles() {
        when(llmService.textCall(anyString(), anyString())).thenReturn("Sorry, I can't do that.");

        var ex = assertThrows(CollaboratorException.class, () -> collaborator.generate(request(null)));
        assertTrue(ex.getMessage().startsWith("Missing files"));
    }

    @Test
    @DisplayName("wraps model errors")
    void wrapsErrors() {
        when(llmService.textCall(anyString(), anyString())).thenThrow(new LlmEmptyResponseException("empty"));

        var ex = assertThrows(CollaboratorException.class, () -> collaborator.generate(request(null)));
        assertEquals("LLM generation failed for backend: empty", ex.getMessage());
    }
}
