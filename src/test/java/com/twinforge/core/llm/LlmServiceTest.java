package com.twinforge.core.llm;

import com.twinforge.core.planning.JudgeResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the {@link ChatClient} chain so no model is called.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "test-model");
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and appends the JSON format to the user prompt")
    void structuredCallSendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"compatible":true,"issues":[],"recommendations":[],"summary":"ok"}
                """);

        llmService.structuredCall("System prompt", "User prompt", JudgeResponse.class);

        verify(mockRequestSpec).system("System prompt");
        var userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt"));
        assertTrue(userCaptor.getValue().length() > "User prompt".length());
    }

    @Test
    @DisplayName("structuredCall deserializes the reply into the requested record")
    void structuredCallParses() {
        when(mockCallResponse.content()).thenReturn("""
                {"compatible":false,"issues":["Frontend calls /api/x"],"recommendations":["Add /api/x"],"summary":"mismatch"}
                """);

        JudgeResponse response = llmService.structuredCall("s", "u", JudgeResponse.class);

        assertFalse(response.compatible());
        assertEquals(List.of("Frontend calls /api/x"), response.issues());
        assertEquals("mismatch", response.summary());
    }

    @Test
    @DisplayName("structuredCall falls back to lenient parsing for fenced replies")
    void structuredCallStripsFences() {
        when(mockCallResponse.content()).thenReturn("""
                ```json
                {"compatible":true,"summary":"fine","unexpected":"ignored"}
                ```
                """);

        JudgeResponse response = llmService.structuredCall("s", "u", JudgeResponse.class);

        assertTrue(response.compatible());
        assertEquals("fine", response.summary());
    }

    @Test
    @DisplayName("structuredCall rejects empty content")
    void structuredCallEmpty() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", JudgeResponse.class));
    }

    @Test
    @DisplayName("structuredCall reports unparseable content")
    void structuredCallGarbage() {
        when(mockCallResponse.content()).thenReturn("I could not decide.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", JudgeResponse.class));
    }

    @Test
    @DisplayName("textCall returns the reply unchanged")
    void textCallReturnsReply() {
        when(mockCallResponse.content()).thenReturn("FILE: main.py\n```python\nprint(1)\n```");

        assertEquals("FILE: main.py\n```python\nprint(1)\n```", llmService.textCall("s", "u"));
        verify(mockRequestSpec).user("u");
    }

    @Test
    @DisplayName("textCall rejects a null reply")
    void textCallNull() {
        when(mockCallResponse.content()).thenReturn(null);

        assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("s", "u"));
    }
}
