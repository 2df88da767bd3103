package com.opsassistant.core.llm;

import com.opsassistant.core.verification.QualityAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        var properties = new LlmProperties();
        properties.setModel("gpt-4o-mini");
        properties.setTemperature(0.1);
        llmService = new LlmService(mockBuilder, properties, "http://test:1234");
    }

    @Nested
    @DisplayName("completeJson")
    class CompleteJson {

        @Test
        @DisplayName("parses a bare JSON object")
        void bareObject() {
            when(mockCallResponse.content()).thenReturn("{\"intent\":\"search\",\"steps\":[]}");

            Map<String, Object> result = llmService.completeJson("sys", "user", 500);

            assertEquals("search", result.get("intent"));
            assertEquals(List.of(), result.get("steps"));
            verify(mockRequestSpec).system("sys");
            verify(mockRequestSpec).user("user");
        }

        @Test
        @DisplayName("strips markdown fences and surrounding prose")
        void fencedObject() {
            when(mockCallResponse.content()).thenReturn("```json\n{\"intent\":\"compare\"}\n```");
            assertEquals("compare", llmService.completeJson("sys", "user", 500).get("intent"));

            when(mockCallResponse.content()).thenReturn("Here is your plan: {\"intent\":\"mixed\"} Hope it helps");
            assertEquals("mixed", llmService.completeJson("sys", "user", 500).get("intent"));
        }

        @Test
        @DisplayName("passes temperature, token limit and model as options")
        void options() {
            when(mockCallResponse.content()).thenReturn("{}");

            llmService.completeJson("sys", "user", 777);

            var captor = ArgumentCaptor.forClass(ChatOptions.class);
            verify(mockRequestSpec).options(captor.capture());
            assertEquals(777, captor.getValue().getMaxTokens());
            assertEquals(0.1, captor.getValue().getTemperature());
            assertEquals("gpt-4o-mini", captor.getValue().getModel());
        }

        @Test
        @DisplayName("non-JSON content raises LlmParseException with the raw response")
        void notJson() {
            when(mockCallResponse.content()).thenReturn("I cannot help with that");

            var e = assertThrows(LlmParseException.class, () -> llmService.completeJson("sys", "user", 500));
            assertEquals("I cannot help with that", e.rawResponse());
        }

        @Test
        @DisplayName("blank content raises LlmEmptyResponseException")
        void blank() {
            when(mockCallResponse.content()).thenReturn("  ");
            assertThrows(LlmEmptyResponseException.class, () -> llmService.completeJson("sys", "user", 500));
        }
    }

    @Nested
    @DisplayName("structuredCall")
    class StructuredCall {

        @Test
        @DisplayName("appends format instructions and deserializes the response")
        void deserializes() {
            when(mockCallResponse.content()).thenReturn("""
                    {"formatted_output":"London 15C","summary":"Fetched weather","issues":[],
                     "recommendations":["Add Paris"],"confidence_score":0.9}
                    """);

            QualityAssessment result = llmService.structuredCall("Verify", "Results", QualityAssessment.class, 900);

            assertEquals("London 15C", result.formattedOutput());
            assertEquals(List.of("Add Paris"), result.recommendations());
            assertEquals(0.9, result.confidenceScore());
            var userCaptor = ArgumentCaptor.forClass(String.class);
            verify(mockRequestSpec).user(userCaptor.capture());
            assertTrue(userCaptor.getValue().startsWith("Results\n\n"));
            assertTrue(userCaptor.getValue().length() > "Results\n\n".length());
        }

        @Test
        @DisplayName("falls back to lenient parsing for fenced responses with prose")
        void lenientFallback() {
            when(mockCallResponse.content()).thenReturn(
                    "Sure:\n{\"summary\":\"ok\",\"issues\":\"single issue\",\"confidence_score\":0.4} done");

            QualityAssessment result = llmService.structuredCall("Verify", "Results", QualityAssessment.class, 900);

            assertEquals("ok", result.summary());
            assertEquals(List.of("single issue"), result.issues());
        }
    }

    @Nested
    @DisplayName("backend failures")
    class BackendFailures {

        @Test
        @DisplayName("client exceptions surface as LlmUnavailableException")
        void wrapsFailures() {
            when(mockRequestSpec.call()).thenThrow(new TransientAiException("503 Service Unavailable"));

            var e = assertThrows(LlmUnavailableException.class, () -> llmService.completeText("sys", "user", 100));
            assertEquals(LlmFailure.UNAVAILABLE, e.failure());
        }

        @Test
        @DisplayName("classifies timeouts, connection errors and rejections")
        void classify() {
            assertEquals(LlmFailure.TIMEOUT,
                    LlmService.classify(new RuntimeException(new SocketTimeoutException("read timed out"))));
            assertEquals(LlmFailure.UNAVAILABLE,
                    LlmService.classify(new RuntimeException(new ConnectException("refused"))));
            assertEquals(LlmFailure.AUTHENTICATION,
                    LlmService.classify(new NonTransientAiException("401 - Incorrect API key provided")));
            assertEquals(LlmFailure.REJECTED,
                    LlmService.classify(new NonTransientAiException("400 - context length exceeded")));
            assertEquals(LlmFailure.TRANSPORT, LlmService.classify(new IllegalStateException("weird")));
        }
    }

    @Test
    @DisplayName("extractJsonObject leaves clean JSON untouched")
    void extractJsonObject() {
        assertEquals("{\"a\":1}", LlmService.extractJsonObject("{\"a\":1}"));
        assertEquals("{\"a\":1}", LlmService.extractJsonObject("```\n{\"a\":1}\n```"));
    }
}
