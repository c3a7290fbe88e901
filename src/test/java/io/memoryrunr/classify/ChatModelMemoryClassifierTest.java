package io.memoryrunr.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.memory.MemoryCategory;
import io.memoryrunr.memory.MemoryException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatModelMemoryClassifierTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final ChatModelMemoryClassifier classifier = new ChatModelMemoryClassifier(chatModel, new ObjectMapper());

    private void reply(String text) {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }

    @Test
    void shouldParseCategoryFromJsonReply() {
        reply("""
                {"category": "preference", "confidence": 0.92}""");

        assertEquals(MemoryCategory.PREFERENCE, classifier.classify("User always uses tabs"));
    }

    @Test
    void shouldSendContentInPrompt() {
        reply("{\"category\": \"fact\", \"confidence\": 0.8}");

        classifier.classify("Project uses PostgreSQL");

        var prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());
        assertTrue(prompt.getValue().getContents().contains("Content: Project uses PostgreSQL"));
    }

    @Test
    void shouldExtractJsonWrappedInCodeFence() {
        reply("""
                ```json
                {"category": "correction", "confidence": 0.7}
                ```""");

        assertEquals(MemoryCategory.CORRECTION, classifier.classify("That's wrong, don't do that again"));
    }

    @Test
    void shouldFallBackToFactForUnknownCategory() {
        reply("{\"category\": \"opinion\", \"confidence\": 0.5}");

        assertEquals(MemoryCategory.FACT, classifier.classify("Pineapple belongs on pizza"));
    }

    @Test
    void shouldFailOnNonJsonReply() {
        reply("I think this is a preference.");

        assertThrows(MemoryException.class, () -> classifier.classify("User prefers vim"));
    }

    @Test
    void shouldWrapModelErrors() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new RuntimeException("LLM unavailable"));

        var e = assertThrows(MemoryException.class, () -> classifier.classify("User prefers vim"));
        assertTrue(e.getMessage().contains("LLM unavailable"));
    }
}
