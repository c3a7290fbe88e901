package io.memoryrunr.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.memory.MemoryException;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Sends a single-turn prompt to a chat model and reads the JSON object out of its reply.
 */
final class ModelReplies {

    private ModelReplies() {
    }

    /**
     * @param task short name of the request, used in error messages ("Memory classification")
     * @throws MemoryException if the model fails or its reply holds no valid JSON object
     */
    static JsonNode askForJson(ChatModel chatModel, ObjectMapper objectMapper, String prompt, String task) {
        String reply;
        try {
            ChatResponse response = chatModel.call(new Prompt(prompt));
            reply = response.getResult().getOutput().getText();
        } catch (RuntimeException e) {
            throw new MemoryException(task + " failed: " + e.getMessage(), e);
        }

        if (reply == null) {
            throw new MemoryException(task + " returned no output");
        }
        // Models sometimes wrap the object in prose or code fences.
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MemoryException(task + " returned no JSON: " + reply);
        }
        try {
            return objectMapper.readTree(reply.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new MemoryException(task + " returned invalid JSON: " + reply, e);
        }
    }
}
