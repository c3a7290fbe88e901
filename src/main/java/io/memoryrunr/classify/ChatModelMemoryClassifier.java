package io.memoryrunr.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.memory.MemoryCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;

/**
 * Classifies memories with a small chat model that answers in JSON:
 * {@code {"category": "...", "confidence": 0.0-1.0}}. Unknown categories fall back to {@code fact}.
 */
public class ChatModelMemoryClassifier implements MemoryClassifier {

    private static final Logger log = LoggerFactory.getLogger(ChatModelMemoryClassifier.class);

    static final String PROMPT = """
            Categorize this piece of information into exactly one category.

            Categories:
            - "preference": User preferences, likes, dislikes, style choices (e.g., "User prefers TypeScript", "User always uses tabs")
            - "fact": Facts about the user, project, or environment (e.g., "User works at Acme", "Project uses PostgreSQL")
            - "correction": Corrections to previous agent behavior (e.g., "that's wrong", "don't do that again")
            - "pattern": Observed patterns in user behavior (e.g., "User usually asks for tests", "User likes verbose output")

            Content: %s

            Respond with valid JSON only:
            {"category": "preference|fact|correction|pattern", "confidence": 0.0-1.0}""";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelMemoryClassifier(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public MemoryCategory classify(String content) {
        JsonNode json = ModelReplies.askForJson(chatModel, objectMapper, PROMPT.formatted(content),
                "Memory classification");
        MemoryCategory category = MemoryCategory.fromString(json.path("category").asText(null));
        log.debug("Classified memory as {} (confidence {})", category.value(), json.path("confidence").asDouble(0.0));
        return category;
    }
}
