package io.memoryrunr.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.memory.Memory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;

import java.util.List;

/**
 * Asks a small chat model whether a candidate memory duplicates, supersedes, or is independent of
 * the memories it embeds close to. Existing memories are listed by their short id so the model can
 * name the one it replaces.
 */
public class ChatModelMemoryJudge implements MemoryJudge {

    private static final Logger log = LoggerFactory.getLogger(ChatModelMemoryJudge.class);

    static final String PROMPT = """
            Compare a new memory against existing memories and decide what to do.

            New memory: %s

            Existing memories:
            %s
            Decide:
            - "new": The new memory is genuinely new information
            - "duplicate": The new memory is essentially the same as an existing one (skip it)
            - "supersede": The new memory updates/replaces an existing one (mark old as superseded)

            Respond with valid JSON only:
            {"action": "new|duplicate|supersede", "reason": "explanation", "target_id": "id of memory to supersede if action=supersede"}""";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelMemoryJudge(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public DuplicateVerdict judge(String candidate, List<Memory> similar) {
        if (similar.isEmpty()) {
            return DuplicateVerdict.isNew("no existing memories");
        }
        StringBuilder existing = new StringBuilder();
        for (Memory memory : similar) {
            existing.append("- [").append(memory.shortId()).append("] ").append(memory.content()).append('\n');
        }

        JsonNode json = ModelReplies.askForJson(chatModel, objectMapper, PROMPT.formatted(candidate, existing),
                "Duplicate check");
        DuplicateVerdict verdict = new DuplicateVerdict(
                DuplicateVerdict.Action.fromString(json.path("action").asText(null)),
                json.path("reason").asText(""),
                blankToNull(json.path("target_id").asText(null)));
        log.debug("Duplicate check for '{}': {} ({})", candidate, verdict.action(), verdict.reason());
        return verdict;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
