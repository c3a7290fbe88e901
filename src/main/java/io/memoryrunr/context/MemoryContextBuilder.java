package io.memoryrunr.context;

import io.memoryrunr.config.MemoryProperties;
import io.memoryrunr.memory.Memory;
import io.memoryrunr.memory.MemoryException;
import io.memoryrunr.search.MemorySearchService;
import io.memoryrunr.search.SearchOptions;
import io.memoryrunr.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recalls memories relevant to the current message and renders them as a system prompt section.
 *
 * <pre>
 * &lt;user_context&gt;
 * The following memories were retrieved from previous interactions with this user.
 * Use this context to provide more personalized and contextual responses.
 *
 * 1. [preference] User prefers light mode
 * 2. [fact] Project uses PostgreSQL
 *    (from: reviewer, path: /work/api)
 * &lt;/user_context&gt;
 * </pre>
 */
@Component
public class MemoryContextBuilder {

    private static final Logger log = LoggerFactory.getLogger(MemoryContextBuilder.class);

    private final MemorySearchService searchService;
    private final MemoryProperties.Search config;

    public MemoryContextBuilder(MemorySearchService searchService, MemoryProperties properties) {
        this.searchService = searchService;
        this.config = properties.search();
    }

    /**
     * Builds the memory section for a conversation turn.
     *
     * @param query       the current user message
     * @param agentHandle the agent being prompted
     * @param pathScope   working directory of the conversation, or null
     * @return the rendered section, or an empty string when nothing relevant is remembered
     */
    public String build(String query, String agentHandle, String pathScope) {
        if (query == null || query.isBlank() || !searchService.isAvailable()) {
            return "";
        }

        SearchOptions options = new SearchOptions(agentFilter(agentHandle), pathScope,
                config.threshold(), config.limit(), Set.of());
        List<SearchResult> results;
        try {
            results = searchService.search(query, options);
        } catch (MemoryException e) {
            log.warn("Memory recall failed, continuing without memory context: {}", e.getMessage());
            return "";
        }
        return format(results, agentHandle);
    }

    /**
     * Appends a memory section to a system prompt. An empty section leaves the prompt unchanged.
     */
    public String inject(String systemPrompt, String section) {
        if (section == null || section.isEmpty()) {
            return systemPrompt;
        }
        return systemPrompt + "\n\n" + section;
    }

    String format(List<SearchResult> results, String agentHandle) {
        if (results.isEmpty()) {
            return "";
        }

        var sb = new StringBuilder();
        sb.append("<user_context>\n");
        sb.append("The following memories were retrieved from previous interactions with this user.\n");
        sb.append("Use this context to provide more personalized and contextual responses.\n\n");

        int n = 1;
        for (SearchResult result : results) {
            Memory memory = result.memory();
            sb.append("%d. [%s] %s\n".formatted(n++, memory.category().value(), memory.content()));

            List<String> meta = new ArrayList<>();
            if (memory.agentHandle() != null && !memory.agentHandle().equals(agentHandle)) {
                meta.add("from: " + memory.agentHandle());
            }
            if (memory.pathScope() != null) {
                meta.add("path: " + memory.pathScope());
            }
            if (!meta.isEmpty()) {
                sb.append("   (").append(String.join(", ", meta)).append(")\n");
            }
        }

        sb.append("</user_context>\n");
        return sb.toString();
    }

    private String agentFilter(String agentHandle) {
        return "agent".equalsIgnoreCase(config.scope()) ? agentHandle : null;
    }
}
