package io.memoryrunr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.classify.ChatModelMemoryClassifier;
import io.memoryrunr.classify.ChatModelMemoryJudge;
import io.memoryrunr.classify.MemoryClassifier;
import io.memoryrunr.classify.MemoryJudge;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.embedding.HttpEmbeddingProvider;
import io.memoryrunr.embedding.SpringAiEmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the optional collaborators of the memory engine.
 *
 * <p>{@code memory.embedding.provider} selects the embedding backend:</p>
 * <ul>
 *   <li>{@code none}: no provider, search is unavailable and formation only catches identical content</li>
 *   <li>{@code spring-ai}: the auto-configured Spring AI {@link EmbeddingModel}</li>
 *   <li>{@code openai}, {@code voyage}, {@code ollama}: direct HTTP calls with per-provider defaults</li>
 * </ul>
 * <p>{@code memory.classifier.enabled=true} puts the Spring AI {@link ChatModel} to work on two small
 * decisions: picking a category when none is given, and judging whether a close match is a duplicate
 * or a replacement. Without it formation falls back to the similarity thresholds.</p>
 */
@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    static final String SPRING_AI = "spring-ai";

    @Bean
    @ConditionalOnExpression("!'${memory.embedding.provider:none}'.equalsIgnoreCase('none')")
    public EmbeddingProvider embeddingProvider(MemoryProperties properties,
                                               ObjectProvider<EmbeddingModel> embeddingModel,
                                               ObjectMapper objectMapper) {
        MemoryProperties.Embedding config = properties.embedding();
        EmbeddingProvider provider;
        if (SPRING_AI.equalsIgnoreCase(config.provider())) {
            EmbeddingModel model = embeddingModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException(
                        "memory.embedding.provider=spring-ai but no Spring AI EmbeddingModel is configured");
            }
            provider = new SpringAiEmbeddingProvider(model, config.dimension());
        } else {
            provider = HttpEmbeddingProvider.create(config.provider(), config.endpoint(), config.model(),
                    config.apiKey(), config.dimension(), config.timeout(), objectMapper);
        }
        log.info("Memory embeddings enabled: {} (dimension {})", provider.name(), provider.dimension());
        return provider;
    }

    @Bean
    @ConditionalOnProperty(prefix = "memory.classifier", name = "enabled", havingValue = "true")
    public MemoryClassifier memoryClassifier(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        ChatModel model = requireChatModel(chatModel);
        log.info("Memory category auto-detection enabled: {}", model.getClass().getSimpleName());
        return new ChatModelMemoryClassifier(model, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "memory.classifier", name = "enabled", havingValue = "true")
    public MemoryJudge memoryJudge(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        ChatModel model = requireChatModel(chatModel);
        log.info("Memory duplicate judgement enabled: {}", model.getClass().getSimpleName());
        return new ChatModelMemoryJudge(model, objectMapper);
    }

    private static ChatModel requireChatModel(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException("memory.classifier.enabled=true but no Spring AI ChatModel is configured");
        }
        return model;
    }
}
