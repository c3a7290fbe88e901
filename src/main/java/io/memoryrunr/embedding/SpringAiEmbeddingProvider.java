package io.memoryrunr.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Embedding provider backed by a Spring AI {@link EmbeddingModel} (Ollama, OpenAI, ... depending on
 * which starter is configured).
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final int dimension;

    /**
     * @param embeddingModel the Spring AI model
     * @param dimension      expected dimension, or null to leave it unknown (asking the model costs a call)
     */
    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, Integer dimension) {
        this.embeddingModel = embeddingModel;
        this.dimension = dimension != null ? dimension : -1;
    }

    @Override
    public float[] embed(String text) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            log.debug("Spring AI embedding call failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Embedding model call failed: " + e.getMessage(), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return VectorMath.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "spring-ai:" + embeddingModel.getClass().getSimpleName();
    }
}
