package io.memoryrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the memory engine.
 *
 * <p>Binds to {@code memory} in application.yml:</p>
 * <pre>
 * memory:
 *   path: ./data/memory
 *   search:
 *     threshold: 0.5
 *     limit: 10
 *     scope: hybrid
 *   formation:
 *     supersede-threshold: 0.85
 *     duplicate-threshold: 0.95
 *   queue:
 *     capacity: 100
 *     shutdown-timeout: 5s
 *   embedding:
 *     provider: ollama        # none | spring-ai | openai | voyage | ollama
 *     model: nomic-embed-text
 *   classifier:
 *     enabled: true
 * </pre>
 *
 * @param path       directory holding {@code memories.db}
 * @param search     serving search defaults
 * @param formation  deduplication thresholds of the formation pipeline
 * @param queue      asynchronous formation queue settings
 * @param embedding  embedding provider selection
 * @param classifier category auto-detection
 */
@ConfigurationProperties(prefix = "memory")
public record MemoryProperties(
        String path,
        Search search,
        Formation formation,
        Queue queue,
        Embedding embedding,
        Classifier classifier
) {

    public MemoryProperties {
        if (path == null || path.isBlank()) {
            path = "./data/memory";
        }
        if (search == null) {
            search = new Search(null, null, null);
        }
        if (formation == null) {
            formation = new Formation(null, null, null);
        }
        if (queue == null) {
            queue = new Queue(null, null);
        }
        if (embedding == null) {
            embedding = new Embedding(null, null, null, null, null, null);
        }
        if (classifier == null) {
            classifier = new Classifier(null);
        }
    }

    public static MemoryProperties defaults() {
        return new MemoryProperties(null, null, null, null, null, null);
    }

    /**
     * @param threshold minimum similarity for served results
     * @param limit     maximum number of served results
     * @param scope     which agents' memories feed prompt context: agent (own and global only),
     *                  global or hybrid (all agents, ranked by similarity)
     */
    public record Search(Double threshold, Integer limit, String scope) {
        public Search {
            if (threshold == null) threshold = 0.5;
            if (limit == null || limit <= 0) limit = 10;
            if (scope == null || scope.isBlank()) scope = "hybrid";
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("memory.search.threshold must be between 0 and 1, got " + threshold);
            }
        }
    }

    /**
     * @param supersedeThreshold similarity at or above which a new memory replaces the existing one
     * @param duplicateThreshold similarity at or above which the new memory is skipped as already known
     * @param supersessionReason reason recorded on memories replaced by formation
     */
    public record Formation(Double supersedeThreshold, Double duplicateThreshold, String supersessionReason) {
        public Formation {
            if (supersedeThreshold == null) supersedeThreshold = 0.85;
            if (duplicateThreshold == null) duplicateThreshold = 0.95;
            if (supersessionReason == null || supersessionReason.isBlank()) {
                supersessionReason = "updated via memory formation";
            }
            if (supersedeThreshold < 0.0 || duplicateThreshold > 1.0 || supersedeThreshold > duplicateThreshold) {
                throw new IllegalArgumentException(
                        "memory.formation thresholds must satisfy 0 <= supersede (%s) <= duplicate (%s) <= 1"
                                .formatted(supersedeThreshold, duplicateThreshold));
            }
        }
    }

    public record Queue(Integer capacity, Duration shutdownTimeout) {
        public Queue {
            if (capacity == null || capacity <= 0) capacity = 100;
            if (shutdownTimeout == null) shutdownTimeout = Duration.ofSeconds(5);
        }
    }

    /**
     * @param provider  none, spring-ai (the auto-configured Spring AI model), openai, voyage or ollama
     * @param endpoint  override of the provider's default URL
     * @param model     override of the provider's default model
     * @param apiKey    override of the provider's API key environment variable
     * @param dimension expected vector dimension, when known up front
     * @param timeout   HTTP request timeout
     */
    public record Embedding(String provider, String endpoint, String model, String apiKey,
                            Integer dimension, Duration timeout) {
        public Embedding {
            if (provider == null || provider.isBlank()) provider = "none";
            if (timeout == null) timeout = Duration.ofSeconds(30);
        }

        public boolean enabled() {
            return !"none".equalsIgnoreCase(provider);
        }
    }

    public record Classifier(Boolean enabled) {
        public Classifier {
            if (enabled == null) enabled = false;
        }
    }
}
