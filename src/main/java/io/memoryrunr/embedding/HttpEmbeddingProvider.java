package io.memoryrunr.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Embedding provider that calls a hosted embedding API directly over HTTP.
 *
 * <p>Two wire formats are supported:</p>
 * <ul>
 *   <li>OpenAI-compatible {@code POST /embeddings} with {@code {"model", "input"}} (openai, voyage,
 *       and any custom endpoint)</li>
 *   <li>Ollama {@code POST /api/embeddings} with {@code {"model", "prompt"}}</li>
 * </ul>
 * Returned vectors are L2-normalized.
 */
public class HttpEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpEmbeddingProvider.class);

    /** Known providers: endpoint, default model, dimension, API key environment variable. */
    record ProviderDefaults(String endpoint, String model, int dimension, String keyEnv, boolean ollamaFormat) {}

    static final Map<String, ProviderDefaults> DEFAULTS = Map.of(
            "openai", new ProviderDefaults("https://api.openai.com/v1/embeddings",
                    "text-embedding-3-small", 1536, "OPENAI_API_KEY", false),
            "voyage", new ProviderDefaults("https://api.voyageai.com/v1/embeddings",
                    "voyage-2", 1024, "VOYAGE_API_KEY", false),
            "ollama", new ProviderDefaults("http://localhost:11434/api/embeddings",
                    "nomic-embed-text", 768, null, true)
    );

    private final String provider;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;
    private final boolean ollamaFormat;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    HttpEmbeddingProvider(String provider, String endpoint, String model, String apiKey, int dimension,
                          boolean ollamaFormat, Duration timeout, ObjectMapper mapper) {
        this.provider = provider;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
        this.ollamaFormat = ollamaFormat;
        this.timeout = timeout;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Creates a provider, filling unset values from the provider defaults.
     *
     * @param provider  "openai", "voyage", "ollama", or any other name when {@code endpoint} is given
     * @param endpoint  full URL of the embeddings endpoint, null for the provider default
     * @param model     model name, null for the provider default
     * @param apiKey    API key, null to read the provider's environment variable
     * @param dimension expected dimension, null for the provider default
     * @param timeout   per-request timeout, null for 30 seconds
     * @throws IllegalArgumentException for an unknown provider without endpoint
     */
    public static HttpEmbeddingProvider create(String provider, String endpoint, String model, String apiKey,
                                               Integer dimension, Duration timeout, ObjectMapper mapper) {
        String key = provider == null ? "" : provider.toLowerCase();
        ProviderDefaults defaults = DEFAULTS.get(key);
        if (defaults == null && (endpoint == null || endpoint.isBlank())) {
            throw new IllegalArgumentException(
                    "Unknown embedding provider '%s' and no endpoint specified".formatted(provider));
        }

        String resolvedEndpoint = endpoint != null && !endpoint.isBlank() ? endpoint : defaults.endpoint();
        String resolvedModel = model != null && !model.isBlank() ? model
                : defaults != null ? defaults.model() : null;
        if (resolvedModel == null) {
            throw new IllegalArgumentException("No embedding model specified for provider '%s'".formatted(provider));
        }
        int resolvedDimension = dimension != null ? dimension
                : defaults != null ? defaults.dimension() : -1;
        String resolvedKey = apiKey;
        if ((resolvedKey == null || resolvedKey.isBlank()) && defaults != null && defaults.keyEnv() != null) {
            resolvedKey = System.getenv(defaults.keyEnv());
        }
        boolean ollamaFormat = defaults != null ? defaults.ollamaFormat() : resolvedEndpoint.endsWith("/api/embeddings");

        return new HttpEmbeddingProvider(key, resolvedEndpoint.replaceAll("/+$", ""), resolvedModel, resolvedKey,
                resolvedDimension, ollamaFormat, timeout != null ? timeout : Duration.ofSeconds(30), mapper);
    }

    @Override
    public float[] embed(String text) {
        try {
            Map<String, Object> payload = ollamaFormat
                    ? Map.of("model", model, "prompt", text)
                    : Map.of("model", model, "input", text);
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            HttpResponse<String> resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                log.error("Embedding API error {} from {}: {}", resp.statusCode(), provider, resp.body());
                throw new EmbeddingUnavailableException(
                        "Embedding API error %d from %s".formatted(resp.statusCode(), provider));
            }

            JsonNode root = mapper.readTree(resp.body());
            JsonNode arr = ollamaFormat ? root.path("embedding") : root.path("data").path(0).path("embedding");
            if (!arr.isArray() || arr.isEmpty()) {
                throw new EmbeddingUnavailableException("No embedding returned by " + provider);
            }
            float[] vec = new float[arr.size()];
            for (int i = 0; i < arr.size(); i++) {
                vec[i] = (float) arr.get(i).asDouble();
            }
            return VectorMath.normalize(vec);
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Embedding request to %s failed: %s".formatted(provider, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("Embedding request to " + provider + " interrupted", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return provider + ":" + model;
    }

    String endpoint() {
        return endpoint;
    }

    String model() {
        return model;
    }
}
