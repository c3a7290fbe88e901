package io.memoryrunr.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpEmbeddingProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        return "http://127.0.0.1:%d%s".formatted(server.getAddress().getPort(), path);
    }

    @Test
    void shouldCallOpenAiCompatibleEndpoint() throws Exception {
        String url = respond("/v1/embeddings", 200, """
                {"data": [{"embedding": [3.0, 4.0]}]}
                """);
        var provider = HttpEmbeddingProvider.create("openai", url, "text-embedding-3-small", "sk-test",
                2, Duration.ofSeconds(5), mapper);

        float[] vector = provider.embed("User prefers dark mode");

        assertEquals(0.6f, vector[0], 1e-6f);
        assertEquals(0.8f, vector[1], 1e-6f);
        assertEquals("Bearer sk-test", lastAuth.get());
        var sent = mapper.readTree(lastBody.get());
        assertEquals("text-embedding-3-small", sent.get("model").asText());
        assertEquals("User prefers dark mode", sent.get("input").asText());
    }

    @Test
    void shouldCallOllamaEndpoint() throws Exception {
        String url = respond("/api/embeddings", 200, """
                {"embedding": [0.0, 2.0, 0.0]}
                """);
        var provider = HttpEmbeddingProvider.create("ollama", url, null, null, null, null, mapper);

        float[] vector = provider.embed("hello");

        assertArrayEquals(new float[]{0.0f, 1.0f, 0.0f}, vector);
        assertNull(lastAuth.get());
        var sent = mapper.readTree(lastBody.get());
        assertEquals("nomic-embed-text", sent.get("model").asText());
        assertEquals("hello", sent.get("prompt").asText());
        assertEquals(768, provider.dimension());
    }

    @Test
    void shouldInferOllamaFormatForCustomEndpoint() {
        String url = respond("/api/embeddings", 200, """
                {"embedding": [1.0]}
                """);
        var provider = HttpEmbeddingProvider.create("local", url, "mxbai-embed-large", null, null, null, mapper);

        assertArrayEquals(new float[]{1.0f}, provider.embed("x"));
        assertEquals(-1, provider.dimension());
    }

    @Test
    void shouldFailOnErrorStatus() {
        String url = respond("/v1/embeddings", 401, """
                {"error": "invalid key"}
                """);
        var provider = HttpEmbeddingProvider.create("voyage", url, null, "bad", null, null, mapper);

        var e = assertThrows(EmbeddingUnavailableException.class, () -> provider.embed("x"));
        assertTrue(e.getMessage().contains("401"));
    }

    @Test
    void shouldFailOnMissingEmbedding() {
        String url = respond("/v1/embeddings", 200, """
                {"data": []}
                """);
        var provider = HttpEmbeddingProvider.create("openai", url, null, "k", null, null, mapper);

        assertThrows(EmbeddingUnavailableException.class, () -> provider.embed("x"));
    }

    @Test
    void shouldFailWhenUnreachable() {
        var provider = HttpEmbeddingProvider.create("openai", "http://127.0.0.1:1/v1/embeddings", null, "k",
                null, Duration.ofSeconds(2), mapper);

        assertThrows(EmbeddingUnavailableException.class, () -> provider.embed("x"));
    }

    @Test
    void shouldApplyProviderDefaults() {
        var provider = HttpEmbeddingProvider.create("voyage", null, null, "k", null, null, mapper);

        assertEquals("https://api.voyageai.com/v1/embeddings", provider.endpoint());
        assertEquals("voyage-2", provider.model());
        assertEquals(1024, provider.dimension());
        assertEquals("voyage:voyage-2", provider.name());
    }

    @Test
    void shouldRejectUnknownProviderWithoutEndpoint() {
        assertThrows(IllegalArgumentException.class,
                () -> HttpEmbeddingProvider.create("acme", null, "m", null, null, null, mapper));
    }
}
