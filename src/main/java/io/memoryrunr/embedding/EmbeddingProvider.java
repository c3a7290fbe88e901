package io.memoryrunr.embedding;

/**
 * Turns text into a fixed-length vector for similarity search.
 *
 * <p>The memory engine treats a provider as optional: without one, memories are stored
 * without vectors and only search refuses to run.</p>
 */
public interface EmbeddingProvider extends AutoCloseable {

    /**
     * Generates an embedding vector for the given text.
     *
     * @throws EmbeddingUnavailableException if the backing model cannot produce a vector
     */
    float[] embed(String text);

    /**
     * The vector dimension this provider produces, or -1 if not known until the first call.
     */
    int dimension();

    /** Short name used in logs and status output. */
    String name();

    /** Releases held resources (model processes, network clients). */
    @Override
    default void close() {
    }
}
