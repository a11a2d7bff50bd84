package ch.so.arp.appliedai.retrieval;

/**
 * Strategy abstraction used to compute embeddings for document fragments and
 * questions. Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws ch.so.arp.appliedai.error.AssistantException classified as
     *         {@code EMBEDDING_UNAVAILABLE}, {@code UNAUTHORIZED},
     *         {@code RATE_LIMITED} or {@code BAD_UPSTREAM_REQUEST}
     */
    float[] embed(String text);
}
