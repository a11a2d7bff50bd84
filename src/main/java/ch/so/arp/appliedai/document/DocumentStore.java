package ch.so.arp.appliedai.document;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of ingested documents and their embedded chunks. All chunks
 * of a store share one embedding dimension.
 */
public interface DocumentStore {

    /**
     * Persist a new document.
     *
     * @param name display name of the document
     * @return the identifier assigned to the document
     */
    long createDocument(String name);

    /**
     * Persist a chunk of an existing document.
     *
     * @return the identifier assigned to the chunk
     * @throws ch.so.arp.appliedai.error.AssistantException {@code NOT_FOUND}
     *         when the document does not exist, {@code INVALID_INPUT} when the
     *         content is empty or the embedding dimension differs from the
     *         stored chunks
     */
    long addChunk(long documentId, String content, float[] embedding);

    /**
     * Full scan over all chunks. The order is unspecified.
     */
    List<StoredChunk> allChunks();

    Optional<Document> findDocument(long documentId);

    List<Document> listDocuments();

    /**
     * Contents of the document's chunks in insertion order.
     */
    List<String> documentChunks(long documentId);

    /**
     * Delete the document together with all of its chunks.
     */
    void deleteDocument(long documentId);

    StoreCounts counts();
}
