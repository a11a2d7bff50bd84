package ch.so.arp.appliedai.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.appliedai.document.DocumentStore;
import ch.so.arp.appliedai.document.StoredChunk;
import ch.so.arp.appliedai.error.AssistantException;

/**
 * {@link Retriever} that scores every chunk of the {@link DocumentStore} with
 * cosine similarity and keeps the best {@code k}.
 */
public class BruteForceRetriever implements Retriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(BruteForceRetriever.class);

    private final DocumentStore documentStore;

    public BruteForceRetriever(DocumentStore documentStore) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
    }

    @Override
    public List<RetrievedChunk> topK(float[] queryVector, int k) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (k < 0) {
            throw AssistantException.invalidInput("k must not be negative but was " + k);
        }
        if (k == 0) {
            return List.of();
        }
        List<StoredChunk> chunks = documentStore.allChunks();
        List<RetrievedChunk> scored = new ArrayList<>(chunks.size());
        for (StoredChunk chunk : chunks) {
            double score = VectorMath.cosineSimilarity(queryVector, chunk.embedding());
            scored.add(new RetrievedChunk(chunk.chunkId(), chunk.documentId(), chunk.content(), score));
        }
        // List.sort is stable, equal scores keep their scan order
        scored.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());
        List<RetrievedChunk> best = scored.size() > k ? List.copyOf(scored.subList(0, k)) : List.copyOf(scored);
        LOGGER.debug("Scanned {} chunks, returning {} (k={})", chunks.size(), best.size(), k);
        return best;
    }
}
