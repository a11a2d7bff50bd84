package ch.so.arp.appliedai.retrieval;

/**
 * A stored fragment together with its similarity to the query vector.
 */
public record RetrievedChunk(long chunkId, long documentId, String content, double score) {
}
