package ch.so.arp.appliedai.document;

/**
 * Chunk row as returned by the full scan used for retrieval.
 */
public record StoredChunk(long chunkId, long documentId, String content, float[] embedding) {
}
