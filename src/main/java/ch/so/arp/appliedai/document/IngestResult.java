package ch.so.arp.appliedai.document;

/**
 * Outcome of an ingestion.
 */
public record IngestResult(long documentId, int chunksAdded) {
}
