package ch.so.arp.appliedai.document;

import java.time.Instant;

/**
 * Ingested document as listed by the store, including the number of chunks it
 * owns.
 */
public record Document(long id, String name, Instant createdAt, long chunkCount) {
}
