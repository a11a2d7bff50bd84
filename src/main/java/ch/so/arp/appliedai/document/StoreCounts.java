package ch.so.arp.appliedai.document;

/**
 * Row counts of the durable store.
 */
public record StoreCounts(long documents, long chunks, long turns) {
}
