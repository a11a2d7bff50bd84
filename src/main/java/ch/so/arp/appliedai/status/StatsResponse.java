package ch.so.arp.appliedai.status;

/**
 * Store totals reported by {@code /stats}.
 */
public record StatsResponse(String status, long messages, long documents, long chunks) {
}
