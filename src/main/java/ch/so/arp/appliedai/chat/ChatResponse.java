package ch.so.arp.appliedai.chat;

/**
 * Assistant reply returned to the caller.
 */
public record ChatResponse(String response) {
}
