package ch.so.arp.appliedai.memory;

import java.time.Instant;

/**
 * One persisted message of a conversation. Identifiers grow monotonically and
 * define the order of the conversation.
 */
public record Turn(long id, String conversationId, Role role, String content, Instant createdAt) {

    public ChatMessage toMessage() {
        return new ChatMessage(role, content);
    }
}
