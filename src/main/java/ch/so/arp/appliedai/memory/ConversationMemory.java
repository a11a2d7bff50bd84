package ch.so.arp.appliedai.memory;

import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

/**
 * Loads the tail of a conversation in the shape consumed by the generation
 * backend.
 */
@Component
public class ConversationMemory {

    private final ConversationStore conversationStore;

    public ConversationMemory(ConversationStore conversationStore) {
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore");
    }

    public List<ChatMessage> recentMessages(String conversationId, int limit) {
        return conversationStore.recentTurns(conversationId, limit).stream().map(Turn::toMessage).toList();
    }
}
