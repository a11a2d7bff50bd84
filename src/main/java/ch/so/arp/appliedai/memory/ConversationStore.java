package ch.so.arp.appliedai.memory;

import java.util.List;

/**
 * Append-only log of conversation turns.
 */
public interface ConversationStore {

    /**
     * Append a turn to the conversation. The turn is durable once the method
     * returns.
     *
     * @return the identifier assigned to the turn
     */
    long appendTurn(String conversationId, Role role, String content);

    /**
     * Return up to {@code limit} most recent turns of the conversation, oldest
     * first. Unknown conversations yield an empty list.
     */
    List<Turn> recentTurns(String conversationId, int limit);
}
