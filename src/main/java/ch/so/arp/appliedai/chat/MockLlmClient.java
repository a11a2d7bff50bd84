package ch.so.arp.appliedai.chat;

import java.util.List;

import ch.so.arp.appliedai.memory.ChatMessage;
import ch.so.arp.appliedai.memory.Role;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted.
 */
class MockLlmClient implements LlmClient {

    @Override
    public String generate(List<ChatMessage> messages) {
        String question = "";
        long contextMessages = 0;
        for (ChatMessage message : messages) {
            if (message.role() == Role.USER) {
                question = message.content();
            } else if (message.role() == Role.SYSTEM) {
                contextMessages++;
            }
        }
        return "[mocked answer] Question was: " + question
                + " (messages: " + messages.size() + ", context: " + (contextMessages > 0 ? "yes" : "none") + ")";
    }
}
