package ch.so.arp.appliedai.chat;

import java.util.List;

import ch.so.arp.appliedai.memory.ChatMessage;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate the assistant reply for the ordered message sequence.
     *
     * @param messages system, history and user messages in prompt order
     * @return the reply text, empty when the backend produced no content
     * @throws ch.so.arp.appliedai.error.AssistantException classified as
     *         {@code UNAUTHORIZED}, {@code RATE_LIMITED},
     *         {@code BAD_UPSTREAM_REQUEST} or {@code UPSTREAM_UNAVAILABLE}
     */
    String generate(List<ChatMessage> messages);
}
