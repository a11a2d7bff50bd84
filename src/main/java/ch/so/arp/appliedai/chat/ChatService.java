package ch.so.arp.appliedai.chat;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.memory.ChatMessage;
import ch.so.arp.appliedai.memory.ConversationMemory;
import ch.so.arp.appliedai.memory.ConversationStore;
import ch.so.arp.appliedai.memory.Role;
import ch.so.arp.appliedai.retrieval.EmbeddingProvider;
import ch.so.arp.appliedai.retrieval.RetrievedChunk;
import ch.so.arp.appliedai.retrieval.Retriever;

/**
 * Answers a chat message: loads the conversation tail, retrieves related
 * document fragments, asks the language model and records the exchange.
 * Nothing is retried. A classified failure aborts the request before any turn
 * is written.
 */
@Service
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final ConversationMemory conversationMemory;
    private final ConversationStore conversationStore;
    private final EmbeddingProvider embeddingProvider;
    private final Retriever retriever;
    private final PromptAssembler promptAssembler;
    private final LlmClient llmClient;
    private final int historyLimit;
    private final int topK;

    public ChatService(ConversationMemory conversationMemory, ConversationStore conversationStore,
            EmbeddingProvider embeddingProvider, Retriever retriever, PromptAssembler promptAssembler,
            LlmClient llmClient, AssistantProperties properties) {
        this.conversationMemory = Objects.requireNonNull(conversationMemory, "conversationMemory");
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.promptAssembler = Objects.requireNonNull(promptAssembler, "promptAssembler");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.historyLimit = properties.getHistoryLimit();
        this.topK = properties.getTopK();
    }

    public ChatResponse chat(String conversationId, String message) {
        if (conversationId == null || conversationId.isBlank()) {
            throw AssistantException.invalidInput("conversationId must not be blank");
        }
        if (message == null || message.isBlank()) {
            throw AssistantException.invalidInput("message must not be blank");
        }
        List<ChatMessage> history = conversationMemory.recentMessages(conversationId, historyLimit);
        float[] queryEmbedding = embeddingProvider.embed(message);
        List<String> fragments = retriever.topK(queryEmbedding, topK).stream()
                .map(RetrievedChunk::content)
                .toList();
        List<ChatMessage> prompt = promptAssembler.assemble(fragments, history, message);
        LOGGER.debug("Conversation '{}': {} prior turns, {} fragments, {} prompt messages", conversationId,
                history.size(), fragments.size(), prompt.size());

        String answer = Objects.requireNonNullElse(llmClient.generate(prompt), "");

        // the user turn is always written before the assistant turn
        conversationStore.appendTurn(conversationId, Role.USER, message);
        conversationStore.appendTurn(conversationId, Role.ASSISTANT, answer);
        return new ChatResponse(answer);
    }

    public List<ChatMessage> history(String conversationId, int limit) {
        return conversationMemory.recentMessages(conversationId, limit);
    }
}
