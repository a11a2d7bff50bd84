package ch.so.arp.appliedai.openai;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import ch.so.arp.appliedai.memory.ChatMessage;

/**
 * Wire shapes of the OpenAI endpoints used by the service. Only the fields we
 * read are mapped.
 */
final class OpenAiApi {

    static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    static final String EMBEDDINGS_PATH = "/embeddings";

    private OpenAiApi() {
    }

    record ChatCompletionRequest(String model, List<ChatMessage> messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(int index, Message message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EmbeddingRequest(String model, String input, Integer dimensions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
