package ch.so.arp.appliedai.openai;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import ch.so.arp.appliedai.chat.LlmClient;
import ch.so.arp.appliedai.error.FailureKind;
import ch.so.arp.appliedai.memory.ChatMessage;

/**
 * {@link LlmClient} calling the OpenAI chat completions endpoint through the
 * shared {@link RestClient}.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final String model;

    public OpenAiLlmClient(RestClient restClient, OpenAiClientProperties properties) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = properties.getModel();
    }

    @Override
    public String generate(List<ChatMessage> messages) {
        LOGGER.debug("Requesting completion from {} with {} messages", model, messages.size());
        OpenAiApi.ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri(OpenAiApi.CHAT_COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new OpenAiApi.ChatCompletionRequest(model, messages))
                    .retrieve()
                    .body(OpenAiApi.ChatCompletionResponse.class);
        } catch (RestClientException ex) {
            throw OpenAiFailures.classify("Chat completion", ex, FailureKind.UPSTREAM_UNAVAILABLE);
        }
        return firstContent(response);
    }

    private static String firstContent(OpenAiApi.ChatCompletionResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            return "";
        }
        OpenAiApi.Message message = response.choices().get(0).message();
        if (message == null || message.content() == null) {
            return "";
        }
        return message.content();
    }
}
