package ch.so.arp.appliedai.openai;

import java.util.Objects;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;
import ch.so.arp.appliedai.retrieval.EmbeddingProvider;

/**
 * {@link EmbeddingProvider} calling the OpenAI embeddings endpoint. The
 * requested dimension is pinned so that every stored chunk shares it.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final RestClient restClient;
    private final String model;
    private final int dimensions;

    public OpenAiEmbeddingProvider(RestClient restClient, OpenAiClientProperties properties, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = properties.getEmbeddingModel();
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        OpenAiApi.EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri(OpenAiApi.EMBEDDINGS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new OpenAiApi.EmbeddingRequest(model, text, dimensions))
                    .retrieve()
                    .body(OpenAiApi.EmbeddingResponse.class);
        } catch (RestClientException ex) {
            throw OpenAiFailures.classify("Embedding", ex, FailureKind.EMBEDDING_UNAVAILABLE);
        }
        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            throw new AssistantException(FailureKind.EMBEDDING_UNAVAILABLE, "Embedding response contained no vector");
        }
        float[] embedding = response.data().get(0).embedding();
        if (embedding.length != dimensions) {
            throw new AssistantException(FailureKind.EMBEDDING_UNAVAILABLE,
                    "Embedding backend returned " + embedding.length + " dimensions, expected " + dimensions);
        }
        return embedding;
    }
}
