package ch.so.arp.appliedai.chat;

import java.net.http.HttpClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import ch.so.arp.appliedai.document.DocumentStore;
import ch.so.arp.appliedai.document.JdbcDocumentStore;
import ch.so.arp.appliedai.memory.ConversationStore;
import ch.so.arp.appliedai.memory.JdbcConversationStore;
import ch.so.arp.appliedai.openai.OpenAiClientProperties;
import ch.so.arp.appliedai.openai.OpenAiEmbeddingProvider;
import ch.so.arp.appliedai.openai.OpenAiLlmClient;
import ch.so.arp.appliedai.retrieval.BruteForceRetriever;
import ch.so.arp.appliedai.retrieval.DeterministicEmbeddingProvider;
import ch.so.arp.appliedai.retrieval.EmbeddingProvider;
import ch.so.arp.appliedai.retrieval.Retriever;

/**
 * Central configuration wiring the chat components together. The
 * {@code rag.chat.mock-openai} toggle decides whether the deterministic
 * backends or the OpenAI clients are used.
 */
@Configuration
@EnableConfigurationProperties({ OpenAiClientProperties.class, AssistantProperties.class })
public class ChatConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatConfiguration.class);

    static final String MOCK_OPENAI_PROPERTY = "rag.chat.mock-openai";

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore(JdbcClient jdbcClient) {
        return new JdbcDocumentStore(jdbcClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationStore conversationStore(JdbcClient jdbcClient) {
        return new JdbcConversationStore(jdbcClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public Retriever retriever(DocumentStore documentStore) {
        return new BruteForceRetriever(documentStore);
    }

    @Bean
    @ConditionalOnProperty(name = MOCK_OPENAI_PROPERTY, havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = MOCK_OPENAI_PROPERTY, havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(AssistantProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbeddingDimensions());
    }

    /**
     * The one HTTP client shared by every OpenAI call of the process.
     */
    @Bean
    @ConditionalOnProperty(name = MOCK_OPENAI_PROPERTY, havingValue = "false")
    public RestClient openAiRestClient(RestClient.Builder builder, OpenAiClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'rag.chat.openai.api-key' or OPENAI_API_KEY must be provided when mocks are disabled");
        }
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getTimeout());
        LOGGER.info("Using OpenAI at {} (chat model {}, embedding model {})", properties.getBaseUrl(),
                properties.getModel(), properties.getEmbeddingModel());
        return builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = MOCK_OPENAI_PROPERTY, havingValue = "false")
    public LlmClient openAiLlmClient(RestClient openAiRestClient, OpenAiClientProperties properties) {
        return new OpenAiLlmClient(openAiRestClient, properties);
    }

    @Bean
    @ConditionalOnProperty(name = MOCK_OPENAI_PROPERTY, havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(RestClient openAiRestClient, OpenAiClientProperties properties,
            AssistantProperties assistantProperties) {
        return new OpenAiEmbeddingProvider(openAiRestClient, properties, assistantProperties.getEmbeddingDimensions());
    }
}
