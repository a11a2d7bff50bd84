package ch.so.arp.appliedai.chat;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the retrieval and memory pipeline.
 */
@ConfigurationProperties(prefix = "rag.assistant")
public class AssistantProperties {

    /**
     * Maximum length of an ingested fragment in characters.
     */
    private int chunkSize = 800;

    /**
     * Number of fragments added as context to a chat request.
     */
    private int topK = 4;

    /**
     * Number of prior turns replayed to the language model.
     */
    private int historyLimit = 20;

    /**
     * Output dimension of the embedding backend. Fixed for the lifetime of a
     * store.
     */
    private int embeddingDimensions = 1536;

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }
}
