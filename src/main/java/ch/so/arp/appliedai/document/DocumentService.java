package ch.so.arp.appliedai.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import ch.so.arp.appliedai.chat.AssistantProperties;
import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.retrieval.EmbeddingProvider;
import ch.so.arp.appliedai.retrieval.TextChunker;

/**
 * Ingests raw text into the document store and manages stored documents.
 */
@Service
public class DocumentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentStore documentStore;
    private final EmbeddingProvider embeddingProvider;
    private final TransactionOperations transactions;
    private final int chunkSize;

    public DocumentService(DocumentStore documentStore, EmbeddingProvider embeddingProvider,
            TransactionOperations transactions, AssistantProperties properties) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.chunkSize = properties.getChunkSize();
    }

    /**
     * Split the text, embed every fragment and store the document with its
     * chunks. Embedding happens before anything is written and the writes run
     * in one transaction, so a failed ingestion leaves no document behind.
     */
    public IngestResult ingest(String name, String text) {
        if (name == null || name.isBlank()) {
            throw AssistantException.invalidInput("Document name must not be blank");
        }
        List<String> fragments = TextChunker.split(text, chunkSize);
        List<float[]> embeddings = new ArrayList<>(fragments.size());
        for (String fragment : fragments) {
            embeddings.add(embeddingProvider.embed(fragment));
        }

        Long documentId = transactions.execute(status -> {
            long id = documentStore.createDocument(name);
            for (int i = 0; i < fragments.size(); i++) {
                documentStore.addChunk(id, fragments.get(i), embeddings.get(i));
            }
            return id;
        });

        LOGGER.info("Ingested document '{}' as {} with {} chunks", name, documentId, fragments.size());
        return new IngestResult(Objects.requireNonNull(documentId, "documentId"), fragments.size());
    }

    public List<Document> listDocuments() {
        return documentStore.listDocuments();
    }

    public Document getDocument(long documentId) {
        return documentStore.findDocument(documentId)
                .orElseThrow(() -> AssistantException.notFound("Document " + documentId + " does not exist"));
    }

    /**
     * Rebuild the stored text of a document from its chunks.
     */
    public String documentText(long documentId) {
        return String.join("", documentStore.documentChunks(documentId));
    }

    public void deleteDocument(long documentId) {
        documentStore.deleteDocument(documentId);
    }
}
