package ch.so.arp.appliedai.document;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;

/**
 * {@link DocumentStore} backed by the {@code documents} and {@code chunks}
 * tables. Embeddings are stored as vector literals ({@code [0.1,0.2,...]})
 * so the schema runs unchanged on H2 and PostgreSQL.
 */
public class JdbcDocumentStore implements DocumentStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcDocumentStore.class);

    private static final String INSERT_DOCUMENT_SQL = "INSERT INTO documents (name) VALUES (:name)";

    private static final String INSERT_CHUNK_SQL = """
            INSERT INTO chunks (document_id, content, embedding, dimensions)
            VALUES (:documentId, :content, :embedding, :dimensions)
            """;

    private static final String DOCUMENT_EXISTS_SQL = "SELECT COUNT(*) FROM documents WHERE id = :id";

    private static final String STORED_DIMENSIONS_SQL = "SELECT dimensions FROM chunks FETCH FIRST 1 ROWS ONLY";

    private static final String ALL_CHUNKS_SQL = """
            SELECT id, document_id, content, embedding
            FROM chunks
            ORDER BY id
            """;

    private static final String DOCUMENTS_SQL = """
            SELECT d.id, d.name, d.created_at, COUNT(c.id) AS chunk_count
            FROM documents d
            LEFT JOIN chunks c ON c.document_id = d.id
            %s
            GROUP BY d.id, d.name, d.created_at
            ORDER BY d.id
            """;

    private static final String DOCUMENT_CHUNKS_SQL = """
            SELECT content
            FROM chunks
            WHERE document_id = :id
            ORDER BY id
            """;

    private static final String DELETE_DOCUMENT_SQL = "DELETE FROM documents WHERE id = :id";

    private static final String COUNTS_SQL = """
            SELECT
              (SELECT COUNT(*) FROM documents) AS documents,
              (SELECT COUNT(*) FROM chunks) AS chunks,
              (SELECT COUNT(*) FROM messages) AS turns
            """;

    private final JdbcClient jdbcClient;

    public JdbcDocumentStore(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    @Override
    public long createDocument(String name) {
        if (name == null || name.isBlank()) {
            throw AssistantException.invalidInput("Document name must not be blank");
        }
        return withStorage(() -> {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcClient.sql(INSERT_DOCUMENT_SQL).param("name", name).update(keyHolder, "id");
            return Objects.requireNonNull(keyHolder.getKey(), "generated document id").longValue();
        });
    }

    @Override
    public long addChunk(long documentId, String content, float[] embedding) {
        if (content == null || content.isEmpty()) {
            throw AssistantException.invalidInput("Chunk content must not be empty");
        }
        if (embedding == null || embedding.length == 0) {
            throw AssistantException.invalidInput("Chunk embedding must not be empty");
        }
        return withStorage(() -> {
            if (!documentExists(documentId)) {
                throw AssistantException.notFound("Document " + documentId + " does not exist");
            }
            Optional<Integer> storedDimensions = jdbcClient.sql(STORED_DIMENSIONS_SQL).query(Integer.class).optional();
            if (storedDimensions.isPresent() && storedDimensions.get() != embedding.length) {
                throw AssistantException.invalidInput("Embedding has " + embedding.length
                        + " dimensions but the store holds " + storedDimensions.get() + "-dimensional chunks");
            }
            KeyHolder keyHolder = new GeneratedKeyHolder();
            try {
                jdbcClient.sql(INSERT_CHUNK_SQL)
                        .param("documentId", documentId)
                        .param("content", content)
                        .param("embedding", toVectorLiteral(embedding))
                        .param("dimensions", embedding.length)
                        .update(keyHolder, "id");
            } catch (DataIntegrityViolationException ex) {
                // the document was deleted between the existence check and the insert
                throw new AssistantException(FailureKind.NOT_FOUND, "Document " + documentId + " does not exist", ex);
            }
            return Objects.requireNonNull(keyHolder.getKey(), "generated chunk id").longValue();
        });
    }

    @Override
    public List<StoredChunk> allChunks() {
        return withStorage(() -> jdbcClient.sql(ALL_CHUNKS_SQL).query(StoredChunkRowMapper.INSTANCE).list());
    }

    @Override
    public Optional<Document> findDocument(long documentId) {
        return withStorage(() -> jdbcClient.sql(DOCUMENTS_SQL.formatted("WHERE d.id = :id"))
                .param("id", documentId)
                .query(DocumentRowMapper.INSTANCE)
                .optional());
    }

    @Override
    public List<Document> listDocuments() {
        return withStorage(() -> jdbcClient.sql(DOCUMENTS_SQL.formatted("")).query(DocumentRowMapper.INSTANCE).list());
    }

    @Override
    public List<String> documentChunks(long documentId) {
        return withStorage(() -> {
            if (!documentExists(documentId)) {
                throw AssistantException.notFound("Document " + documentId + " does not exist");
            }
            return jdbcClient.sql(DOCUMENT_CHUNKS_SQL).param("id", documentId).query(String.class).list();
        });
    }

    @Override
    public void deleteDocument(long documentId) {
        int deleted = withStorage(() -> jdbcClient.sql(DELETE_DOCUMENT_SQL).param("id", documentId).update());
        if (deleted == 0) {
            throw AssistantException.notFound("Document " + documentId + " does not exist");
        }
        LOGGER.info("Deleted document {} and its chunks", documentId);
    }

    @Override
    public StoreCounts counts() {
        return withStorage(() -> jdbcClient.sql(COUNTS_SQL)
                .query((rs, rowNum) -> new StoreCounts(rs.getLong("documents"), rs.getLong("chunks"),
                        rs.getLong("turns")))
                .single());
    }

    private boolean documentExists(long documentId) {
        Long count = jdbcClient.sql(DOCUMENT_EXISTS_SQL).param("id", documentId).query(Long.class).single();
        return count != null && count > 0;
    }

    private static <T> T withStorage(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new AssistantException(FailureKind.STORAGE_UNAVAILABLE, "Document store failure", ex);
        }
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder(embedding.length * 12);
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] fromVectorLiteral(String literal) {
        String body = literal.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    private enum StoredChunkRowMapper implements RowMapper<StoredChunk> {
        INSTANCE;

        @Override
        public StoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StoredChunk(
                    rs.getLong("id"),
                    rs.getLong("document_id"),
                    rs.getString("content"),
                    fromVectorLiteral(rs.getString("embedding")));
        }
    }

    private enum DocumentRowMapper implements RowMapper<Document> {
        INSTANCE;

        @Override
        public Document mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Document(
                    rs.getLong("id"),
                    rs.getString("name"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getLong("chunk_count"));
        }
    }
}
