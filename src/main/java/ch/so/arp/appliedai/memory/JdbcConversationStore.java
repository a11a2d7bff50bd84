package ch.so.arp.appliedai.memory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;

/**
 * {@link ConversationStore} persisting turns in the {@code messages} table.
 * Turn identifiers come from the identity column, so concurrent appends to the
 * same conversation are ordered by completion.
 */
public class JdbcConversationStore implements ConversationStore {

    private static final String INSERT_SQL = """
            INSERT INTO messages (conversation_id, role, content)
            VALUES (:conversationId, :role, :content)
            """;

    private static final String RECENT_SQL = """
            SELECT id, conversation_id, role, content, created_at
            FROM messages
            WHERE conversation_id = :conversationId
            ORDER BY id DESC
            LIMIT :limit
            """;

    private final JdbcClient jdbcClient;

    public JdbcConversationStore(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    @Override
    public long appendTurn(String conversationId, Role role, String content) {
        requireConversationId(conversationId);
        Objects.requireNonNull(role, "role");
        if (content == null) {
            throw AssistantException.invalidInput("content must not be null");
        }
        return withStorage(() -> {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcClient.sql(INSERT_SQL)
                    .param("conversationId", conversationId)
                    .param("role", role.value())
                    .param("content", content)
                    .update(keyHolder, "id");
            return Objects.requireNonNull(keyHolder.getKey(), "generated turn id").longValue();
        });
    }

    @Override
    public List<Turn> recentTurns(String conversationId, int limit) {
        requireConversationId(conversationId);
        if (limit < 0) {
            throw AssistantException.invalidInput("limit must not be negative but was " + limit);
        }
        if (limit == 0) {
            return List.of();
        }
        List<Turn> newestFirst = withStorage(() -> jdbcClient.sql(RECENT_SQL)
                .param("conversationId", conversationId)
                .param("limit", limit)
                .query(TurnRowMapper.INSTANCE)
                .list());
        List<Turn> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    private static void requireConversationId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw AssistantException.invalidInput("conversationId must not be blank");
        }
    }

    private static <T> T withStorage(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new AssistantException(FailureKind.STORAGE_UNAVAILABLE, "Conversation store failure", ex);
        }
    }

    private enum TurnRowMapper implements RowMapper<Turn> {
        INSTANCE;

        @Override
        public Turn mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Turn(
                    rs.getLong("id"),
                    rs.getString("conversation_id"),
                    Role.fromValue(rs.getString("role")),
                    rs.getString("content"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }
}
