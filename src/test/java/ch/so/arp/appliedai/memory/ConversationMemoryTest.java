package ch.so.arp.appliedai.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

class ConversationMemoryTest {

    @Test
    void mapsTurnsToMessagesKeepingOrder() {
        ConversationStore store = mock(ConversationStore.class);
        Instant now = Instant.now();
        when(store.recentTurns("c1", 20)).thenReturn(List.of(
                new Turn(1L, "c1", Role.USER, "question", now),
                new Turn(2L, "c1", Role.ASSISTANT, "answer", now)));

        List<ChatMessage> messages = new ConversationMemory(store).recentMessages("c1", 20);

        assertThat(messages).containsExactly(ChatMessage.user("question"), ChatMessage.assistant("answer"));
    }

    @Test
    void roleParsingIsCaseInsensitive() {
        assertThat(Role.fromValue("Assistant")).isEqualTo(Role.ASSISTANT);
        assertThat(Role.USER.value()).isEqualTo("user");
    }
}
