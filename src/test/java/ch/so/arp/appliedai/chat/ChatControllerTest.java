package ch.so.arp.appliedai.chat;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.appliedai.error.ApiExceptionHandler;
import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;
import ch.so.arp.appliedai.memory.ChatMessage;

class ChatControllerTest {

    private final ChatService chatService = mock(ChatService.class);
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

    @Test
    void returnsAssistantReply() throws Exception {
        when(chatService.chat("c1", "How are you?")).thenReturn(new ChatResponse("Fine."));

        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conversationId\":\"c1\",\"message\":\"How are you?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Fine."));
    }

    @Test
    void mapsUpstreamFailuresToTheirStatus() throws Exception {
        when(chatService.chat("c1", "broken"))
                .thenThrow(new AssistantException(FailureKind.RATE_LIMITED, "quota exceeded for key sk-123"));

        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conversationId\":\"c1\",\"message\":\"broken\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("rate_limited"))
                .andExpect(jsonPath("$.detail").doesNotExist());
    }

    @Test
    void rejectsBlankMessage() throws Exception {
        mockMvc.perform(post("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conversationId\":\"c1\",\"message\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_input"));

        verify(chatService, never()).chat(any(), any());
    }

    @Test
    void returnsConversationHistory() throws Exception {
        when(chatService.history("c1", 5)).thenReturn(List.of(ChatMessage.user("q"), ChatMessage.assistant("a")));

        mockMvc.perform(get("/api/chat/c1/history").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].content").value("a"));
    }
}
