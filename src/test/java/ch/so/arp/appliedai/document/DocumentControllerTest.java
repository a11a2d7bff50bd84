package ch.so.arp.appliedai.document;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.appliedai.error.ApiExceptionHandler;
import ch.so.arp.appliedai.error.AssistantException;

class DocumentControllerTest {

    private final DocumentService documentService = mock(DocumentService.class);
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new DocumentController(documentService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();

    @Test
    void ingestsDocument() throws Exception {
        when(documentService.ingest("doc1", "text")).thenReturn(new IngestResult(7L, 1));

        mockMvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"doc1\",\"text\":\"text\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.documentId").value(7))
                .andExpect(jsonPath("$.chunksAdded").value(1));
    }

    @Test
    void rejectsMissingName() throws Exception {
        mockMvc.perform(post("/api/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"text\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_input"));
    }

    @Test
    void listsDocuments() throws Exception {
        when(documentService.listDocuments())
                .thenReturn(List.of(new Document(1L, "doc1", Instant.parse("2024-05-01T10:00:00Z"), 3L)));

        mockMvc.perform(get("/api/documents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("doc1"))
                .andExpect(jsonPath("$[0].chunkCount").value(3));
    }

    @Test
    void returnsDocumentText() throws Exception {
        when(documentService.documentText(1L)).thenReturn("full text");

        mockMvc.perform(get("/api/documents/1/text"))
                .andExpect(status().isOk())
                .andExpect(content().string("full text"));
    }

    @Test
    void deletingUnknownDocumentIsNotFound() throws Exception {
        doThrow(AssistantException.notFound("Document 9 does not exist")).when(documentService).deleteDocument(9L);

        mockMvc.perform(delete("/api/documents/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void deletesDocument() throws Exception {
        mockMvc.perform(delete("/api/documents/1"))
                .andExpect(status().isNoContent());
    }
}
