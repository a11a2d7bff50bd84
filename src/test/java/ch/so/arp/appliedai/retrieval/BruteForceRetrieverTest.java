package ch.so.arp.appliedai.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import ch.so.arp.appliedai.document.DocumentStore;
import ch.so.arp.appliedai.document.StoredChunk;
import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;

class BruteForceRetrieverTest {

    private final DocumentStore documentStore = mock(DocumentStore.class);
    private final BruteForceRetriever retriever = new BruteForceRetriever(documentStore);

    @Test
    void returnsMostSimilarChunksFirst() {
        when(documentStore.allChunks()).thenReturn(List.of(
                chunk(1L, "orthogonal", 0f, 1f),
                chunk(2L, "identical", 1f, 0f),
                chunk(3L, "opposite", -1f, 0f),
                chunk(4L, "close", 0.9f, 0.1f)));

        List<RetrievedChunk> result = retriever.topK(new float[] { 1f, 0f }, 3);

        assertThat(result).extracting(RetrievedChunk::content).containsExactly("identical", "close", "orthogonal");
        assertThat(result.get(0).score()).isEqualTo(1.0d);
    }

    @Test
    void neverReturnsMoreThanKAndScoresDoNotIncrease() {
        Random random = new Random(7L);
        List<StoredChunk> chunks = new ArrayList<>();
        for (long id = 1; id <= 50; id++) {
            chunks.add(chunk(id, "chunk-" + id, random.nextFloat() - 0.5f, random.nextFloat() - 0.5f,
                    random.nextFloat() - 0.5f));
        }
        when(documentStore.allChunks()).thenReturn(chunks);

        List<RetrievedChunk> result = retriever.topK(new float[] { 0.2f, -0.4f, 0.9f }, 4);

        assertThat(result).hasSize(4);
        for (int i = 1; i < result.size(); i++) {
            assertThat(result.get(i).score()).isLessThanOrEqualTo(result.get(i - 1).score());
        }
    }

    @Test
    void tiesKeepScanOrder() {
        when(documentStore.allChunks()).thenReturn(List.of(
                chunk(5L, "first", 2f, 0f),
                chunk(3L, "second", 1f, 0f),
                chunk(9L, "third", 3f, 0f)));

        List<RetrievedChunk> result = retriever.topK(new float[] { 1f, 0f }, 4);

        assertThat(result).extracting(RetrievedChunk::content).containsExactly("first", "second", "third");
    }

    @Test
    void emptyStoreYieldsEmptyResult() {
        when(documentStore.allChunks()).thenReturn(List.of());

        assertThat(retriever.topK(new float[] { 1f }, 4)).isEmpty();
    }

    @Test
    void zeroKSkipsTheScan() {
        assertThat(retriever.topK(new float[] { 1f }, 0)).isEmpty();
        verifyNoInteractions(documentStore);
    }

    @Test
    void rejectsNegativeK() {
        assertThatThrownBy(() -> retriever.topK(new float[] { 1f }, -1))
                .isInstanceOfSatisfying(AssistantException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(FailureKind.INVALID_INPUT));
    }

    private static StoredChunk chunk(long id, String content, float... embedding) {
        return new StoredChunk(id, 1L, content, embedding);
    }
}
