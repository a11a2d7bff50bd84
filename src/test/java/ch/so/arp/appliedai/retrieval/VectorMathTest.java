package ch.so.arp.appliedai.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;

import org.junit.jupiter.api.Test;

import ch.so.arp.appliedai.error.AssistantException;
import ch.so.arp.appliedai.error.FailureKind;

class VectorMathTest {

    @Test
    void identicalVectorsHaveSimilarityOne() {
        float[] vector = { 0.3f, -1.2f, 4.0f, 0.0f };

        assertThat(VectorMath.cosineSimilarity(vector, vector)).isCloseTo(1.0d, within(1e-9));
    }

    @Test
    void oppositeAndOrthogonalVectors() {
        assertThat(VectorMath.cosineSimilarity(new float[] { 1f, 2f }, new float[] { -1f, -2f }))
                .isCloseTo(-1.0d, within(1e-9));
        assertThat(VectorMath.cosineSimilarity(new float[] { 1f, 0f }, new float[] { 0f, 5f })).isZero();
    }

    @Test
    void zeroVectorYieldsZero() {
        assertThat(VectorMath.cosineSimilarity(new float[3], new float[] { 1f, 2f, 3f })).isZero();
        assertThat(VectorMath.cosineSimilarity(new float[] { 1f, 2f, 3f }, new float[3])).isZero();
    }

    @Test
    void staysWithinBoundsForRandomVectors() {
        Random random = new Random(42L);
        for (int run = 0; run < 200; run++) {
            float[] a = new float[16];
            float[] b = new float[16];
            for (int i = 0; i < a.length; i++) {
                a[i] = random.nextFloat() * 200f - 100f;
                b[i] = random.nextFloat() * 200f - 100f;
            }
            assertThat(VectorMath.cosineSimilarity(a, b)).isBetween(-1.0d, 1.0d);
        }
    }

    @Test
    void rejectsMismatchedDimensions() {
        assertThatThrownBy(() -> VectorMath.cosineSimilarity(new float[2], new float[3]))
                .isInstanceOfSatisfying(AssistantException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(FailureKind.INVALID_INPUT));
    }
}
