package ch.so.arp.appliedai.retrieval;

import java.util.List;

/**
 * Ranks stored fragments against a query vector.
 */
public interface Retriever {

    /**
     * Return the {@code k} stored fragments most similar to the query vector.
     * The current implementation scans every chunk on each call (linear in the
     * number of chunks times the dimension) and builds no index. Deployments
     * that need sub-linear latency replace the implementation behind this
     * contract.
     *
     * @param queryVector the embedded query
     * @param k           the maximum number of fragments, must not be negative
     * @return at most {@code k} fragments ordered by descending score, ties kept
     *         in scan order; empty when nothing is stored
     */
    List<RetrievedChunk> topK(float[] queryVector, int k);
}
