package eu.virtualparadox.techrag.rag.retriever.service;

import eu.virtualparadox.techrag.rag.embed.EmbeddingService;
import eu.virtualparadox.techrag.rag.index.VectorIndexService;
import eu.virtualparadox.techrag.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves a diverse set of chunks with maximal marginal relevance.
 * <p>
 * The {@code fetchK} nearest chunks are fetched from the index; {@code k} of them are then picked
 * greedily, each maximizing {@code λ·sim(q, d) − (1 − λ)·max sim(d, s)} over the already selected
 * chunks {@code s}, with cosine similarity on the stored vectors. {@code λ = 1} degenerates to plain
 * nearest-neighbor order, {@code λ = 0} to maximal diversity.
 */
@Service
@Slf4j
public final class MmrRetrieverService implements RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final int fetchK;
    private final double lambda;

    public MmrRetrieverService(final EmbeddingService embeddingService,
                               final VectorIndexService vectorIndexService,
                               @Value("${techrag.retrieval.fetch-k:10}") final int fetchK,
                               @Value("${techrag.retrieval.mmr-lambda:0.5}") final double lambda) {
        if (fetchK <= 0) {
            throw new IllegalArgumentException("fetchK must be > 0");
        }
        if (lambda < 0.0 || lambda > 1.0) {
            throw new IllegalArgumentException("lambda must be in [0, 1]");
        }
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.fetchK = fetchK;
        this.lambda = lambda;
    }

    @Override
    public List<SearchResult> search(final String query, final int k) {
        final float[] queryVector = embeddingService.embedQuery(query);
        final List<SearchResult> candidates = vectorIndexService.similaritySearch(queryVector, Math.max(k, fetchK));
        final List<SearchResult> selected = select(queryVector, candidates, k);
        log.debug("MMR selected {} of {} candidates", selected.size(), candidates.size());
        return selected;
    }

    List<SearchResult> select(final float[] queryVector, final List<SearchResult> candidates, final int k) {
        final List<SearchResult> remaining = new ArrayList<>(candidates);
        final List<SearchResult> selected = new ArrayList<>(Math.min(k, candidates.size()));

        final List<Double> remainingRelevance = new ArrayList<>(remaining.size());
        for (final SearchResult candidate : remaining) {
            remainingRelevance.add(cosine(queryVector, candidate.vector()));
        }

        while (selected.size() < k && !remaining.isEmpty()) {
            int best = 0;
            double bestScore = Double.NEGATIVE_INFINITY;

            for (int i = 0; i < remaining.size(); i++) {
                double redundancy = 0.0;
                if (!selected.isEmpty()) {
                    redundancy = Double.NEGATIVE_INFINITY;
                    for (final SearchResult s : selected) {
                        redundancy = Math.max(redundancy, cosine(remaining.get(i).vector(), s.vector()));
                    }
                }

                final double score = lambda * remainingRelevance.get(i) - (1.0 - lambda) * redundancy;
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }

            selected.add(remaining.remove(best));
            remainingRelevance.remove(best);
        }
        return selected;
    }

    static double cosine(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
