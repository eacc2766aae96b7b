package de.bsommerfeld.kurral.feed.core.vector;

import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Single place where embeddings are read. Callers get an empty result when
 * either side has no embedding, and never have to null-check vectors.
 * Vectors of different length are not comparable and yield 0.
 */
public final class AudienceSimilarity {

    private AudienceSimilarity() {
    }

    /**
     * Cosine similarity between the viewer's profile and the candidate's
     * target audience, or empty if either embedding is absent.
     */
    public static OptionalDouble between(Viewer viewer, Candidate candidate) {
        if (viewer == null || candidate.reach() == null)
            return OptionalDouble.empty();
        return between(viewer.profileEmbedding(), candidate.reach().targetAudience());
    }

    public static OptionalDouble between(Optional<Embedding> a, Optional<Embedding> b) {
        if (a.isEmpty() || b.isEmpty())
            return OptionalDouble.empty();
        return OptionalDouble.of(cosine(a.get(), b.get()));
    }

    /**
     * Cosine similarity in [-1, 1]. Mismatched dimensions and zero vectors
     * yield 0.
     */
    public static double cosine(Embedding a, Embedding b) {
        if (a.dimension() != b.dimension() || a.dimension() == 0)
            return 0.0;
        double similarity = CosineSimilarity.between(a, b);
        return Double.isFinite(similarity) ? similarity : 0.0;
    }
}
