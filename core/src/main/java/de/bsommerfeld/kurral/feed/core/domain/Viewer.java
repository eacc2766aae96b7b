package de.bsommerfeld.kurral.feed.core.domain;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The user a feed is being built for. Owned by the account and onboarding
 * flows; the engine only reads it.
 *
 * @param id               user id
 * @param following        ids of the authors this viewer follows
 * @param interests        free-text interests (e.g. "react", "startup funding")
 * @param profileEmbedding embedding of the viewer's profile summary, if computed
 */
public record Viewer(
        String id,
        Set<String> following,
        Set<String> interests,
        Optional<Embedding> profileEmbedding) {

    public Viewer {
        Objects.requireNonNull(id, "id");
        following = following == null ? Set.of() : Set.copyOf(following);
        interests = interests == null ? Set.of() : Set.copyOf(interests);
        profileEmbedding = profileEmbedding == null ? Optional.empty() : profileEmbedding;
    }

    /**
     * Convenience constructor for viewers without a profile embedding.
     */
    public Viewer(String id, Set<String> following, Set<String> interests) {
        this(id, following, interests, Optional.empty());
    }

    public boolean follows(String authorId) {
        return following.contains(authorId);
    }

    public boolean isAuthorOf(Candidate candidate) {
        return id.equals(candidate.authorId());
    }

    public Viewer withProfileEmbedding(Embedding embedding) {
        return new Viewer(id, following, interests, Optional.ofNullable(embedding));
    }

    public Viewer withInterests(Set<String> newInterests) {
        return new Viewer(id, following, newInterests, profileEmbedding);
    }
}
