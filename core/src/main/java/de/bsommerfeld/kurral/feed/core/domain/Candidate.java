package de.bsommerfeld.kurral.feed.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a post ("chirp") considered for ranking.
 *
 * @param id             post id
 * @param authorId       id of the posting user
 * @param authorHandle   display handle of the author, {@code null} if unknown
 * @param topic          primary topic (one of the canonical topics, or an
 *                       opaque bucket name)
 * @param semanticTopics fine-grained topics extracted from the text, may be
 *                       empty
 * @param reach          reach policy, {@code null} when the stored document
 *                       carried none
 * @param createdAt      creation timestamp
 * @param commentCount   number of comments, never negative
 * @param moderation     fact-check status; absent is treated as clean
 */
public record Candidate(
        String id,
        String authorId,
        String authorHandle,
        String topic,
        List<String> semanticTopics,
        ReachPolicy reach,
        Instant createdAt,
        int commentCount,
        ModerationStatus moderation) {

    public Candidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(authorId, "authorId");
        Objects.requireNonNull(createdAt, "createdAt");
        semanticTopics = semanticTopics == null ? List.of() : List.copyOf(semanticTopics);
        commentCount = Math.max(0, commentCount);
        moderation = moderation == null ? ModerationStatus.CLEAN : moderation;
    }

    /**
     * Convenience constructor for an open, clean post without semantic topics.
     */
    public Candidate(String id, String authorId, String topic, Instant createdAt) {
        this(id, authorId, null, topic, List.of(), ReachPolicy.open(), createdAt, 0, ModerationStatus.CLEAN);
    }

    /** Handle used in human-readable reasons, falling back to the author id. */
    public String displayAuthor() {
        return authorHandle != null && !authorHandle.isBlank() ? authorHandle : authorId;
    }

    public Candidate withReach(ReachPolicy newReach) {
        return new Candidate(id, authorId, authorHandle, topic, semanticTopics, newReach, createdAt,
                commentCount, moderation);
    }

    public Candidate withSemanticTopics(List<String> topics) {
        return new Candidate(id, authorId, authorHandle, topic, topics, reach, createdAt,
                commentCount, moderation);
    }

    public Candidate withCommentCount(int count) {
        return new Candidate(id, authorId, authorHandle, topic, semanticTopics, reach, createdAt,
                count, moderation);
    }

    public Candidate withModeration(ModerationStatus status) {
        return new Candidate(id, authorId, authorHandle, topic, semanticTopics, reach, createdAt,
                commentCount, status);
    }
}
