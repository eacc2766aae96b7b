package de.bsommerfeld.kurral.feed.ranking;

import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The additive terms of the relevance score, in evaluation order. Each term
 * only reads its {@link ScoringInput}; none sees another term's result.
 */
public enum ScoringTerm {

    /** Weight of the following tier when the viewer follows (or is) the author. */
    FOLLOWING {
        @Override
        TermContribution evaluate(ScoringInput in) {
            Viewer viewer = in.viewer();
            if (viewer == null)
                return TermContribution.NONE;
            int boost = in.config().getFollowingWeight().boost();
            if (viewer.isAuthorOf(in.candidate()))
                return TermContribution.of(boost, "your own post");
            if (viewer.follows(in.candidate().authorId()))
                return TermContribution.of(boost, "you follow @" + in.candidate().displayAuthor());
            return TermContribution.NONE;
        }
    },

    /** 30 points plus 5 per matching semantic topic, capped at 55. */
    INTEREST {
        @Override
        TermContribution evaluate(ScoringInput in) {
            if (in.viewer() == null)
                return TermContribution.NONE;
            List<String> interests = in.viewer().interests().stream()
                    .map(TopicVocabulary::normalize)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
            if (interests.isEmpty())
                return TermContribution.NONE;

            List<String> matches = in.candidate().semanticTopics().stream()
                    .filter(topic -> matchesAny(topic, interests))
                    .collect(Collectors.toList());
            if (matches.isEmpty())
                return TermContribution.NONE;
            double score = 30 + Math.min(matches.size() * 5, 25);
            return TermContribution.of(score, "matches your interest \"" + matches.get(0) + "\"");
        }
    },

    LIKED_TOPIC {
        @Override
        TermContribution evaluate(ScoringInput in) {
            String topic = in.candidate().topic();
            if (!in.config().likes(topic))
                return TermContribution.NONE;
            return TermContribution.of(25, "topic #" + TopicVocabulary.normalize(topic) + " you like");
        }
    },

    /** Only matters in relaxed mode; otherwise muted posts never get scored. */
    MUTED_TOPIC {
        @Override
        TermContribution evaluate(ScoringInput in) {
            String topic = in.candidate().topic();
            if (!in.config().mutes(topic))
                return TermContribution.NONE;
            return TermContribution.of(-100, "topic #" + TopicVocabulary.normalize(topic) + " you muted");
        }
    },

    /** Logarithmic comment boost, capped at 20. */
    ACTIVE_DISCUSSION {
        @Override
        TermContribution evaluate(ScoringInput in) {
            if (!in.config().isBoostActiveConversations())
                return TermContribution.NONE;
            int comments = in.candidate().commentCount();
            if (comments <= 0)
                return TermContribution.NONE;
            return TermContribution.of(Math.min(20, Math.log10(comments + 1) * 5), "active conversation");
        }
    },

    SEMANTIC_SIMILARITY {
        @Override
        TermContribution evaluate(ScoringInput in) {
            if (in.similarity().isEmpty())
                return TermContribution.NONE;
            double similarity = in.similarity().getAsDouble();
            if (similarity <= 0)
                return TermContribution.NONE;
            return TermContribution.of(similarity * 35,
                    "aligns with your profile (" + Math.round(similarity * 100) + "% similarity)");
        }
    },

    /** 15 points for a brand-new post, losing half a point per hour. */
    RECENCY {
        @Override
        TermContribution evaluate(ScoringInput in) {
            double hours = Math.max(0, hoursBetween(in.candidate(), in));
            return TermContribution.silent(Math.max(0, 15 - hours * 0.5));
        }
    },

    /** Fact-check penalties. Blocked posts only ever reach their author. */
    MODERATION {
        @Override
        TermContribution evaluate(ScoringInput in) {
            switch (in.candidate().moderation()) {
                case BLOCKED:
                    return TermContribution.of(-50, "blocked by fact-check");
                case NEEDS_REVIEW:
                    return TermContribution.of(-20, "fact-check needs review");
                default:
                    return TermContribution.NONE;
            }
        }
    };

    abstract TermContribution evaluate(ScoringInput in);

    /** Case-insensitive substring match in either direction. */
    static boolean matchesAny(String topic, List<String> normalizedInterests) {
        String t = TopicVocabulary.normalize(topic);
        if (t.isEmpty())
            return false;
        for (String interest : normalizedInterests) {
            if (t.contains(interest) || interest.contains(t))
                return true;
        }
        return false;
    }

    private static double hoursBetween(Candidate candidate, ScoringInput in) {
        return Duration.between(candidate.createdAt(), in.now()).toMillis() / 3_600_000.0;
    }
}
