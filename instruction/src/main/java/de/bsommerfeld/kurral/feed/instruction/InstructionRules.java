package de.bsommerfeld.kurral.feed.instruction;

import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;

import java.util.List;
import java.util.Set;

/**
 * Keyword tables the {@link InstructionCompiler} is driven by.
 */
final class InstructionRules {

    /** Checked heavy to none, first match wins. */
    static final KeywordTable<FollowingWeight> FOLLOWING_TIERS = KeywordTable.<FollowingWeight>builder()
            .rule(FollowingWeight.HEAVY, "only show me people i follow", "max following", "heavy following",
                    "more from people i follow", "keep it personal", "all from people i follow")
            .rule(FollowingWeight.MEDIUM, "balanced", "mix discovery", "medium following", "half following",
                    "mixed feed")
            .rule(FollowingWeight.LIGHT, "discovery mode", "light following", "some new people", "less following",
                    "more surprises", "open feed")
            .rule(FollowingWeight.NONE, "full discovery", "no following boost", "show me random people", "everyone",
                    "no following", "fresh content")
            .build();

    /** Off phrases first, "less active conversation" contains an on phrase too. */
    static final KeywordTable<Boolean> ACTIVE_TOGGLE = KeywordTable.<Boolean>builder()
            .rule(Boolean.FALSE, "less active", "not active", "quiet conversations", "calm feed", "avoid active",
                    "reduce active")
            .rule(Boolean.TRUE, "active conversation", "active discussions", "boost active", "lively conversation",
                    "hot discussion", "more active")
            .build();

    static final List<String> ADD_TRIGGERS = List.of(
            "more", "show me", "i want", "prefer", "focus on", "love", "interested in", "add", "like",
            "want to see", "about", "regarding", "concerning", "related to");

    static final List<String> REMOVE_TRIGGERS = List.of(
            "less", "avoid", "stop", "no more", "hide", "tired of", "don't want", "don't show", "remove",
            "exclude");

    /** Words that end an interest phrase. */
    static final Set<String> PHRASE_BREAKS = Set.of("and", "but", "or", "please");

    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "that", "this", "with", "you", "are", "not", "but", "have", "was", "what",
            "can", "will", "just", "your", "all", "from", "out", "now", "one", "has", "why", "who", "how",
            "new", "get", "like", "more", "time", "some", "it", "is", "of", "to", "in", "see", "show", "me",
            "posts", "post", "stuff", "things", "content", "feed", "people", "really", "lot", "lots", "any",
            "much", "my", "about", "want", "less", "also", "too", "very", "them", "those", "these", "i'm",
            "it's", "don't", "dont", "please", "mute", "avoid", "stop", "hide", "skip", "drop", "calm", "boost",
            "focus", "love", "favor", "highlight", "prioritize", "again", "prefer", "add", "remove", "exclude",
            "tired", "follow", "following", "followed", "active", "conversation", "conversations", "discussion",
            "discussions", "topic", "topics", "mode", "lively", "quiet");

    /** Well-known subjects picked up anywhere in the instruction. */
    static final List<String> DOMAIN_KEYWORDS = List.of(
            "react", "vue", "angular", "javascript", "typescript", "python", "java", "go", "rust",
            "ai", "machine learning", "deep learning", "neural networks", "nlp",
            "design", "ui", "ux", "figma", "sketch",
            "startup", "funding", "vc", "saas", "startup funding",
            "crypto", "blockchain", "bitcoin", "ethereum", "defi",
            "productivity", "workflow", "habit", "routine",
            "music", "guitar", "piano", "album",
            "sports", "nba", "nfl", "soccer", "football");

    private InstructionRules() {
    }
}
