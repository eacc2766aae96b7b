package de.bsommerfeld.kurral.feed.core.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical topic names the instruction compiler recognizes. Topics are
 * stored lowercase and compared case-insensitively; dynamically created
 * bucket topics are just opaque strings and never need to be listed here.
 */
public final class TopicVocabulary {

    public static final List<String> DEFAULT_TOPICS = List.of(
            "dev", "startups", "music", "sports", "productivity", "design", "politics", "crypto");

    private final List<String> topics;

    public TopicVocabulary(List<String> topics) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String topic : topics) {
            String n = normalize(topic);
            if (!n.isEmpty())
                normalized.add(n);
        }
        this.topics = List.copyOf(normalized);
    }

    public static TopicVocabulary defaults() {
        return new TopicVocabulary(DEFAULT_TOPICS);
    }

    public List<String> topics() {
        return topics;
    }

    public boolean contains(String topic) {
        return topic != null && topics.contains(normalize(topic));
    }

    /**
     * Lowercases and trims a topic name. {@code null} becomes the empty string.
     */
    public static String normalize(String topic) {
        return topic == null ? "" : topic.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Exact, case-insensitive topic equality. Blank topics never match.
     */
    public static boolean sameTopic(String a, String b) {
        String na = normalize(a);
        return !na.isEmpty() && na.equals(normalize(b));
    }

    @Override
    public String toString() {
        return "TopicVocabulary" + topics;
    }
}
