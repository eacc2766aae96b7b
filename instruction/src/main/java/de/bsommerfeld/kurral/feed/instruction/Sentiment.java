package de.bsommerfeld.kurral.feed.instruction;

import java.util.List;

/**
 * Direction of a topic mention, with the keywords that signal it.
 */
enum Sentiment {

    POSITIVE(List.of("more", "boost", "show", "focus on", "love", "want", "favor", "highlight", "prioritize",
            "again")),

    NEGATIVE(List.of("less", "avoid", "stop", "mute", "no", "don't", "dont", "skip", "drop", "hide", "calm",
            "not", "no more", "don't want", "dont want", "don't show", "tired of"));

    private final List<String> keywords;

    Sentiment(List<String> keywords) {
        this.keywords = keywords;
    }

    List<String> keywords() {
        return keywords;
    }
}
