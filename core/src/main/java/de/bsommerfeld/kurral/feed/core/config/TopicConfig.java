package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical topic vocabulary. Maintained outside the engine; the list here
 * is what the instruction compiler looks for in free text.
 */
public class TopicConfig {

    @JsonProperty("vocabulary")
    private List<String> vocabulary = new ArrayList<>(TopicVocabulary.DEFAULT_TOPICS);

    public List<String> getVocabulary() {
        return vocabulary;
    }

    public void setVocabulary(List<String> vocabulary) {
        this.vocabulary = vocabulary;
    }

    public TopicVocabulary toVocabulary() {
        return new TopicVocabulary(vocabulary == null ? List.of() : vocabulary);
    }
}
