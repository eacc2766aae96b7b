package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Heuristic thresholds of the instruction compiler.
 */
public class InstructionConfig {

    // max characters between a sentiment keyword and a topic mention
    @JsonProperty("proximity-window")
    private int proximityWindow = 10;

    // shorter extracted interest tokens are dropped
    @JsonProperty("min-interest-length")
    private int minInterestLength = 3;

    // longer phrases are only kept as single words
    @JsonProperty("max-phrase-words")
    private int maxPhraseWords = 3;

    public int getProximityWindow() {
        return proximityWindow;
    }

    public void setProximityWindow(int proximityWindow) {
        this.proximityWindow = proximityWindow;
    }

    public int getMinInterestLength() {
        return minInterestLength;
    }

    public int getMaxPhraseWords() {
        return maxPhraseWords;
    }
}
