package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;
import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Per-viewer For-You preferences read by the scorer. Onboarding seeds it
 * from the {@code [defaults]} section; afterwards only the instruction
 * compiler and direct settings edits change it.
 *
 * <p>
 * Liked and muted topics are kept disjoint by every writer in this project;
 * setters do not enforce it so that persisted documents load as they are.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedConfig {

    // following boost tier (none, light, medium, heavy)
    @JsonProperty("following-weight")
    private FollowingWeight followingWeight = FollowingWeight.MEDIUM;

    @JsonProperty("boost-active-conversations")
    private boolean boostActiveConversations = true;

    @JsonProperty("liked-topics")
    private List<String> likedTopics = new ArrayList<>();

    @JsonProperty("muted-topics")
    private List<String> mutedTopics = new ArrayList<>();

    // candidates older than this are not considered (clamped to 1..30 by the selector)
    @JsonProperty("time-window-days")
    private int timeWindowDays = 7;

    // null means "use ranking.similarity-threshold"
    @JsonProperty("similarity-threshold")
    private Double similarityThreshold;

    public FeedConfig() {
    }

    /**
     * Returns a deep copy; lists are not shared with this instance.
     */
    public FeedConfig copy() {
        FeedConfig copy = new FeedConfig();
        copy.followingWeight = followingWeight;
        copy.boostActiveConversations = boostActiveConversations;
        copy.likedTopics = new ArrayList<>(likedTopics);
        copy.mutedTopics = new ArrayList<>(mutedTopics);
        copy.timeWindowDays = timeWindowDays;
        copy.similarityThreshold = similarityThreshold;
        return copy;
    }

    public FollowingWeight getFollowingWeight() {
        return followingWeight;
    }

    public void setFollowingWeight(FollowingWeight followingWeight) {
        this.followingWeight = Objects.requireNonNull(followingWeight, "followingWeight");
    }

    public boolean isBoostActiveConversations() {
        return boostActiveConversations;
    }

    public void setBoostActiveConversations(boolean boostActiveConversations) {
        this.boostActiveConversations = boostActiveConversations;
    }

    /** Read-only view; change it through {@link #setLikedTopics(List)}. */
    public List<String> getLikedTopics() {
        return Collections.unmodifiableList(likedTopics);
    }

    public void setLikedTopics(List<String> likedTopics) {
        this.likedTopics = likedTopics == null ? new ArrayList<>() : new ArrayList<>(likedTopics);
    }

    public List<String> getMutedTopics() {
        return Collections.unmodifiableList(mutedTopics);
    }

    public void setMutedTopics(List<String> mutedTopics) {
        this.mutedTopics = mutedTopics == null ? new ArrayList<>() : new ArrayList<>(mutedTopics);
    }

    public int getTimeWindowDays() {
        return timeWindowDays;
    }

    public void setTimeWindowDays(int timeWindowDays) {
        this.timeWindowDays = timeWindowDays;
    }

    public Double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(Double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * The configured similarity threshold clamped to [0, 1], or the fallback
     * when none is set.
     */
    public double similarityThresholdOr(double fallback) {
        if (similarityThreshold == null || similarityThreshold.isNaN())
            return fallback;
        return Math.max(0.0, Math.min(1.0, similarityThreshold));
    }

    public boolean likes(String topic) {
        return likedTopics.stream().anyMatch(t -> TopicVocabulary.sameTopic(t, topic));
    }

    public boolean mutes(String topic) {
        return mutedTopics.stream().anyMatch(t -> TopicVocabulary.sameTopic(t, topic));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FeedConfig other = (FeedConfig) o;
        return boostActiveConversations == other.boostActiveConversations
                && timeWindowDays == other.timeWindowDays
                && followingWeight == other.followingWeight
                && likedTopics.equals(other.likedTopics)
                && mutedTopics.equals(other.mutedTopics)
                && Objects.equals(similarityThreshold, other.similarityThreshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(followingWeight, boostActiveConversations, likedTopics, mutedTopics,
                timeWindowDays, similarityThreshold);
    }

    @Override
    public String toString() {
        return "FeedConfig{following=" + followingWeight.key()
                + ", boostActive=" + boostActiveConversations
                + ", liked=" + likedTopics
                + ", muted=" + mutedTopics
                + ", windowDays=" + timeWindowDays
                + ", similarity=" + similarityThreshold + "}";
    }
}
