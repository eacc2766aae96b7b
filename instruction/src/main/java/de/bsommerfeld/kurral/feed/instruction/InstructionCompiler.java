package de.bsommerfeld.kurral.feed.instruction;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.InstructionConfig;
import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;
import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a free-text viewer instruction ("more #dev, less crypto, keep it
 * personal") into an updated {@link FeedConfig} plus interest adjustments.
 * Purely keyword driven and deterministic.
 *
 * <p>
 * The passed configuration is never modified. Liked and muted topics of the
 * result are disjoint, lowercased and sorted.
 */
@Singleton
public class InstructionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(InstructionCompiler.class);

    static final String EMPTY_INSTRUCTION = "Please describe how you want the feed to behave.";

    private final TopicVocabulary vocabulary;
    private final TopicSentimentMatcher sentimentMatcher;
    private final InterestExtractor interestExtractor;

    @Inject
    public InstructionCompiler(InstructionConfig instructionConfig, TopicVocabulary vocabulary) {
        this.vocabulary = vocabulary;
        this.sentimentMatcher = new TopicSentimentMatcher(instructionConfig.getProximityWindow());
        this.interestExtractor = new InterestExtractor(vocabulary, instructionConfig.getMinInterestLength(),
                instructionConfig.getMaxPhraseWords());
    }

    /**
     * @throws InvalidInstructionException if the instruction is null, empty or
     *                                     whitespace only
     */
    public CompiledInstruction compile(String instruction, FeedConfig currentConfig) {
        if (instruction == null || instruction.isBlank())
            throw new InvalidInstructionException(EMPTY_INSTRUCTION);
        Objects.requireNonNull(currentConfig, "currentConfig");

        String lowered = InstructionText.lower(instruction);
        FeedConfig next = currentConfig.copy();
        List<String> changes = new ArrayList<>();

        applyFollowingWeight(lowered, next, changes);
        applyActiveToggle(lowered, next, changes);
        applyTopicSentiment(lowered, next, changes);

        InterestAdjustment interests = interestExtractor.extract(lowered);
        if (!interests.add().isEmpty())
            changes.add("Added interests: " + String.join(", ", interests.add()));
        if (!interests.remove().isEmpty())
            changes.add("Removed interests: " + String.join(", ", interests.remove()));

        LOG.debug("Compiled instruction into {} change(s): {}", changes.size(), changes);
        return new CompiledInstruction(next, changes, interests.add(), interests.remove());
    }

    private void applyFollowingWeight(String lowered, FeedConfig next, List<String> changes) {
        Optional<FollowingWeight> weight = InstructionRules.FOLLOWING_TIERS.firstMatch(lowered);
        if (weight.isPresent() && weight.get() != next.getFollowingWeight()) {
            next.setFollowingWeight(weight.get());
            changes.add("Set following boost to " + weight.get().key());
        }
    }

    private void applyActiveToggle(String lowered, FeedConfig next, List<String> changes) {
        Optional<Boolean> active = InstructionRules.ACTIVE_TOGGLE.firstMatch(lowered);
        if (active.isPresent() && active.get() != next.isBoostActiveConversations()) {
            next.setBoostActiveConversations(active.get());
            changes.add(active.get()
                    ? "Boosted active conversations"
                    : "Reduced the emphasis on active conversations");
        }
    }

    private void applyTopicSentiment(String lowered, FeedConfig next, List<String> changes) {
        Set<String> liked = normalized(next.getLikedTopics());
        Set<String> muted = normalized(next.getMutedTopics());

        for (String topic : sentimentMatcher.mentionedTopics(lowered, vocabulary)) {
            Optional<Sentiment> sentiment = sentimentMatcher.sentimentFor(lowered, topic);
            if (sentiment.isEmpty())
                continue;
            if (sentiment.get() == Sentiment.POSITIVE) {
                muted.remove(topic);
                if (liked.add(topic))
                    changes.add("Liked #" + topic);
            } else {
                liked.remove(topic);
                if (muted.add(topic))
                    changes.add("Muted #" + topic);
            }
        }

        // a topic both liked and muted stays liked
        muted.removeAll(liked);
        next.setLikedTopics(sorted(liked));
        next.setMutedTopics(sorted(muted));
    }

    private static Set<String> normalized(List<String> topics) {
        Set<String> result = new LinkedHashSet<>();
        for (String topic : topics) {
            String normalized = TopicVocabulary.normalize(topic);
            if (!normalized.isEmpty())
                result.add(normalized);
        }
        return result;
    }

    private static List<String> sorted(Set<String> topics) {
        List<String> list = new ArrayList<>(topics);
        list.sort(null);
        return list;
    }
}
