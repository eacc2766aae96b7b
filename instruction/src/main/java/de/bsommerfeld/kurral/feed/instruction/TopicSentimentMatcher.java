package de.bsommerfeld.kurral.feed.instruction;

import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds vocabulary topics in an instruction and the sentiment attached to
 * each of them.
 *
 * <p>
 * For every mention (bare word or {@code #hashtag}) the sentiment keyword
 * closest to it, on either side and at most {@code proximityWindow}
 * characters away, decides the mention's direction. On equal distance the
 * longer keyword wins, so "no more dev" reads as negative although "more" is
 * just as close. A topic keeps no sentiment when its mentions disagree or
 * when opposite keywords of the same length sit equally close to a mention.
 */
final class TopicSentimentMatcher {

    private final int proximityWindow;
    private final List<KeywordPattern> keywordPatterns = new ArrayList<>();

    TopicSentimentMatcher(int proximityWindow) {
        this.proximityWindow = proximityWindow;
        for (Sentiment sentiment : Sentiment.values()) {
            for (String keyword : sentiment.keywords())
                keywordPatterns.add(new KeywordPattern(sentiment, InstructionText.wordPattern(keyword)));
        }
    }

    /**
     * Vocabulary topics mentioned in the lowered instruction, in vocabulary
     * order.
     */
    List<String> mentionedTopics(String loweredInstruction, TopicVocabulary vocabulary) {
        List<String> mentioned = new ArrayList<>();
        for (String topic : vocabulary.topics()) {
            if (InstructionText.mentionPattern(topic).matcher(loweredInstruction).find())
                mentioned.add(topic);
        }
        return mentioned;
    }

    Optional<Sentiment> sentimentFor(String loweredInstruction, String topic) {
        List<Span> keywords = findKeywords(loweredInstruction);
        Set<Sentiment> found = EnumSet.noneOf(Sentiment.class);

        Matcher mention = InstructionText.mentionPattern(topic).matcher(loweredInstruction);
        while (mention.find()) {
            Span closest = null;
            int closestDistance = Integer.MAX_VALUE;
            boolean contested = false;
            for (Span keyword : keywords) {
                int distance = distance(keyword, mention.start(), mention.end());
                if (distance < 0 || distance > proximityWindow)
                    continue;
                if (distance < closestDistance
                        || (distance == closestDistance && keyword.length() > closest.length())) {
                    closest = keyword;
                    closestDistance = distance;
                    contested = false;
                } else if (distance == closestDistance && keyword.length() == closest.length()
                        && keyword.sentiment() != closest.sentiment()) {
                    contested = true;
                }
            }
            if (contested)
                return Optional.empty();
            if (closest != null)
                found.add(closest.sentiment());
        }

        if (found.size() != 1)
            return Optional.empty();
        return Optional.of(found.iterator().next());
    }

    private List<Span> findKeywords(String loweredInstruction) {
        List<Span> spans = new ArrayList<>();
        for (KeywordPattern keyword : keywordPatterns) {
            Matcher matcher = keyword.pattern().matcher(loweredInstruction);
            while (matcher.find())
                spans.add(new Span(keyword.sentiment(), matcher.start(), matcher.end()));
        }
        return spans;
    }

    /** Characters between keyword and mention, -1 if they overlap. */
    private static int distance(Span keyword, int mentionStart, int mentionEnd) {
        if (keyword.end() <= mentionStart)
            return mentionStart - keyword.end();
        if (keyword.start() >= mentionEnd)
            return keyword.start() - mentionEnd;
        return -1;
    }

    private record KeywordPattern(Sentiment sentiment, Pattern pattern) {
    }

    private record Span(Sentiment sentiment, int start, int end) {
        int length() {
            return end - start;
        }
    }
}
