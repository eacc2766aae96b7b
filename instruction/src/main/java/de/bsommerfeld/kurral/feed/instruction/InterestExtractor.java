package de.bsommerfeld.kurral.feed.instruction;

import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls free-form interests out of an instruction.
 *
 * <p>
 * Two passes. Trigger phrases ("more", "interested in", "tired of", ...)
 * open a phrase that runs up to the next trigger, punctuation or connective;
 * its words, minus stop words, short tokens and vocabulary topics, become
 * interests, and so does the cleaned phrase when it has a few words only.
 * Then a dictionary of well-known subjects is scanned, each hit routed to
 * the remove list when a removal trigger directly precedes it.
 */
final class InterestExtractor {

    private static final Pattern PUNCTUATION = Pattern.compile("[.,;:!?()\\n]");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9#+'-]+");

    private final TopicVocabulary vocabulary;
    private final int minLength;
    private final int maxPhraseWords;
    private final List<Trigger> triggers = new ArrayList<>();
    private final Pattern removalSuffix;

    InterestExtractor(TopicVocabulary vocabulary, int minLength, int maxPhraseWords) {
        this.vocabulary = vocabulary;
        this.minLength = minLength;
        this.maxPhraseWords = maxPhraseWords;
        for (String phrase : InstructionRules.ADD_TRIGGERS)
            triggers.add(new Trigger(false, InstructionText.wordPattern(phrase)));
        for (String phrase : InstructionRules.REMOVE_TRIGGERS)
            triggers.add(new Trigger(true, InstructionText.wordPattern(phrase)));

        List<String> quoted = new ArrayList<>();
        for (String phrase : InstructionRules.REMOVE_TRIGGERS)
            quoted.add(InstructionText.wordPattern(phrase).pattern());
        this.removalSuffix = Pattern.compile("(?:" + String.join("|", quoted) + ")\\s*$");
    }

    InterestAdjustment extract(String loweredInstruction) {
        Set<String> add = new LinkedHashSet<>();
        Set<String> remove = new LinkedHashSet<>();

        List<TriggerHit> hits = selectTriggers(loweredInstruction);
        for (int i = 0; i < hits.size(); i++) {
            TriggerHit hit = hits.get(i);
            int limit = i + 1 < hits.size() ? hits.get(i + 1).start() : loweredInstruction.length();
            String phrase = loweredInstruction.substring(hit.end(), limit);
            collectPhrase(phrase, hit.removal() ? remove : add);
        }

        for (String keyword : InstructionRules.DOMAIN_KEYWORDS) {
            if (vocabulary.contains(keyword))
                continue;
            Matcher matcher = InstructionText.wordPattern(keyword).matcher(loweredInstruction);
            if (!matcher.find())
                continue;
            String before = loweredInstruction.substring(0, matcher.start());
            if (removalSuffix.matcher(before).find())
                remove.add(keyword);
            else
                add.add(keyword);
        }

        add.removeAll(remove);
        return new InterestAdjustment(new ArrayList<>(add), new ArrayList<>(remove));
    }

    /**
     * All trigger occurrences by position; at a shared start the longer
     * trigger wins and overlapped triggers are dropped.
     */
    private List<TriggerHit> selectTriggers(String text) {
        List<TriggerHit> all = new ArrayList<>();
        for (Trigger trigger : triggers) {
            Matcher matcher = trigger.pattern().matcher(text);
            while (matcher.find())
                all.add(new TriggerHit(trigger.removal(), matcher.start(), matcher.end()));
        }
        all.sort(Comparator.comparingInt(TriggerHit::start)
                .thenComparing((a, b) -> Integer.compare(b.length(), a.length())));

        List<TriggerHit> selected = new ArrayList<>();
        int coveredUntil = -1;
        for (TriggerHit hit : all) {
            if (hit.start() < coveredUntil)
                continue;
            selected.add(hit);
            coveredUntil = hit.end();
        }
        return selected;
    }

    private void collectPhrase(String rawPhrase, Set<String> target) {
        Matcher punctuation = PUNCTUATION.matcher(rawPhrase);
        String phrase = punctuation.find() ? rawPhrase.substring(0, punctuation.start()) : rawPhrase;

        List<String> words = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(phrase.trim())) {
            if (InstructionRules.PHRASE_BREAKS.contains(token))
                break;
            String word = stripHash(token);
            if (word.length() < minLength || InstructionRules.STOP_WORDS.contains(word)
                    || vocabulary.contains(word))
                continue;
            words.add(word);
        }

        target.addAll(words);
        if (words.size() > 1 && words.size() <= maxPhraseWords)
            target.add(String.join(" ", words));
    }

    private static String stripHash(String token) {
        int i = 0;
        while (i < token.length() && token.charAt(i) == '#')
            i++;
        return token.substring(i);
    }

    private record Trigger(boolean removal, Pattern pattern) {
    }

    private record TriggerHit(boolean removal, int start, int end) {
        int length() {
            return end - start;
        }
    }
}
