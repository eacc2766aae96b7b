package de.bsommerfeld.kurral.feed.instruction;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the instruction parsers.
 */
final class InstructionText {

    private static final String WORD_CHAR = "[a-z0-9_]";

    private InstructionText() {
    }

    static String lower(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Whole-word pattern for a lowered phrase. Inner whitespace matches any
     * run of whitespace.
     */
    static Pattern wordPattern(String phrase) {
        String[] words = lower(phrase).split("\\s+");
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0)
                body.append("\\s+");
            body.append(Pattern.quote(words[i]));
        }
        return Pattern.compile("(?<!" + WORD_CHAR + ")" + body + "(?!" + WORD_CHAR + ")");
    }

    /** Like {@link #wordPattern} but also accepts a leading {@code #}. */
    static Pattern mentionPattern(String topic) {
        return Pattern.compile("(?<!" + WORD_CHAR + ")#?" + Pattern.quote(lower(topic)) + "(?!" + WORD_CHAR + ")");
    }
}
