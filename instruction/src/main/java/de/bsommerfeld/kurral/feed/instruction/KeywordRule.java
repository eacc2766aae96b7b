package de.bsommerfeld.kurral.feed.instruction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps a set of trigger phrases to a value. A rule matches when the lowered
 * instruction contains any of its phrases.
 */
record KeywordRule<T>(T value, List<String> phrases) {

    KeywordRule {
        phrases = phrases.stream().map(InstructionText::lower).collect(Collectors.toList());
    }

    boolean matches(String loweredInstruction) {
        for (String phrase : phrases) {
            if (loweredInstruction.contains(phrase))
                return true;
        }
        return false;
    }
}
