package de.bsommerfeld.kurral.feed.instruction;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;

import java.util.List;

/**
 * Result of compiling one viewer instruction.
 *
 * @param newConfig         the configuration to persist; a fresh copy, never
 *                          the one passed in
 * @param changes           human-readable change log, in detection order
 * @param interestsToAdd    free-form interests to add to the viewer
 * @param interestsToRemove free-form interests to remove from the viewer
 */
public record CompiledInstruction(
        FeedConfig newConfig,
        List<String> changes,
        List<String> interestsToAdd,
        List<String> interestsToRemove) {

    static final String NO_SIGNAL =
            "Couldn't detect any strong signal in your instruction, so the configuration stayed as is.";

    public CompiledInstruction {
        changes = List.copyOf(changes);
        interestsToAdd = List.copyOf(interestsToAdd);
        interestsToRemove = List.copyOf(interestsToRemove);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public boolean hasInterestChanges() {
        return !interestsToAdd.isEmpty() || !interestsToRemove.isEmpty();
    }

    /**
     * One-line explanation for the viewer.
     */
    public String summary() {
        if (changes.isEmpty())
            return NO_SIGNAL;
        return "Heuristics applied: " + String.join("; ", changes) + ".";
    }
}
