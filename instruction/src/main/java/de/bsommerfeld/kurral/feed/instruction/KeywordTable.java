package de.bsommerfeld.kurral.feed.instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link KeywordRule}s evaluated first-match-wins.
 */
final class KeywordTable<T> {

    private final List<KeywordRule<T>> rules;

    private KeywordTable(List<KeywordRule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    static <T> Builder<T> builder() {
        return new Builder<>();
    }

    Optional<T> firstMatch(String loweredInstruction) {
        for (KeywordRule<T> rule : rules) {
            if (rule.matches(loweredInstruction))
                return Optional.of(rule.value());
        }
        return Optional.empty();
    }

    static final class Builder<T> {
        private final List<KeywordRule<T>> rules = new ArrayList<>();

        Builder<T> rule(T value, String... phrases) {
            rules.add(new KeywordRule<>(value, List.of(phrases)));
            return this;
        }

        KeywordTable<T> build() {
            return new KeywordTable<>(rules);
        }
    }
}
