package de.bsommerfeld.kurral.feed.instruction;

import java.util.List;

/**
 * Free-form interests an instruction asks to add or remove. Both lists are
 * lowercased, free of duplicates and disjoint.
 */
public record InterestAdjustment(List<String> add, List<String> remove) {

    public InterestAdjustment {
        add = List.copyOf(add);
        remove = List.copyOf(remove);
    }

    public boolean isEmpty() {
        return add.isEmpty() && remove.isEmpty();
    }
}
