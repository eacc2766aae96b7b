package de.bsommerfeld.kurral.feed.ranking;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a sorted list and drops posts by authors who already filled their
 * share: at most {@code topWindowLimit} per author among the first
 * {@code topWindowSize} accepted results, at most {@code totalLimit} overall.
 * Counters live only for the duration of one {@link #apply} call.
 */
final class AuthorDiversityCap {

    private final int topWindowSize;
    private final int topWindowLimit;
    private final int totalLimit;

    AuthorDiversityCap(int topWindowSize, int topWindowLimit, int totalLimit) {
        this.topWindowSize = topWindowSize;
        this.topWindowLimit = topWindowLimit;
        this.totalLimit = totalLimit;
    }

    List<ScoredCandidate> apply(List<ScoredCandidate> sorted, int limit) {
        List<ScoredCandidate> accepted = new ArrayList<>();
        Map<String, Integer> perAuthor = new HashMap<>();

        for (ScoredCandidate item : sorted) {
            if (accepted.size() >= limit)
                break;
            String author = item.candidate().authorId();
            int count = perAuthor.getOrDefault(author, 0);
            int cap = accepted.size() < topWindowSize ? topWindowLimit : totalLimit;
            if (count >= cap)
                continue;
            perAuthor.put(author, count + 1);
            accepted.add(item);
        }
        return accepted;
    }
}
