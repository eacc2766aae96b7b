package de.bsommerfeld.kurral.feed.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Score-descending order in which near-equal scores count as a tie and are
 * broken by recency.
 *
 * <p>
 * Two scores are in the same band when {@code |a - b| < max(minBand, max(|a|, |b|) * percentage)}.
 * The band relation is not transitive, so {@link java.util.List#sort} may
 * reject this comparator. {@link #sort(List)} uses a plain stable merge sort
 * instead. Its result depends on the order it starts from, so the input is
 * first put into canonical order (newest first, then by id) and the same
 * candidates always come out in the same order.
 */
final class TieBandOrdering implements Comparator<ScoredCandidate> {

    private static final Comparator<ScoredCandidate> CANONICAL = Comparator
            .comparing((ScoredCandidate s) -> s.candidate().createdAt(), Comparator.reverseOrder())
            .thenComparing(s -> s.candidate().id())
            .thenComparing(ScoredCandidate::score, Comparator.reverseOrder());

    private final double minBand;
    private final double percentage;

    TieBandOrdering(double minBand, double percentage) {
        this.minBand = minBand;
        this.percentage = percentage;
    }

    boolean inSameBand(double a, double b) {
        double band = Math.max(minBand, Math.max(Math.abs(a), Math.abs(b)) * percentage);
        return Math.abs(a - b) < band;
    }

    @Override
    public int compare(ScoredCandidate a, ScoredCandidate b) {
        if (inSameBand(a.score(), b.score())) {
            int byRecency = b.candidate().createdAt().compareTo(a.candidate().createdAt());
            if (byRecency != 0)
                return byRecency;
        }
        int byScore = Double.compare(b.score(), a.score());
        if (byScore != 0)
            return byScore;
        return a.candidate().id().compareTo(b.candidate().id());
    }

    List<ScoredCandidate> sort(List<ScoredCandidate> input) {
        List<ScoredCandidate> items = new ArrayList<>(input);
        if (items.size() < 2)
            return items;
        items.sort(CANONICAL);
        ScoredCandidate[] buffer = items.toArray(new ScoredCandidate[0]);
        ScoredCandidate[] scratch = new ScoredCandidate[buffer.length];
        mergeSort(buffer, scratch, 0, buffer.length);
        return new ArrayList<>(List.of(buffer));
    }

    private void mergeSort(ScoredCandidate[] a, ScoredCandidate[] scratch, int from, int to) {
        if (to - from < 2)
            return;
        int mid = (from + to) >>> 1;
        mergeSort(a, scratch, from, mid);
        mergeSort(a, scratch, mid, to);

        int left = from;
        int right = mid;
        int out = from;
        while (left < mid && right < to) {
            // <= keeps equal elements in canonical order
            if (compare(a[left], a[right]) <= 0)
                scratch[out++] = a[left++];
            else
                scratch[out++] = a[right++];
        }
        while (left < mid)
            scratch[out++] = a[left++];
        while (right < to)
            scratch[out++] = a[right++];
        System.arraycopy(scratch, from, a, from, to - from);
    }
}
