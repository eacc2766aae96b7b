package de.bsommerfeld.kurral.feed.ranking;

/**
 * What one scoring term adds to a candidate's score.
 *
 * @param delta  points added (negative for penalties)
 * @param reason short human-readable justification, {@code null} if the term
 *               never explains itself
 */
public record TermContribution(double delta, String reason) {

    public static final TermContribution NONE = new TermContribution(0.0, null);

    public static TermContribution of(double delta, String reason) {
        return new TermContribution(delta, reason);
    }

    public static TermContribution silent(double delta) {
        return new TermContribution(delta, null);
    }
}
