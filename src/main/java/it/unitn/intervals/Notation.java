package it.unitn.intervals;

import java.util.Objects;

/**
 * Symbols used to render {@link Interval}s and {@link IntervalSet}s.
 */
public record Notation(
    String negativeInfinity,
    String positiveInfinity,
    String separator,
    String union,
    String empty
) {

    public static final Notation DEFAULT = new Notation("-∞", "+∞", ", ", " ∪ ", "∅");

    public static final Notation ASCII = new Notation("-inf", "+inf", ", ", " U ", "{}");

    public Notation {
        Objects.requireNonNull(negativeInfinity, "negativeInfinity");
        Objects.requireNonNull(positiveInfinity, "positiveInfinity");
        Objects.requireNonNull(separator, "separator");
        Objects.requireNonNull(union, "union");
        Objects.requireNonNull(empty, "empty");
    }

}
