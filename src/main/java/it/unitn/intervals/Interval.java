package it.unitn.intervals;

import it.unitn.intervals.utils.Ordering;

import java.util.Objects;
import java.util.Optional;

import static it.unitn.intervals.utils.Comparing.cmp;
import static it.unitn.intervals.utils.Comparing.max;
import static it.unitn.intervals.utils.Comparing.min;

/**
 * Contiguous range of a totally ordered domain, bounded by a {@code left} and a {@code right} {@link Endpoint}.
 * <br>
 * Every instance is valid: when both sides are bounded, {@code low < high}, or {@code low <= high} if both sides
 * are {@link Endpoint.Closed}. Otherwise the constructor throws {@link InvalidIntervalException}.
 */
public record Interval<T extends Comparable<? super T>>(Endpoint<T> left, Endpoint<T> right) {

    public Interval {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        if (!Endpoints.valid(left, right))
            throw new InvalidIntervalException(left, right);
    }

    public static <T extends Comparable<? super T>> Interval<T> of(Endpoint<T> left, Endpoint<T> right) {
        return new Interval<>(left, right);
    }

    public static <T extends Comparable<? super T>> boolean isValid(Endpoint<T> left, Endpoint<T> right) {
        return Endpoints.valid(left, right);
    }

    /**
     * @return {@code (low, high)}
     */
    public static <T extends Comparable<? super T>> Interval<T> open(T low, T high) {
        return new Interval<>(Endpoint.open(low), Endpoint.open(high));
    }

    /**
     * @return {@code [low, high]}, degenerate when {@code low} equals {@code high}
     */
    public static <T extends Comparable<? super T>> Interval<T> closed(T low, T high) {
        return new Interval<>(Endpoint.closed(low), Endpoint.closed(high));
    }

    /**
     * @return {@code (low, high]}
     */
    public static <T extends Comparable<? super T>> Interval<T> openClosed(T low, T high) {
        return new Interval<>(Endpoint.open(low), Endpoint.closed(high));
    }

    /**
     * @return {@code [low, high)}
     */
    public static <T extends Comparable<? super T>> Interval<T> closedOpen(T low, T high) {
        return new Interval<>(Endpoint.closed(low), Endpoint.open(high));
    }

    /**
     * @return {@code (-∞, high)}
     */
    public static <T extends Comparable<? super T>> Interval<T> unboundedOpen(T high) {
        return new Interval<T>(Endpoint.<T>unbounded(), Endpoint.open(high));
    }

    /**
     * @return {@code (-∞, high]}
     */
    public static <T extends Comparable<? super T>> Interval<T> unboundedClosed(T high) {
        return new Interval<T>(Endpoint.<T>unbounded(), Endpoint.closed(high));
    }

    /**
     * @return {@code (low, +∞)}
     */
    public static <T extends Comparable<? super T>> Interval<T> openUnbounded(T low) {
        return new Interval<T>(Endpoint.open(low), Endpoint.<T>unbounded());
    }

    /**
     * @return {@code [low, +∞)}
     */
    public static <T extends Comparable<? super T>> Interval<T> closedUnbounded(T low) {
        return new Interval<T>(Endpoint.closed(low), Endpoint.<T>unbounded());
    }

    /**
     * @return {@code (-∞, +∞)}
     */
    public static <T extends Comparable<? super T>> Interval<T> universe() {
        return new Interval<T>(Endpoint.<T>unbounded(), Endpoint.<T>unbounded());
    }

    /**
     * @return the value of the left endpoint, empty when unbounded on the left
     */
    public Optional<T> low() {
        return left instanceof Endpoint.Bounded<T> b ? Optional.of(b.value()) : Optional.empty();
    }

    /**
     * @return the value of the right endpoint, empty when unbounded on the right
     */
    public Optional<T> high() {
        return right instanceof Endpoint.Bounded<T> b ? Optional.of(b.value()) : Optional.empty();
    }

    public boolean isUniverse() {
        return left instanceof Endpoint.Unbounded && right instanceof Endpoint.Unbounded;
    }

    public boolean isDegenerate() {
        return left instanceof Endpoint.Closed<T> l
            && right instanceof Endpoint.Closed<T> r
            && cmp(l.value(), r.value()) == Ordering.EQ;
    }

    public boolean isBounded() {
        return left instanceof Endpoint.Bounded && right instanceof Endpoint.Bounded;
    }

    public boolean isUnbounded() {
        return !isBounded();
    }

    public boolean contains(T value) {
        final var point = Endpoint.closed(value);

        return Endpoints.asLower(left, point) != Ordering.GT
            && Endpoints.asUpper(right, point) != Ordering.LT;
    }

    /**
     * Two intervals are separated when the closure of each one is disjoint from the other one:
     * there is a gap between them, so that not even an open boundary touches.
     */
    public boolean isSeparatedFrom(Interval<T> other) {
        return Endpoints.gap(left, other.right) || Endpoints.gap(other.left, right);
    }

    /**
     * @return the convex hull of {@code this} and {@code other}
     * @throws MergeSeparatedIntervalsException if {@code this} is separated from {@code other}
     */
    public Interval<T> merge(Interval<T> other) {
        if (isSeparatedFrom(other))
            throw new MergeSeparatedIntervalsException(this, other);

        return new Interval<>(
            min(Endpoints::asLower, left, other.left),
            max(Endpoints::asUpper, right, other.right)
        );
    }

    /**
     * @return the points shared by {@code this} and {@code other}, empty when there is none
     */
    public Optional<Interval<T>> intersect(Interval<T> other) {
        final var l = max(Endpoints::asLower, left, other.left);
        final var r = min(Endpoints::asUpper, right, other.right);

        return Endpoints.valid(l, r) ? Optional.of(new Interval<>(l, r)) : Optional.empty();
    }

    public String render(Notation notation) {
        final var lo = low().map(Object::toString).orElse(notation.negativeInfinity());
        final var hi = high().map(Object::toString).orElse(notation.positiveInfinity());

        if (isDegenerate())
            return "[%s]".formatted(lo);

        return "%s%s%s%s%s".formatted(
            left instanceof Endpoint.Closed ? "[" : "(",
            lo,
            notation.separator(),
            hi,
            right instanceof Endpoint.Closed ? "]" : ")"
        );
    }

    @Override
    public String toString() {
        return render(Notation.DEFAULT);
    }

}
