package it.unitn.intervals;

import it.unitn.intervals.utils.Logging;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static it.unitn.intervals.utils.Windowing.pairwise;

/**
 * Possibly disconnected subset of a totally ordered domain, stored in canonical form:
 * {@link Interval}s in ascending order, pairwise separated.
 * <br>
 * A subset has exactly one canonical form, hence {@link #equals(Object)} compares the represented subsets:
 * endpoint by endpoint, with values compared through {@code compareTo} as every other operation does.
 * Instances are immutable; every operation returns a new {@link IntervalSet} and none of them fails.
 */
public final class IntervalSet<T extends Comparable<? super T>> {

    private static final Logger LOG = LoggerFactory.getLogger(IntervalSet.class);

    private final ImmutableList<Interval<T>> intervals;

    private IntervalSet(ImmutableList<Interval<T>> intervals) {
        this.intervals = intervals;
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> empty() {
        return new IntervalSet<>(Lists.immutable.empty());
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> universe() {
        return of(Interval.<T>universe());
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> of(Interval<T> interval) {
        return new IntervalSet<>(Lists.immutable.with(Objects.requireNonNull(interval, "interval")));
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> IntervalSet<T> of(Interval<T>... intervals) {
        return of(Lists.immutable.with(intervals));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> of(Iterable<Interval<T>> intervals) {
        return Lists.immutable.withAll(intervals).injectInto(IntervalSet.<T>empty(), (s, i) -> s.union(i));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> open(T low, T high) {
        return of(Interval.open(low, high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> closed(T low, T high) {
        return of(Interval.closed(low, high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> openClosed(T low, T high) {
        return of(Interval.openClosed(low, high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> closedOpen(T low, T high) {
        return of(Interval.closedOpen(low, high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> unboundedOpen(T high) {
        return of(Interval.unboundedOpen(high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> unboundedClosed(T high) {
        return of(Interval.unboundedClosed(high));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> openUnbounded(T low) {
        return of(Interval.openUnbounded(low));
    }

    public static <T extends Comparable<? super T>> IntervalSet<T> closedUnbounded(T low) {
        return of(Interval.closedUnbounded(low));
    }

    /**
     * @return the canonical form, in ascending order
     */
    public ImmutableList<Interval<T>> intervals() {
        return intervals;
    }

    public int size() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public boolean isUniverse() {
        return intervals.size() == 1 && intervals.getFirst().isUniverse();
    }

    public boolean contains(T value) {
        return intervals.anySatisfy(i -> i.contains(value));
    }

    /**
     * The intervals not separated from {@code interval} form a contiguous run:
     * they are merged with it and the run is replaced by the result.
     */
    public IntervalSet<T> union(Interval<T> interval) {
        Objects.requireNonNull(interval, "interval");

        final var parts = intervals.partition(i -> i.isSeparatedFrom(interval));
        final var merged = parts.getRejected().injectInto(interval, Interval::merge);
        final var below = parts.getSelected().select(i -> Endpoints.gap(interval.left(), i.right()));
        final var above = parts.getSelected().reject(i -> Endpoints.gap(interval.left(), i.right()));

        return Logging.logging(LOG, "union", this, interval, new IntervalSet<>(below.newWith(merged).newWithAll(above)));
    }

    public IntervalSet<T> union(IntervalSet<T> other) {
        return Logging.logging(LOG, "union", this, other, other.intervals.injectInto(this, (s, i) -> s.union(i)));
    }

    /**
     * Two-pointer scan over both canonical forms, advancing the side whose current interval ends first.
     */
    public IntervalSet<T> intersection(IntervalSet<T> other) {
        final var shared = Lists.mutable.<Interval<T>>empty();

        int i = 0;
        int j = 0;

        while (i < intervals.size() && j < other.intervals.size()) {
            final var a = intervals.get(i);
            final var b = other.intervals.get(j);

            a.intersect(b).ifPresent(shared::add);

            switch (Endpoints.asUpper(a.right(), b.right())) {
                case LT -> i++;
                case GT -> j++;
                case EQ -> {
                    i++;
                    j++;
                }
            }
        }

        return Logging.logging(LOG, "intersection", this, other, new IntervalSet<>(shared.toImmutable()));
    }

    public IntervalSet<T> complement() {
        if (intervals.isEmpty())
            return Logging.logging(LOG, "complement", this, universe());

        final var gaps = Lists.mutable.<Interval<T>>empty();

        final var first = intervals.getFirst();
        if (first.left() instanceof Endpoint.Bounded)
            gaps.add(new Interval<T>(Endpoint.<T>unbounded(), Endpoints.flip(first.left())));

        pairwise(intervals).forEach(p -> gaps.add(new Interval<T>(
            Endpoints.flip(p.getOne().right()),
            Endpoints.flip(p.getTwo().left())
        )));

        final var last = intervals.getLast();
        if (last.right() instanceof Endpoint.Bounded)
            gaps.add(new Interval<T>(Endpoints.flip(last.right()), Endpoint.<T>unbounded()));

        return Logging.logging(LOG, "complement", this, new IntervalSet<>(gaps.toImmutable()));
    }

    public IntervalSet<T> difference(IntervalSet<T> other) {
        return intersection(other.complement());
    }

    public IntervalSet<T> or(IntervalSet<T> other) {
        return union(other);
    }

    public IntervalSet<T> and(IntervalSet<T> other) {
        return intersection(other);
    }

    public IntervalSet<T> not() {
        return complement();
    }

    public IntervalSet<T> minus(IntervalSet<T> other) {
        return difference(other);
    }

    public String render(Notation notation) {
        if (intervals.isEmpty())
            return notation.empty();

        return intervals.collect(i -> i.render(notation)).makeString(notation.union());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        return o instanceof IntervalSet<?> that
            && intervals.size() == that.intervals.size()
            && intervals.zip(that.intervals).allSatisfy(p ->
                Endpoints.same(p.getOne().left(), p.getTwo().left()) && Endpoints.same(p.getOne().right(), p.getTwo().right())
            );
    }

    /**
     * Values equal under {@code compareTo} may have different hash codes, so only the endpoint kinds are hashed.
     */
    @Override
    public int hashCode() {
        int hash = 1;

        for (final var i : intervals)
            hash = 31 * hash + 3 * Endpoints.kind(i.left()) + Endpoints.kind(i.right());

        return hash;
    }

    @Override
    public String toString() {
        return render(Notation.DEFAULT);
    }

}
