package it.unitn.intervals;

import it.unitn.intervals.utils.Ordering;

import static it.unitn.intervals.utils.Comparing.cmp;

/**
 * Role-aware comparisons of {@link Endpoint}s.
 * <br>
 * As a lower bound, {@link Endpoint.Unbounded} comes first and, at equal values, {@link Endpoint.Closed} comes
 * before {@link Endpoint.Open}.
 * As an upper bound, {@link Endpoint.Unbounded} comes last and, at equal values, {@link Endpoint.Open} comes
 * before {@link Endpoint.Closed}.
 */
interface Endpoints {

    static <T extends Comparable<? super T>> Ordering asLower(Endpoint<T> a, Endpoint<T> b) {
        if (a instanceof Endpoint.Bounded<T> x && b instanceof Endpoint.Bounded<T> y) {
            final var byValue = cmp(x.value(), y.value());
            return byValue == Ordering.EQ ? closedFirst(x, y) : byValue;
        }

        if (a instanceof Endpoint.Bounded)
            return Ordering.GT;

        if (b instanceof Endpoint.Bounded)
            return Ordering.LT;

        return Ordering.EQ;
    }

    static <T extends Comparable<? super T>> Ordering asUpper(Endpoint<T> a, Endpoint<T> b) {
        if (a instanceof Endpoint.Bounded<T> x && b instanceof Endpoint.Bounded<T> y) {
            final var byValue = cmp(x.value(), y.value());
            return byValue == Ordering.EQ ? closedFirst(x, y).reversed() : byValue;
        }

        if (a instanceof Endpoint.Bounded)
            return Ordering.LT;

        if (b instanceof Endpoint.Bounded)
            return Ordering.GT;

        return Ordering.EQ;
    }

    /**
     * @param lower left endpoint of the interval lying above
     * @param upper right endpoint of the interval lying below
     * @return whether there is a gap between the two, so that not even their closures touch
     */
    static <T extends Comparable<? super T>> boolean gap(Endpoint<T> lower, Endpoint<T> upper) {
        if (lower instanceof Endpoint.Bounded<T> l && upper instanceof Endpoint.Bounded<T> u)
            return switch (cmp(l.value(), u.value())) {
                case LT -> false;
                case EQ -> l instanceof Endpoint.Open && u instanceof Endpoint.Open;
                case GT -> true;
            };

        return false;
    }

    /**
     * @return whether {@code left} and {@code right} bound a non-empty range
     */
    static <T extends Comparable<? super T>> boolean valid(Endpoint<T> left, Endpoint<T> right) {
        if (left instanceof Endpoint.Bounded<T> l && right instanceof Endpoint.Bounded<T> r)
            return switch (cmp(l.value(), r.value())) {
                case LT -> true;
                case EQ -> l instanceof Endpoint.Closed && r instanceof Endpoint.Closed;
                case GT -> false;
            };

        return true;
    }

    static <T> Endpoint<T> flip(Endpoint<T> endpoint) {
        if (endpoint instanceof Endpoint.Open<T> o)
            return Endpoint.closed(o.value());

        if (endpoint instanceof Endpoint.Closed<T> c)
            return Endpoint.open(c.value());

        return endpoint;
    }

    /**
     * @return whether {@code a} and {@code b} have the same kind and, if bounded, values equal under
     * {@code compareTo}
     */
    static boolean same(Endpoint<?> a, Endpoint<?> b) {
        if (a instanceof Endpoint.Bounded<?> x && b instanceof Endpoint.Bounded<?> y)
            return kind(x) == kind(y) && sameValue(x.value(), y.value());

        return kind(a) == kind(b);
    }

    static int kind(Endpoint<?> endpoint) {
        if (endpoint instanceof Endpoint.Open)
            return 1;

        if (endpoint instanceof Endpoint.Closed)
            return 2;

        return 0;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static boolean sameValue(Object a, Object b) {
        if (a.equals(b))
            return true;

        return a.getClass() == b.getClass() && ((Comparable) a).compareTo(b) == 0;
    }

    private static <T> Ordering closedFirst(Endpoint.Bounded<T> a, Endpoint.Bounded<T> b) {
        if ((a instanceof Endpoint.Closed) == (b instanceof Endpoint.Closed))
            return Ordering.EQ;

        return a instanceof Endpoint.Closed ? Ordering.LT : Ordering.GT;
    }

}
