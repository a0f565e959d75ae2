package it.unitn.intervals.utils;

import java.util.function.BiFunction;

public interface Comparing {

    static <T extends Comparable<? super T>> Ordering cmp(T a, T b) {
        final var cmp = a.compareTo(b);

        if (cmp < 0)
            return Ordering.LT;

        if (cmp > 0)
            return Ordering.GT;

        return Ordering.EQ;
    }

    /**
     * @return {@code a} unless {@code by} ranks {@code b} strictly lower
     */
    static <T> T min(BiFunction<T, T, Ordering> by, T a, T b) {
        return by.apply(a, b) == Ordering.GT ? b : a;
    }

    /**
     * @return {@code a} unless {@code by} ranks {@code b} strictly higher
     */
    static <T> T max(BiFunction<T, T, Ordering> by, T a, T b) {
        return by.apply(a, b) == Ordering.LT ? b : a;
    }

}
