package it.unitn.intervals.utils;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.stream.IntStream;
import java.util.stream.Stream;

public interface Windowing {

    static <T> Stream<ImmutableList<T>> windowed(int n, ImmutableList<T> xs) {
        if (n <= 0)
            return Stream.empty();

        return IntStream.range(0, xs.size() - n + 1).mapToObj(i -> xs.subList(i, i + n));
    }

    static <T> Stream<Pair<T, T>> pairwise(ImmutableList<T> xs) {
        return windowed(2, xs).map(w -> Tuples.pair(w.get(0), w.get(1)));
    }

}
