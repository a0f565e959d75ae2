package it.unitn.intervals;

import java.util.Objects;

/**
 * Boundary of an {@link Interval}: {@link Open} excludes its value, {@link Closed} includes it,
 * {@link Unbounded} extends to infinity on its side.
 * <br>
 * An endpoint means nothing on its own: whether it sits below or above another one depends on the side
 * it terminates, see {@link Endpoints}.
 */
public sealed interface Endpoint<T> permits Endpoint.Bounded, Endpoint.Unbounded {

    static <T> Endpoint<T> open(T value) {
        return new Open<>(value);
    }

    static <T> Endpoint<T> closed(T value) {
        return new Closed<>(value);
    }

    static <T> Endpoint<T> unbounded() {
        return new Unbounded<>();
    }

    sealed interface Bounded<T> extends Endpoint<T> permits Open, Closed {

        T value();

    }

    record Open<T>(T value) implements Bounded<T> {

        public Open {
            Objects.requireNonNull(value, "value");
        }

    }

    record Closed<T>(T value) implements Bounded<T> {

        public Closed {
            Objects.requireNonNull(value, "value");
        }

    }

    record Unbounded<T>() implements Endpoint<T> {}

}
