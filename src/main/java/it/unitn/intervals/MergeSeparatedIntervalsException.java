package it.unitn.intervals;

/**
 * Thrown by {@link Interval#merge(Interval)} when there is a gap between the two intervals.
 */
public final class MergeSeparatedIntervalsException extends IntervalException {

    private static final long serialVersionUID = 1L;

    private static final String TEMPLATE = "separated intervals cannot be merged: %s, %s";

    private final transient Interval<?> a;
    private final transient Interval<?> b;

    public MergeSeparatedIntervalsException(Interval<?> a, Interval<?> b) {
        super(TEMPLATE.formatted(a, b));
        this.a = a;
        this.b = b;
    }

    public Interval<?> a() {
        return a;
    }

    public Interval<?> b() {
        return b;
    }

}
