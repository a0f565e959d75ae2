package it.unitn.intervals;

public abstract sealed class IntervalException extends RuntimeException
    permits InvalidIntervalException, MergeSeparatedIntervalsException {

    private static final long serialVersionUID = 1L;

    protected IntervalException(String message) {
        super(message);
    }

}
