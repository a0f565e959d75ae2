package it.unitn.intervals;

/**
 * Thrown when a pair of {@link Endpoint}s does not bound a non-empty range.
 */
public final class InvalidIntervalException extends IntervalException {

    private static final long serialVersionUID = 1L;

    private static final String TEMPLATE = "invalid interval: %s is not below %s";

    private final transient Endpoint<?> left;
    private final transient Endpoint<?> right;

    public InvalidIntervalException(Endpoint<?> left, Endpoint<?> right) {
        super(TEMPLATE.formatted(left, right));
        this.left = left;
        this.right = right;
    }

    public Endpoint<?> left() {
        return left;
    }

    public Endpoint<?> right() {
        return right;
    }

}
