package it.unitn.intervals.utils;

public enum Ordering {

    LT,
    EQ,
    GT;

    public Ordering reversed() {
        return switch (this) {
            case LT -> GT;
            case EQ -> EQ;
            case GT -> LT;
        };
    }

}
