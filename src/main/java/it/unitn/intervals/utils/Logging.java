package it.unitn.intervals.utils;

import org.slf4j.Logger;

public interface Logging {

    static <S, E, R> R logging(Logger logger, String operation, S state, E event, R result) {
        logger.debug("{}\n\t[{}]\n  ,\t[{}]\n ->\t[{}]", operation, state, event, result);
        return result;
    }

    static <S, R> R logging(Logger logger, String operation, S state, R result) {
        logger.debug("{}\n\t[{}]\n ->\t[{}]", operation, state, result);
        return result;
    }

}
