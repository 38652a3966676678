package com.hindsight.core.exception;

/**
 * Base class for errors raised by the backtest core.
 */
public class BacktestException extends RuntimeException {

    public BacktestException(String message) {
        super(message);
    }

    public BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
