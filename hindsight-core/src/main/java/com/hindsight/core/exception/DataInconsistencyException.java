package com.hindsight.core.exception;

public class DataInconsistencyException extends BacktestException {

    public DataInconsistencyException(String message) {
        super(message);
    }
}
