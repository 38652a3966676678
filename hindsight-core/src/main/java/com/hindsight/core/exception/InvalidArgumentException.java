package com.hindsight.core.exception;

public class InvalidArgumentException extends BacktestException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
