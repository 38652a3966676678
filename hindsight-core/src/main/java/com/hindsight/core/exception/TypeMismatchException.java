package com.hindsight.core.exception;

public class TypeMismatchException extends BacktestException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
