package com.hindsight.core.exception;

public class InvalidConfigurationException extends BacktestException {

    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
