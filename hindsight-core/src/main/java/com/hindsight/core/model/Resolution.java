package com.hindsight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

public enum Resolution {
    SECOND("1s", Duration.ofSeconds(1)),
    MINUTE("1m", Duration.ofMinutes(1)),
    HOUR("1h", Duration.ofHours(1)),
    DAY("1d", Duration.ofDays(1));

    private final String value;
    private final Duration duration;

    Resolution(String value, Duration duration) {
        this.value = value;
        this.duration = duration;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration duration() {
        return duration;
    }

    public static Resolution fromValue(String value) {
        for (Resolution r : values()) {
            if (r.value.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown resolution: " + value);
    }
}
