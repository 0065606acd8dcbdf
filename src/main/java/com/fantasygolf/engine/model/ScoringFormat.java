package com.fantasygolf.engine.model;

import com.fantasygolf.engine.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a tournament's raw performance score reads.
 * Stableford points are better when higher, medal strokes when lower.
 */
public enum ScoringFormat {
    STABLEFORD("stableford"),
    MEDAL("medal");

    private final String value;

    ScoringFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ScoringFormat fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException("scoringFormat", "must not be empty");
        }
        for (ScoringFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new ValidationException("scoringFormat", "unknown scoring format '" + value + "'");
    }
}
