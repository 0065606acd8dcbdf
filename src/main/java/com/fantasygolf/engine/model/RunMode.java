package com.fantasygolf.engine.model;

import com.fantasygolf.engine.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum RunMode {
    PREVIEW,
    APPLY;

    /**
     * Parses {@code preview} or {@code apply}, ignoring case. A missing value means preview.
     */
    @JsonCreator
    public static RunMode fromValue(String value) {
        if (value == null) {
            return PREVIEW;
        }
        for (RunMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new ValidationException("mode", "must be preview or apply, was '" + value + "'");
    }
}
