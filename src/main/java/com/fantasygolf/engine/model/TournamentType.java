package com.fantasygolf.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TournamentType {
    REGULAR("regular", 1.0),
    ELEVATED("elevated", 2.0),
    SIGNATURE("signature", 3.0);

    private final String value;
    private final double defaultMultiplier;

    TournamentType(String value, double defaultMultiplier) {
        this.value = value;
        this.defaultMultiplier = defaultMultiplier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getDefaultMultiplier() {
        return defaultMultiplier;
    }

    // Unrecognised types score as regular events
    @JsonCreator
    public static TournamentType fromValue(String value) {
        if (value == null) {
            return REGULAR;
        }
        for (TournamentType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return REGULAR;
    }
}
