package ru.itmo.ghostpaste.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import ru.itmo.ghostpaste.exception.InvalidInputException;

public enum WrapMode {
    NONE("none"),
    SOFT("soft"),
    HARD("hard");

    private final String value;

    WrapMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static WrapMode fromValue(String value) {
        for (WrapMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new InvalidInputException("Unsupported wrap mode: " + value);
    }
}
