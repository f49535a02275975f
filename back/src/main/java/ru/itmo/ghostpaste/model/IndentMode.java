package ru.itmo.ghostpaste.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import ru.itmo.ghostpaste.exception.InvalidInputException;

public enum IndentMode {
    TABS("tabs"),
    SPACES("spaces");

    private final String value;

    IndentMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IndentMode fromValue(String value) {
        for (IndentMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new InvalidInputException("Unsupported indent mode: " + value);
    }
}
