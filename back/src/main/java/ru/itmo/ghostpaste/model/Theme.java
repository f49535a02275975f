package ru.itmo.ghostpaste.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import ru.itmo.ghostpaste.exception.InvalidInputException;

public enum Theme {
    LIGHT("light"),
    DARK("dark"),
    AUTO("auto");

    private final String value;

    Theme(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Theme fromValue(String value) {
        for (Theme theme : values()) {
            if (theme.value.equalsIgnoreCase(value)) {
                return theme;
            }
        }
        throw new InvalidInputException("Unsupported theme: " + value);
    }
}
