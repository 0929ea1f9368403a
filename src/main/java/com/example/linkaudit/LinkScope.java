package com.example.linkaudit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which side of a hyperlink the link engine searches. */
public enum LinkScope {
    NAME, URL, BOTH;

    public boolean includesName() { return this != URL; }

    public boolean includesUrl() { return this != NAME; }

    @JsonValue
    public String label() { return name().toLowerCase(Locale.ROOT); }

    /** null means both. */
    @JsonCreator
    public static LinkScope parse(String value) {
        if (value == null || value.isBlank()) return BOTH;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "name": return NAME;
            case "url": return URL;
            case "both": return BOTH;
            default: throw new IllegalArgumentException("Unknown link target: " + value);
        }
    }
}
