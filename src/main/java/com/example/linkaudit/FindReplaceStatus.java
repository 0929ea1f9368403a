package com.example.linkaudit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindReplaceStatus {
    FOUND("Found"),
    REPLACED_AND_SAVED("Replaced & Saved"),
    NO_FIND_TEXT("No find_text provided"),
    ERROR("error");

    private final String label;

    FindReplaceStatus(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
}
