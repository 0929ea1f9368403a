package com.example.linkaudit;

import com.fasterxml.jackson.annotation.JsonValue;

/** Classification of a hyperlink target. */
public enum LinkType {
    EMAIL("email"),
    INTERNAL("internal"),
    DOCUMENT("document"),
    EXTERNAL("external"),
    UNKNOWN("unknown");

    private final String label;

    LinkType(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    /** internal and document links are the only ones that can point at another file of the scan */
    public boolean isDependencyCandidate() {
        return this == INTERNAL || this == DOCUMENT;
    }
}
