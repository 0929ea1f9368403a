package com.example.linkaudit;

import lombok.Value;

/** A hyperlink as found in a document. */
@Value
public class Link {
    String text;
    String rawHref;
    String normalizedTarget;
    LinkType type;
}
