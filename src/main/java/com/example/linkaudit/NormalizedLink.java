package com.example.linkaudit;

import lombok.Value;

/** Outcome of classifying one hyperlink target. */
@Value
public class NormalizedLink {
    LinkType type;
    String target;
}
