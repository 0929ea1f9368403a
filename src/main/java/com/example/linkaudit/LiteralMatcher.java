package com.example.linkaudit;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Case-insensitive matching of a literal search string. The search text is never read as a regex. */
public final class LiteralMatcher {

    private static final int SNIPPET_MAX = 100;
    private static final int SNIPPET_CONTEXT = 40;

    private final String needle;
    private final Pattern pattern;

    public LiteralMatcher(String needle) {
        if (needle == null || needle.isEmpty()) throw new IllegalArgumentException("search text is empty");
        this.needle = needle;
        this.pattern = Pattern.compile(Pattern.quote(needle), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public boolean containsIn(String text) {
        return text != null && pattern.matcher(text).find();
    }

    /** Number of non-overlapping matches. */
    public int count(String text) {
        if (text == null) return 0;
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    /** Replaces every match with the replacement inserted verbatim. */
    public String replaceAll(String text, String replacement) {
        if (text == null) return null;
        return pattern.matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
    }

    /**
     * Trimmed text; when longer than 100 chars, a window of 40 chars either side of the
     * first match between "..." markers.
     */
    public String snippet(String text) {
        String s = text == null ? "" : text.strip();
        if (s.length() <= SNIPPET_MAX) return s;
        Matcher m = pattern.matcher(s);
        int idx = m.find() ? m.start() : 0;
        int start = Math.max(0, idx - SNIPPET_CONTEXT);
        int end = Math.min(s.length(), idx + needle.length() + SNIPPET_CONTEXT);
        return "..." + s.substring(start, end) + "...";
    }
}
