package com.example.linkaudit;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String based path arithmetic with '/' separators.
 * Drive-letter paths ("C:\a\b") behave the same on every OS.
 */
public final class LinkPaths {
    private LinkPaths() {}

    private static final Pattern DRIVE_ABS = Pattern.compile("^[A-Za-z]:[\\\\/].*");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    public static boolean isDriveAbsolute(String s) {
        return s != null && DRIVE_ABS.matcher(s).matches();
    }

    public static boolean isAbsolute(String s) {
        if (s == null || s.isEmpty()) return false;
        return s.startsWith("/") || s.startsWith("\\") || isDriveAbsolute(s);
    }

    public static String toSlashes(String s) {
        return s == null ? null : s.replace('\\', '/');
    }

    public static String of(Path p) {
        return toSlashes(p.toAbsolutePath().normalize().toString());
    }

    /** Collapses ".", ".." and duplicate separators. An empty relative path becomes ".". */
    public static String normalize(String path) {
        String s = toSlashes(path == null ? "" : path);
        String root = rootOf(s);
        String rest = s.substring(root.length());

        Deque<String> out = new ArrayDeque<>();
        for (String seg : rest.split("/")) {
            if (seg.isEmpty() || ".".equals(seg)) continue;
            if ("..".equals(seg)) {
                if (!out.isEmpty() && !"..".equals(out.peekLast())) {
                    out.removeLast();
                } else if (root.isEmpty()) {
                    out.addLast(seg);
                }
                // ".." above an absolute root is dropped
                continue;
            }
            out.addLast(seg);
        }
        String body = String.join("/", out);
        if (root.isEmpty()) return body.isEmpty() ? "." : body;
        return root + body;
    }

    public static String parent(String path) {
        String n = normalize(path);
        String root = rootOf(n);
        int idx = n.lastIndexOf('/');
        if (idx < root.length()) return root.isEmpty() ? "." : root;
        return n.substring(0, idx);
    }

    /** Joins child onto base; an absolute child replaces base. */
    public static String join(String base, String child) {
        if (isAbsolute(child)) return normalize(child);
        if (base == null || base.isEmpty()) return normalize(child);
        return normalize(toSlashes(base) + "/" + child);
    }

    /**
     * Path of target relative to base, both taken as absolute.
     *
     * @throws IllegalArgumentException when the two paths do not share a root (different drives,
     *                                  or one of them is relative)
     */
    public static String relativize(String target, String base) {
        String t = normalize(target);
        String b = normalize(base);
        String tRoot = rootOf(t);
        String bRoot = rootOf(b);
        if (tRoot.isEmpty() || bRoot.isEmpty() || !tRoot.equalsIgnoreCase(bRoot)) {
            throw new IllegalArgumentException("path " + target + " is on a different root than " + base);
        }
        List<String> ts = segments(t.substring(tRoot.length()));
        List<String> bs = segments(b.substring(bRoot.length()));

        int common = 0;
        while (common < ts.size() && common < bs.size() && ts.get(common).equals(bs.get(common))) common++;

        List<String> rel = new ArrayList<>();
        for (int i = common; i < bs.size(); i++) rel.add("..");
        rel.addAll(ts.subList(common, ts.size()));
        return rel.isEmpty() ? "." : String.join("/", rel);
    }

    /** Returns the file name without its last extension. */
    public static String baseName(String path) {
        String s = toSlashes(path);
        String name = s.substring(s.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String rootOf(String s) {
        if (DRIVE_PREFIX.matcher(s).matches()) {
            return s.length() > 2 && s.charAt(2) == '/' ? s.substring(0, 3) : s.substring(0, 2);
        }
        if (s.startsWith("/")) return "/";
        return "";
    }

    private static List<String> segments(String s) {
        List<String> out = new ArrayList<>();
        for (String seg : s.split("/")) if (!seg.isEmpty()) out.add(seg);
        return out;
    }
}
