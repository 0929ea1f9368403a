package com.example.linkaudit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a raw hyperlink target and, for file-system targets, rewrites it relative to the scan root.
 * Rules are evaluated in order and the first hit wins; the hub/keyword checks run before the scheme
 * checks, so an https link to the organization's hub is internal.
 */
@Component
public class LinkNormalizer {

    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*):");

    private final String hubDomain;
    private final String orgKeyword;

    public LinkNormalizer(@Value("${linkaudit.links.hub-domain:skfgroup.sharepoint.com}") String hubDomain,
                          @Value("${linkaudit.links.org-keyword:skf}") String orgKeyword) {
        this.hubDomain = lower(hubDomain);
        this.orgKeyword = lower(orgKeyword);
    }

    /**
     * @param href        raw relationship target or field URL
     * @param docPath     path of the document holding the link, may be null
     * @param baseDir     directory results are made relative to, may be null
     */
    public NormalizedLink normalize(String href, String docPath, String baseDir) {
        String h = href == null ? "" : href.strip();
        String low = h.toLowerCase(Locale.ROOT);
        String scheme = schemeOf(h);

        if ("mailto".equals(scheme) || low.contains("mailto:")) {
            return new NormalizedLink(LinkType.EMAIL, h);
        }
        if (!hubDomain.isEmpty() && low.contains(hubDomain)) {
            return new NormalizedLink(low.contains("document") ? LinkType.DOCUMENT : LinkType.INTERNAL, h);
        }
        if (!orgKeyword.isEmpty() && low.contains(orgKeyword)) {
            return new NormalizedLink(LinkType.INTERNAL, h);
        }
        if ("http".equals(scheme) || "https".equals(scheme) || "ftp".equals(scheme) || h.startsWith("//")) {
            return new NormalizedLink(LinkType.EXTERNAL, h);
        }
        if ("file".equals(scheme)) {
            String path = percentDecode(filePathOf(h));
            if (path.length() > 2 && path.charAt(0) == '/' && path.charAt(2) == ':') {
                path = path.substring(1);
            }
            return new NormalizedLink(LinkType.INTERNAL, relativeOrAbsolute(LinkPaths.normalize(path), baseDir));
        }
        if (LinkPaths.isDriveAbsolute(h)) {
            return new NormalizedLink(LinkType.INTERNAL, relativeOrAbsolute(LinkPaths.normalize(h), baseDir));
        }
        if (docPath != null && !docPath.isEmpty()) {
            try {
                // relative targets are URI references, Word writes "My%20Doc.docx"
                String rel = h.indexOf('%') >= 0 ? percentDecode(h) : h;
                String candidate = LinkPaths.join(LinkPaths.parent(docPath), rel);
                if (baseDir != null && !baseDir.isEmpty()) {
                    return new NormalizedLink(LinkType.INTERNAL, LinkPaths.relativize(candidate, baseDir));
                }
                return new NormalizedLink(LinkType.INTERNAL, candidate);
            } catch (IllegalArgumentException e) {
                // not resolvable against the document, falls through to unknown
            }
        }
        return new NormalizedLink(LinkType.UNKNOWN, h);
    }

    private static String relativeOrAbsolute(String normalized, String baseDir) {
        if (baseDir == null || baseDir.isEmpty()) return normalized;
        try {
            return LinkPaths.relativize(normalized, baseDir);
        } catch (IllegalArgumentException e) {
            return normalized;
        }
    }

    static String schemeOf(String h) {
        Matcher m = SCHEME.matcher(h);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    /** Path portion of a file URL; the authority (host) part is dropped. */
    static String filePathOf(String h) {
        String rest = h.substring(h.indexOf(':') + 1);
        if (rest.startsWith("//")) {
            int slash = rest.indexOf('/', 2);
            rest = slash < 0 ? "" : rest.substring(slash);
        }
        int cut = indexOfAny(rest, '?', '#');
        return cut < 0 ? rest : rest.substring(0, cut);
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a), ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }

    private static String percentDecode(String s) {
        try {
            // '+' is a literal character in a path
            return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
