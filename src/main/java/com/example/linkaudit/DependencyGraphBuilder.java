package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of which documents link to which. A link points at a file when its normalized
 * target equals the file's root-relative path, or when its display text equals the file's base
 * name (case-insensitive; every file sharing that base name is a target). Only internal and
 * document links count, and self edges are dropped.
 */
@Slf4j
@Component
public class DependencyGraphBuilder {

    public List<DependencyRecord> build(Path root, List<Path> files, List<FileLinks> linkData) {
        String rootStr = LinkPaths.of(root);

        Map<String, FileRecord> byPath = new LinkedHashMap<>();
        Map<String, Set<Integer>> idsByBase = new HashMap<>();
        List<FileRecord> records = new ArrayList<>();
        for (Path file : files) {
            String abs = file.toString();
            if (byPath.containsKey(abs)) continue;
            String rel = tryRelativize(LinkPaths.of(file), rootStr);
            if (rel == null) rel = LinkPaths.of(file);
            FileRecord rec = new FileRecord(records.size(), abs, rel,
                    LinkPaths.baseName(rel).toLowerCase(Locale.ROOT));
            records.add(rec);
            byPath.put(abs, rec);
            idsByBase.computeIfAbsent(rec.getBaseName(), k -> new LinkedHashSet<>()).add(rec.getId());
        }

        List<Set<Integer>> outgoing = new ArrayList<>();
        List<Set<Integer>> incoming = new ArrayList<>();
        List<DependencyRecord> deps = new ArrayList<>();
        for (FileRecord rec : records) {
            outgoing.add(new LinkedHashSet<>());
            incoming.add(new LinkedHashSet<>());
            DependencyRecord d = new DependencyRecord();
            d.setPath(rec.getAbsolutePath());
            d.setRelativePath(rec.getRelativePath());
            deps.add(d);
        }

        int edges = 0;
        for (FileLinks item : linkData) {
            FileRecord src = byPath.get(item.getPath());
            if (src == null) continue;
            for (Link link : item.getLinks()) {
                if (link.getType() == null || !link.getType().isDependencyCandidate()) continue;
                for (int tgt : matchTargets(link, rootStr, records, idsByBase)) {
                    if (tgt == src.getId()) continue;
                    FileRecord target = records.get(tgt);
                    outgoing.get(src.getId()).add(tgt);
                    deps.get(src.getId()).getOutgoingDetails().add(new DependencyRecord.OutgoingEdge(
                            link.getText(), hrefOf(link), target.getRelativePath()));
                    incoming.get(tgt).add(src.getId());
                    deps.get(tgt).getIncomingDetails().add(new DependencyRecord.IncomingEdge(
                            src.getRelativePath(), link.getText(), hrefOf(link)));
                    edges++;
                }
            }
        }

        for (FileRecord rec : records) {
            deps.get(rec.getId()).setOutgoingCount(outgoing.get(rec.getId()).size());
            deps.get(rec.getId()).setIncomingCount(incoming.get(rec.getId()).size());
        }
        log.debug("dependency graph: {} file(s), {} edge record(s)", records.size(), edges);
        return deps;
    }

    private static Set<Integer> matchTargets(Link link, String root, List<FileRecord> records,
                                             Map<String, Set<Integer>> idsByBase) {
        Set<Integer> matches = new LinkedHashSet<>();
        String rel = toRootRelative(link.getNormalizedTarget(), root);
        if (rel != null) {
            for (FileRecord rec : records) {
                if (rel.equals(rec.getRelativePath())) matches.add(rec.getId());
            }
        }
        String text = link.getText() == null ? "" : link.getText().strip().toLowerCase(Locale.ROOT);
        if (!text.isEmpty()) {
            matches.addAll(idsByBase.getOrDefault(text, Set.of()));
        }
        return matches;
    }

    /**
     * Normalized target as a path under root when it can be expressed as one,
     * otherwise the target itself with '/' separators.
     */
    static String toRootRelative(String normalized, String root) {
        if (normalized == null || normalized.isEmpty()) return null;
        String val = LinkPaths.toSlashes(normalized);
        if (LinkPaths.isAbsolute(val)) {
            String rel = tryRelativize(val, root);
            if (rel != null && !rel.startsWith("..")) return rel;
        }
        String rel = tryRelativize(LinkPaths.join(root, val), root);
        if (rel != null && !rel.startsWith("..")) return rel;
        return val;
    }

    private static String tryRelativize(String target, String base) {
        try {
            return LinkPaths.relativize(target, base);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String hrefOf(Link link) {
        return link.getRawHref() != null ? link.getRawHref() : link.getNormalizedTarget();
    }
}
