package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Find/replace restricted to hyperlinks: display text, targets, or both.
 * Handles relationship hyperlinks (w:hyperlink r:id) and legacy HYPERLINK field instructions.
 * A matching target is replaced as a whole by the replacement text, not just the matched part.
 */
@Slf4j
@Service
public class LinkFindReplaceService {

    private static final String FIELD_DIRECTIVE = "HYPERLINK";
    private static final Pattern FIELD_URL_DOUBLE = Pattern.compile("HYPERLINK\\s+\"([^\"]+)\"");
    private static final Pattern FIELD_URL_SINGLE = Pattern.compile("HYPERLINK\\s+'([^']+)'");
    private static final Pattern FIELD_URL_BARE = Pattern.compile("HYPERLINK\\s+(\\S+)");

    private final DocumentSource documents;
    private final BackupWriter backupWriter;

    public LinkFindReplaceService(DocumentSource documents, BackupWriter backupWriter) {
        this.documents = documents;
        this.backupWriter = backupWriter;
    }

    /**
     * @param replaceText null for find-only
     * @param scope       which side of each hyperlink is searched
     * @param backupPath  where to copy the original when something matched, may be null
     * @throws DocumentOpenException when the file cannot be read as a document
     * @throws DocumentSaveException when the mutated document cannot be written back
     */
    public FindReplaceResult findReplace(Path file, String findText, String replaceText, LinkScope scope, Path backupPath)
            throws IOException {
        if (findText == null || findText.isEmpty()) {
            return FindReplaceResult.noFindText(file.toString());
        }
        LinkScope target = scope == null ? LinkScope.BOTH : scope;

        FindReplaceResult result = new FindReplaceResult();
        result.setPath(file.toString());

        try (DocumentHandle doc = documents.open(file)) {
            Scan scan = new Scan(doc, new LiteralMatcher(findText), replaceText, target);
            for (DocumentHandle.Paragraph p : doc.getAllParagraphs()) {
                scan.fieldHyperlinks(p);
                for (DocumentHandle.Hyperlink hl : p.getHyperlinks()) scan.hyperlink(hl);
            }
            result.setMatchesCount(scan.matches);
            result.setSnippets(scan.snippets);

            if (scan.matches > 0 && backupPath != null) {
                Path copy = backupWriter.copyOriginal(file, backupPath);
                if (copy != null) result.setCopyPath(copy.toString());
            }

            boolean replace = replaceText != null && scan.matches > 0;
            if (replace) {
                doc.save();
                result.setStatus(FindReplaceStatus.REPLACED_AND_SAVED);
            } else {
                result.setStatus(FindReplaceStatus.FOUND);
            }
            if (!scan.foundUrls.isEmpty()) result.setFoundUrls(new ArrayList<>(scan.foundUrls));
            if (!scan.foundTexts.isEmpty()) result.setFoundTexts(new ArrayList<>(scan.foundTexts));
            result.setDidReplace(replace);
        }
        log.debug("link find '{}' ({}) in {}: {} match(es), {}",
                findText, target.label(), file, result.getMatchesCount(), result.getStatus());
        return result;
    }

    /** URL of a HYPERLINK field instruction: double-quoted, single-quoted, then bare. */
    static String fieldUrl(String instruction) {
        for (Pattern p : new Pattern[]{FIELD_URL_DOUBLE, FIELD_URL_SINGLE, FIELD_URL_BARE}) {
            Matcher m = p.matcher(instruction);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    /** Per-call state; one document, one search. */
    private static final class Scan {
        final DocumentHandle doc;
        final LiteralMatcher matcher;
        final String replaceText;
        final LinkScope scope;

        int matches;
        final List<String> snippets = new ArrayList<>();
        final Set<String> foundUrls = new LinkedHashSet<>();
        final Set<String> foundTexts = new LinkedHashSet<>();

        Scan(DocumentHandle doc, LiteralMatcher matcher, String replaceText, LinkScope scope) {
            this.doc = doc;
            this.matcher = matcher;
            this.replaceText = replaceText;
            this.scope = scope;
        }

        void hyperlink(DocumentHandle.Hyperlink hl) {
            Optional<DocumentHandle.LinkRelationship> rel = relationshipOf(hl);
            String url = rel.map(DocumentHandle.LinkRelationship::getTarget).orElse(null);
            String linkText = hl.getText();

            if (scope.includesName() && !linkText.isEmpty() && matcher.containsIn(linkText)) {
                matches += matcher.count(linkText);
                snippets.add("text: " + linkText);
                foundTexts.add(linkText);
                if (replaceText != null) replaceInRuns(hl.getRuns());
            }

            if (scope.includesUrl() && url != null && matcher.containsIn(url)) {
                matches += matcher.count(url);
                snippets.add("url: " + url);
                foundUrls.add(url);
                if (replaceText != null) {
                    DocumentHandle.LinkRelationship old = rel.get();
                    try {
                        DocumentHandle.LinkRelationship created =
                                doc.createHyperlinkRelationship(replaceText, old.isExternal());
                        hl.setRelationshipId(created.getId());
                        snippets.add("replaced-url: " + old.getTarget() + " -> " + replaceText
                                + " (rId=" + created.getId() + ")");
                    } catch (RuntimeException e) {
                        log.warn("rewriting hyperlink {} failed: {}", old.getId(), e.getMessage());
                        snippets.add("replace-url-failed: " + e.getMessage());
                    }
                }
            }
        }

        void fieldHyperlinks(DocumentHandle.Paragraph p) {
            for (DocumentHandle.TextRun instr : p.getFieldInstructions()) {
                String instruction = instr.getText();
                if (!instruction.contains(FIELD_DIRECTIVE)) continue;
                String url = fieldUrl(instruction);
                String linkText = p.getText();

                if (scope.includesUrl() && url != null && matcher.containsIn(url)) {
                    matches += matcher.count(url);
                    snippets.add("field-url: " + url);
                    foundUrls.add(url);
                    if (replaceText != null) {
                        try {
                            instr.setText(instruction.replace(url, replaceText));
                            snippets.add("replaced-field-url: " + url + " -> " + replaceText);
                        } catch (RuntimeException e) {
                            log.warn("rewriting field hyperlink {} failed: {}", url, e.getMessage());
                            snippets.add("replace-field-url-failed: " + e.getMessage());
                        }
                    }
                }

                if (scope.includesName() && !linkText.isEmpty() && matcher.containsIn(linkText)) {
                    matches += matcher.count(linkText);
                    snippets.add("field-text: " + linkText);
                    foundTexts.add(linkText);
                    if (replaceText != null) replaceInRuns(p.getRuns());
                }
            }
        }

        /** Substitutes inside each run on its own so run boundaries and formatting stay as they are. */
        private void replaceInRuns(List<DocumentHandle.TextRun> runs) {
            for (DocumentHandle.TextRun run : runs) {
                String t = run.getText();
                if (!t.isEmpty() && matcher.containsIn(t)) run.setText(matcher.replaceAll(t, replaceText));
            }
        }

        private Optional<DocumentHandle.LinkRelationship> relationshipOf(DocumentHandle.Hyperlink hl) {
            try {
                return doc.getRelationship(hl.getRelationshipId());
            } catch (RuntimeException e) {
                log.debug("unresolvable relationship {}: {}", hl.getRelationshipId(), e.getMessage());
                return Optional.empty();
            }
        }
    }
}
