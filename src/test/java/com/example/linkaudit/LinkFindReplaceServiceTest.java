package com.example.linkaudit;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkFindReplaceServiceTest {

    @TempDir
    Path tempDir;

    private final LinkFindReplaceService engine =
            new LinkFindReplaceService(new PoiDocumentSource(), new BackupWriter());

    private Path linked() throws Exception {
        return DocxFixtures.write(tempDir.resolve("links.docx"), doc -> {
            DocxFixtures.paragraph(doc, "Intro mentions old-site in plain text");
            DocxFixtures.hyperlink(doc, "Old portal", "https://old-site.example.com/home");
            DocxFixtures.hyperlink(doc, "Old portal", "https://old-site.example.com/home");
            DocxFixtures.hyperlink(doc, "Handbook", "https://docs.example.com/handbook");
        });
    }

    private static String targetOf(XWPFDocument doc, XWPFParagraph p) {
        XWPFHyperlinkRun run = (XWPFHyperlinkRun) p.getRuns().get(0);
        return doc.getPackagePart().getRelationship(run.getHyperlinkId()).getTargetURI().toString();
    }

    @Test
    void findOnlyReportsDistinctUrlsAndLeavesTheFile() throws Exception {
        Path file = linked();
        byte[] before = Files.readAllBytes(file);

        FindReplaceResult result = engine.findReplace(file, "OLD-SITE", null, LinkScope.URL, null);

        assertEquals(2, result.getMatchesCount());
        assertEquals(List.of("https://old-site.example.com/home"), result.getFoundUrls());
        assertNull(result.getFoundTexts());
        assertEquals(FindReplaceStatus.FOUND, result.getStatus());
        assertFalse(result.getDidReplace());
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void plainBodyTextIsNeverALinkMatch() throws Exception {
        Path file = linked();

        FindReplaceResult result = engine.findReplace(file, "plain text", null, LinkScope.BOTH, null);

        assertEquals(0, result.getMatchesCount());
        assertTrue(result.getSnippets().isEmpty());
    }

    @Test
    void urlScopeReplacesTheWholeTargetAndKeepsTheText() throws Exception {
        Path file = linked();

        FindReplaceResult result = engine.findReplace(file, "old-site", "https://new.example.org/",
                LinkScope.URL, null);

        assertEquals(FindReplaceStatus.REPLACED_AND_SAVED, result.getStatus());
        assertTrue(result.getDidReplace());
        assertTrue(result.getSnippets().stream().anyMatch(s -> s.startsWith("replaced-url: https://old-site.example.com/home -> https://new.example.org/")));
        try (XWPFDocument doc = DocxFixtures.read(file)) {
            XWPFParagraph first = doc.getParagraphs().get(1);
            assertEquals("https://new.example.org/", targetOf(doc, first));
            assertEquals("Old portal", first.getText());
            assertEquals("https://new.example.org/", targetOf(doc, doc.getParagraphs().get(2)));
            assertEquals("https://docs.example.com/handbook", targetOf(doc, doc.getParagraphs().get(3)));
        }
    }

    @Test
    void nameScopeRewritesTextAndKeepsTheTarget() throws Exception {
        Path file = linked();

        FindReplaceResult result = engine.findReplace(file, "old", "New", LinkScope.NAME, null);

        assertEquals(2, result.getMatchesCount());
        assertEquals(List.of("Old portal"), result.getFoundTexts());
        assertNull(result.getFoundUrls());
        try (XWPFDocument doc = DocxFixtures.read(file)) {
            XWPFParagraph p = doc.getParagraphs().get(1);
            assertEquals("New portal", p.getText());
            assertEquals("https://old-site.example.com/home", targetOf(doc, p));
            assertEquals("Intro mentions old-site in plain text", doc.getParagraphs().get(0).getText());
        }
    }

    @Test
    void bothScopesCountTextAndUrlSeparately() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("both.docx"),
                doc -> DocxFixtures.hyperlink(doc, "wiki page", "https://wiki.example.com/"));

        FindReplaceResult result = engine.findReplace(file, "wiki", null, null, null);

        assertEquals(2, result.getMatchesCount());
        assertEquals(List.of("text: wiki page", "url: https://wiki.example.com/"), result.getSnippets());
    }

    @Test
    void fieldHyperlinkUrlIsRewrittenInTheInstruction() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("field.docx"),
                doc -> DocxFixtures.fieldHyperlink(doc, "Legacy link", "http://intranet/old/page.htm"));

        FindReplaceResult found = engine.findReplace(file, "intranet/old", null, LinkScope.URL, null);
        assertEquals(1, found.getMatchesCount());
        assertEquals(List.of("field-url: http://intranet/old/page.htm"), found.getSnippets());

        engine.findReplace(file, "intranet/old", "http://intranet/new/page.htm", LinkScope.URL, null);

        try (XWPFDocument doc = DocxFixtures.read(file)) {
            String instruction = doc.getParagraphs().get(0).getCTP().getRArray(1).getInstrTextArray(0).getStringValue();
            assertEquals(" HYPERLINK \"http://intranet/new/page.htm\" ", instruction);
            assertEquals("Legacy link", doc.getParagraphs().get(0).getText());
        }
    }

    @Test
    void fieldHyperlinkTextMatchesOnTheParagraph() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("field-name.docx"),
                doc -> DocxFixtures.fieldHyperlink(doc, "Legacy link", "http://intranet/page.htm"));

        FindReplaceResult result = engine.findReplace(file, "legacy", "Current", LinkScope.NAME, null);

        assertEquals(1, result.getMatchesCount());
        assertEquals(List.of("Legacy link"), result.getFoundTexts());
        try (XWPFDocument doc = DocxFixtures.read(file)) {
            assertEquals("Current link", doc.getParagraphs().get(0).getText());
        }
    }

    @Test
    void fieldUrlAcceptsQuotedAndBareForms() {
        assertEquals("a b.docx", LinkFindReplaceService.fieldUrl(" HYPERLINK \"a b.docx\" "));
        assertEquals("x.htm", LinkFindReplaceService.fieldUrl("HYPERLINK 'x.htm' \\o tip"));
        assertEquals("http://h/p", LinkFindReplaceService.fieldUrl("HYPERLINK http://h/p \\l top"));
        assertNull(LinkFindReplaceService.fieldUrl("PAGEREF _Toc1"));
    }

    @Test
    void backupIsWrittenOnlyWhenSomethingMatched() throws Exception {
        Path file = linked();
        byte[] original = Files.readAllBytes(file);
        Path missBackup = tempDir.resolve("copies/miss.docx");
        Path hitBackup = tempDir.resolve("copies/hit.docx");

        engine.findReplace(file, "nowhere", "x", LinkScope.BOTH, missBackup);
        FindReplaceResult hit = engine.findReplace(file, "handbook", "https://docs.example.com/guide", LinkScope.URL, hitBackup);

        assertFalse(Files.exists(missBackup));
        assertEquals(hitBackup.toString(), hit.getCopyPath());
        assertArrayEquals(original, Files.readAllBytes(hitBackup));
    }

    @Test
    void missingSearchText() throws Exception {
        FindReplaceResult result = engine.findReplace(tempDir.resolve("none.docx"), null, "x", LinkScope.URL, null);
        assertEquals(FindReplaceStatus.NO_FIND_TEXT, result.getStatus());
    }

    @Test
    void urlCanBeReplacedWithAWindowsPath() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("win.docx"),
                doc -> DocxFixtures.hyperlink(doc, "Doc", "https://example.com/old"));

        FindReplaceResult result = engine.findReplace(file, "old", "C:\\docs\\new doc.docx", LinkScope.URL, null);

        assertTrue(result.getSnippets().stream().noneMatch(s -> s.startsWith("replace-url-failed")),
                result.getSnippets().toString());
        try (XWPFDocument doc = DocxFixtures.read(file)) {
            String target = targetOf(doc, doc.getParagraphs().get(0));
            assertEquals("file:///C:/docs/new%20doc.docx", target);
            NormalizedLink n = new LinkNormalizer("hub.example.com", "acme").normalize(target, null, null);
            assertEquals(new NormalizedLink(LinkType.INTERNAL, "C:/docs/new doc.docx"), n);
        }
    }

    @Test
    void relativeReplacementWithSpacesIsEncoded() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("rel.docx"),
                doc -> DocxFixtures.hyperlink(doc, "Doc", "https://example.com/old"));

        engine.findReplace(file, "old", "sub dir/Next Doc.docx", LinkScope.URL, null);

        try (XWPFDocument doc = DocxFixtures.read(file)) {
            assertEquals("sub%20dir/Next%20Doc.docx", targetOf(doc, doc.getParagraphs().get(0)));
        }
    }

    @Test
    void rawTargetsThatAreNotUrisStillMatch() throws Exception {
        Path file = DocxFixtures.write(tempDir.resolve("raw.docx"),
                doc -> DocxFixtures.hyperlink(doc, "Go", "https://placeholder.example.org/other"));
        DocxFixtures.rewriteRelationshipTarget(file, "https://placeholder.example.org/other", "Other Doc.docx");

        FindReplaceResult result = engine.findReplace(file, "other doc", null, LinkScope.URL, null);

        assertEquals(1, result.getMatchesCount());
        assertEquals(List.of("Other Doc.docx"), result.getFoundUrls());
    }

    @Test
    void failedRewriteIsReportedAndLaterLinksAreStillRewritten() throws Exception {
        Path file = linked();
        LinkFindReplaceService flaky = new LinkFindReplaceService(
                f -> new FirstRewriteFails(new PoiDocumentSource().open(f)), new BackupWriter());

        FindReplaceResult result = flaky.findReplace(file, "old-site", "https://new.example.org/", LinkScope.URL, null);

        assertEquals(2, result.getMatchesCount());
        assertTrue(result.getSnippets().contains("replace-url-failed: relationship table locked"),
                result.getSnippets().toString());
        assertTrue(result.getSnippets().stream().anyMatch(s -> s.startsWith("replaced-url: ")));
        try (XWPFDocument doc = DocxFixtures.read(file)) {
            assertEquals("https://old-site.example.com/home", targetOf(doc, doc.getParagraphs().get(1)));
            assertEquals("https://new.example.org/", targetOf(doc, doc.getParagraphs().get(2)));
        }
    }

    /** Delegating handle whose first relationship creation throws. */
    private static final class FirstRewriteFails implements DocumentHandle {
        private final DocumentHandle delegate;
        private boolean failed;

        FirstRewriteFails(DocumentHandle delegate) { this.delegate = delegate; }

        @Override public List<Paragraph> getParagraphs() { return delegate.getParagraphs(); }

        @Override public List<Table> getTables() { return delegate.getTables(); }

        @Override public Optional<LinkRelationship> getRelationship(String id) { return delegate.getRelationship(id); }

        @Override public LinkRelationship createHyperlinkRelationship(String target, boolean external) {
            if (!failed) {
                failed = true;
                throw new IllegalStateException("relationship table locked");
            }
            return delegate.createHyperlinkRelationship(target, external);
        }

        @Override public boolean isTrackRevisions() { return delegate.isTrackRevisions(); }

        @Override public void save() throws DocumentSaveException { delegate.save(); }

        @Override public void close() throws java.io.IOException { delegate.close(); }
    }
}
