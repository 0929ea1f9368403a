package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.opc.PackageNamespaces;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRelation;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHyperlink;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.namespace.QName;

/**
 * {@link DocumentHandle} over an in-memory {@link XWPFDocument}.
 * Relationship targets are reported as written in the package: POI swaps targets that are not
 * valid URIs (raw spaces, backslashes) for a dummy, so the raw Target attributes are read from
 * the main part's relationship part.
 */
@Slf4j
public class PoiDocumentHandle implements DocumentHandle {

    private static final String HYPERLINK_REL = XWPFRelation.HYPERLINK.getRelation();
    private static final String URI_SAFE = "-._~:/?#@!$&'()*+,;=";

    private final Path file;
    private final XWPFDocument doc;
    private Map<String, String> rawTargets;

    public PoiDocumentHandle(Path file, XWPFDocument doc) {
        this.file = file;
        this.doc = doc;
    }

    @Override
    public List<Paragraph> getParagraphs() {
        return wrapParagraphs(doc.getParagraphs());
    }

    @Override
    public List<Table> getTables() {
        return wrapTables(doc.getTables());
    }

    @Override
    public Optional<LinkRelationship> getRelationship(String id) {
        if (id == null || id.isEmpty()) return Optional.empty();
        PackageRelationship rel = doc.getPackagePart().getRelationship(id);
        return Optional.ofNullable(rel).map(r -> new PoiRelationship(r, rawTargets().get(r.getId())));
    }

    @Override
    public LinkRelationship createHyperlinkRelationship(String target, boolean external) {
        PackagePart part = doc.getPackagePart();
        URI uri = toTargetUri(target);
        PackageRelationship rel = part.addRelationship(uri, external ? TargetMode.EXTERNAL : TargetMode.INTERNAL,
                HYPERLINK_REL);
        return new PoiRelationship(rel, null);
    }

    /**
     * Relationship targets must be URIs. Backslashes become '/', drive and UNC paths become
     * file URLs, and characters a URI cannot hold are percent-encoded as UTF-8.
     *
     * @throws IllegalArgumentException when the result still does not parse
     */
    static URI toTargetUri(String target) {
        String s = target == null ? "" : target.strip();
        boolean unc = s.startsWith("\\\\");
        s = s.replace('\\', '/');
        if (LinkPaths.isDriveAbsolute(s)) {
            s = "file:///" + s;
        } else if (unc) {
            s = "file:" + s;
        }
        try {
            return PackagingURIHelper.toURI(percentEncode(s));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid target - " + e.getMessage(), e);
        }
    }

    private static String percentEncode(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean keep = c < 0x80 && (Character.isLetterOrDigit(c) || URI_SAFE.indexOf(c) >= 0);
            if (c == '%' && isEscape(s, i)) keep = true;
            if (keep) {
                sb.append(c);
                continue;
            }
            int end = Character.isHighSurrogate(c) && i + 1 < s.length() ? i + 2 : i + 1;
            for (byte b : s.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
                sb.append('%').append(String.format("%02X", b & 0xFF));
            }
            i = end - 1;
        }
        return sb.toString();
    }

    private static boolean isEscape(String s, int i) {
        return i + 2 < s.length()
                && Character.digit(s.charAt(i + 1), 16) >= 0
                && Character.digit(s.charAt(i + 2), 16) >= 0;
    }

    /** Id to Target attribute, as found in the relationship part the document was loaded with. */
    private Map<String, String> rawTargets() {
        if (rawTargets != null) return rawTargets;
        rawTargets = new HashMap<>();
        PackagePart main = doc.getPackagePart();
        try {
            PackagePartName relsName = PackagingURIHelper.getRelationshipPartName(main.getPartName());
            PackagePart rels = main.getPackage().getPart(relsName);
            if (rels == null) return rawTargets;
            XmlObject xml;
            try (InputStream in = rels.getInputStream()) {
                xml = XmlObject.Factory.parse(in);
            }
            try (XmlCursor c = xml.newCursor()) {
                c.selectPath("declare namespace r='" + PackageNamespaces.RELATIONSHIPS + "' .//r:Relationship");
                while (c.toNextSelection()) {
                    String id = c.getAttributeText(new QName("Id"));
                    String target = c.getAttributeText(new QName("Target"));
                    if (id != null && target != null) rawTargets.put(id, target);
                }
            }
        } catch (IOException | XmlException | RuntimeException e) {
            log.debug("raw relationship targets of {} unavailable: {}", file, e.getMessage());
        }
        return rawTargets;
    }

    @Override
    public boolean isTrackRevisions() {
        return doc.isTrackRevisions();
    }

    @Override
    public void save() throws DocumentSaveException {
        // serialize fully before touching the file so a failed write leaves it intact
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            doc.write(out);
            Files.write(file, out.toByteArray());
        } catch (IOException | RuntimeException e) {
            throw new DocumentSaveException("Cannot save " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        doc.close();
    }

    private static List<Paragraph> wrapParagraphs(List<XWPFParagraph> ps) {
        List<Paragraph> out = new ArrayList<>(ps.size());
        for (XWPFParagraph p : ps) out.add(new PoiParagraph(p));
        return out;
    }

    private static List<Table> wrapTables(List<XWPFTable> ts) {
        List<Table> out = new ArrayList<>(ts.size());
        for (XWPFTable t : ts) out.add(new PoiTable(t));
        return out;
    }

    private static List<TextRun> wrapText(XmlObject scope, String path) {
        List<TextRun> out = new ArrayList<>();
        for (XmlObject o : ParagraphTextWriter.select(scope, path)) out.add(new PoiTextRun(o));
        return out;
    }

    private static final class PoiParagraph implements Paragraph {
        private final XWPFParagraph p;

        PoiParagraph(XWPFParagraph p) { this.p = p; }

        @Override public String getText() {
            String t = p.getText();
            return t == null ? "" : t;
        }

        @Override public void setText(String text) { ParagraphTextWriter.replaceText(p, text); }

        @Override public List<TextRun> getRuns() { return wrapText(p.getCTP(), "./w:r/w:t"); }

        @Override public List<Hyperlink> getHyperlinks() {
            List<Hyperlink> out = new ArrayList<>();
            for (CTHyperlink hl : p.getCTP().getHyperlinkArray()) out.add(new PoiHyperlink(hl));
            return out;
        }

        @Override public List<TextRun> getFieldInstructions() { return wrapText(p.getCTP(), ".//w:instrText"); }
    }

    private static final class PoiHyperlink implements Hyperlink {
        private final CTHyperlink hl;

        PoiHyperlink(CTHyperlink hl) { this.hl = hl; }

        @Override public String getRelationshipId() { return hl.isSetId() ? hl.getId() : null; }

        @Override public void setRelationshipId(String id) { hl.setId(id); }

        @Override public List<TextRun> getRuns() { return wrapText(hl, ".//w:t"); }
    }

    private static final class PoiTextRun implements TextRun {
        private final XmlObject node;

        PoiTextRun(XmlObject node) { this.node = node; }

        @Override public String getText() { return ParagraphTextWriter.readText(node); }

        @Override public void setText(String text) { ParagraphTextWriter.writeText(node, text); }
    }

    private static final class PoiTable implements Table {
        private final XWPFTable t;

        PoiTable(XWPFTable t) { this.t = t; }

        @Override public List<Row> getRows() {
            List<Row> out = new ArrayList<>();
            for (XWPFTableRow r : t.getRows()) out.add(new PoiRow(r));
            return out;
        }
    }

    private static final class PoiRow implements Row {
        private final XWPFTableRow r;

        PoiRow(XWPFTableRow r) { this.r = r; }

        @Override public List<Cell> getCells() {
            List<Cell> out = new ArrayList<>();
            for (XWPFTableCell c : r.getTableCells()) out.add(new PoiCell(c));
            return out;
        }
    }

    private static final class PoiCell implements Cell {
        private final XWPFTableCell c;

        PoiCell(XWPFTableCell c) { this.c = c; }

        @Override public List<Paragraph> getParagraphs() { return wrapParagraphs(c.getParagraphs()); }

        @Override public List<Table> getTables() { return wrapTables(c.getTables()); }
    }

    private static final class PoiRelationship implements LinkRelationship {
        private final PackageRelationship rel;
        private final String rawTarget;

        PoiRelationship(PackageRelationship rel, String rawTarget) {
            this.rel = rel;
            this.rawTarget = rawTarget;
        }

        @Override public String getId() { return rel.getId(); }

        @Override public String getTarget() {
            return rawTarget != null ? rawTarget : rel.getTargetURI().toString();
        }

        @Override public boolean isExternal() { return rel.getTargetMode() == TargetMode.EXTERNAL; }
    }
}
