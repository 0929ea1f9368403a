package com.example.linkaudit;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTbl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/** Builds small .docx files on disk for engine tests. */
final class DocxFixtures {
    private DocxFixtures() {}

    static Path write(Path file, Consumer<XWPFDocument> content) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        try (XWPFDocument doc = new XWPFDocument(); OutputStream out = Files.newOutputStream(file)) {
            content.accept(doc);
            doc.write(out);
        }
        return file;
    }

    static XWPFParagraph paragraph(XWPFDocument doc, String text) {
        XWPFParagraph p = doc.createParagraph();
        p.createRun().setText(text);
        return p;
    }

    static void hyperlink(XWPFDocument doc, String text, String url) {
        XWPFParagraph p = doc.createParagraph();
        XWPFHyperlinkRun run = p.createHyperlinkRun(url);
        run.setText(text);
    }

    /** Legacy field-code hyperlink: begin, instruction, separate, visible text, end. */
    static void fieldHyperlink(XWPFDocument doc, String text, String url) {
        CTP ctp = doc.createParagraph().getCTP();
        ctp.addNewR().addNewFldChar().setFldCharType(STFldCharType.BEGIN);
        ctp.addNewR().addNewInstrText().setStringValue(" HYPERLINK \"" + url + "\" ");
        ctp.addNewR().addNewFldChar().setFldCharType(STFldCharType.SEPARATE);
        ctp.addNewR().addNewT().setStringValue(text);
        ctp.addNewR().addNewFldChar().setFldCharType(STFldCharType.END);
    }

    /** A one-row table whose cells hold the given texts. */
    static XWPFTableCell[] table(XWPFDocument doc, String... cellTexts) {
        var table = doc.createTable(1, cellTexts.length);
        XWPFTableCell[] cells = new XWPFTableCell[cellTexts.length];
        for (int i = 0; i < cellTexts.length; i++) {
            cells[i] = table.getRow(0).getCell(i);
            cells[i].setText(cellTexts[i]);
        }
        return cells;
    }

    /** Puts a one-cell table holding text inside the cell. */
    static void nestedTable(XWPFTableCell cell, String text) {
        CTTc outer = cell.getCTTc();
        CTTbl tbl = outer.addNewTbl();
        CTRow row = tbl.addNewTr();
        CTTc tc = row.addNewTc();
        CTR r = tc.addNewP().addNewR();
        r.addNewT().setStringValue(text);
        outer.addNewP();
    }

    static XWPFDocument read(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            return new XWPFDocument(in);
        }
    }

    /**
     * Rewrites a Target attribute of the main part's relationships as raw text, the way other
     * tools write targets POI would never produce (spaces, backslashes).
     */
    static void rewriteRelationshipTarget(Path file, String from, String to) throws IOException {
        String rels = "word/_rels/document.xml.rels";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(Files.readAllBytes(file)));
             ZipOutputStream zout = new ZipOutputStream(out)) {
            ZipEntry entry;
            while ((entry = zin.getNextEntry()) != null) {
                byte[] data = zin.readAllBytes();
                if (rels.equals(entry.getName())) {
                    String xml = new String(data, StandardCharsets.UTF_8);
                    String rewritten = xml.replace("Target=\"" + from + "\"", "Target=\"" + to + "\"");
                    if (rewritten.equals(xml)) throw new IllegalStateException("no target " + from + " in " + rels);
                    data = rewritten.getBytes(StandardCharsets.UTF_8);
                }
                zout.putNextEntry(new ZipEntry(entry.getName()));
                zout.write(data);
                zout.closeEntry();
            }
        }
        Files.write(file, out.toByteArray());
    }
}
