package com.example.linkaudit;

import org.apache.poi.xwpf.usermodel.XWPFHyperlinkRun;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the visible text of a paragraph into a single run.
 * Hyperlink and field runs are anchors: their text is cleared but the elements stay,
 * every other run is removed.
 */
final class ParagraphTextWriter {
    private ParagraphTextWriter() {}

    static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final QName QN_XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    static void replaceText(XWPFParagraph p, String text) {
        List<XWPFRun> runs = p.getRuns();
        int baseIdx = -1;
        for (int i = 0; i < runs.size(); i++) {
            if (!isAnchoredRun(runs.get(i))) { baseIdx = i; break; }
        }

        for (int i = runs.size() - 1; i >= 0; i--) {
            if (i == baseIdx) continue;
            XWPFRun r = p.getRuns().get(i);
            if (isAnchoredRun(r)) clearRunText(r);
            else p.removeRun(i);
        }

        XWPFRun base = null;
        for (XWPFRun r : p.getRuns()) {
            if (!isAnchoredRun(r)) { base = r; break; }
        }
        if (base == null) base = p.createRun();
        writeTextToRun(base, text);
    }

    /** Hyperlink runs and runs carrying field characters or instructions. */
    static boolean isAnchoredRun(XWPFRun r) {
        var ctr = r.getCTR(); if (ctr == null) return false;
        if (r instanceof XWPFHyperlinkRun) return true;
        if (ctr.sizeOfFldCharArray() > 0) return true;
        if (ctr.sizeOfInstrTextArray() > 0) return true;
        return false;
    }

    private static void clearRunText(XWPFRun r) {
        var ctr = r.getCTR(); if (ctr == null) return;
        for (XmlObject o : select(ctr, "./w:t|./w:br|./w:cr|./w:tab")) {
            try (XmlCursor c = o.newCursor()) { c.removeXml(); }
        }
    }

    static List<XmlObject> select(XmlObject scope, String path) {
        List<XmlObject> out = new ArrayList<>();
        try (XmlCursor c = scope.newCursor()) {
            c.selectPath("declare namespace w='" + NS_W + "' " + path);
            while (c.toNextSelection()) out.add(c.getObject());
        }
        return out;
    }

    /** One w:t per line, separated by w:br; tabs inside a line become w:tab. */
    private static void writeTextToRun(XWPFRun r, String text) {
        if (text == null) text = "";
        String s = text.replace("\r\n", "\n").replace('\r', '\n')
                       .replace('\u2028', '\n').replace('\u2029', '\n');

        clearRunText(r);
        CTR ctr = r.getCTR();
        String[] lines = s.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) ctr.addNewBr();
            String[] cells = lines[i].split("\t", -1);
            for (int j = 0; j < cells.length; j++) {
                if (j > 0) ctr.addNewTab();
                if (cells[j].isEmpty() && cells.length > 1) continue;
                CTText t = ctr.addNewT();
                t.setStringValue(cells[j]);
                try (XmlCursor tc = t.newCursor()) { tc.setAttributeText(QN_XML_SPACE, "preserve"); }
            }
        }
    }

    static String readText(XmlObject node) {
        try (XmlCursor c = node.newCursor()) {
            String v = c.getTextValue();
            return v == null ? "" : v;
        }
    }

    static void writeText(XmlObject node, String text) {
        try (XmlCursor c = node.newCursor()) {
            c.setTextValue(text == null ? "" : text);
        }
        try (XmlCursor c = node.newCursor()) {
            c.setAttributeText(QN_XML_SPACE, "preserve");
        }
    }
}
