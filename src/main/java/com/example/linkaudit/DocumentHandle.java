package com.example.linkaudit;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What the engines need from an open Word document: paragraphs and tables, text runs,
 * hyperlink references and their relationship table, the settings flags, and persistence.
 */
public interface DocumentHandle extends Closeable {

    List<Paragraph> getParagraphs();

    List<Table> getTables();

    /** Any relationship of the main document part by id. */
    Optional<LinkRelationship> getRelationship(String id);

    LinkRelationship createHyperlinkRelationship(String target, boolean external);

    boolean isTrackRevisions();

    /** Writes the current state back to the file this handle was opened from. */
    void save() throws DocumentSaveException;

    /** Body paragraphs first, then every paragraph of every table cell, nested tables included. */
    default List<Paragraph> getAllParagraphs() {
        List<Paragraph> out = new ArrayList<>(getParagraphs());
        for (Table t : getTables()) collectTableParagraphs(t, out);
        return out;
    }

    private static void collectTableParagraphs(Table table, List<Paragraph> out) {
        for (Row row : table.getRows()) {
            for (Cell cell : row.getCells()) {
                out.addAll(cell.getParagraphs());
                for (Table nested : cell.getTables()) collectTableParagraphs(nested, out);
            }
        }
    }

    interface Paragraph {
        /** Rendered text, hyperlink text included, field instructions excluded. */
        String getText();

        /** Replaces the whole visible text of the paragraph. */
        void setText(String text);

        /** Text nodes of the paragraph's own runs. */
        List<TextRun> getRuns();

        List<Hyperlink> getHyperlinks();

        /** Field instruction text nodes anywhere inside the paragraph. */
        List<TextRun> getFieldInstructions();
    }

    interface Hyperlink {
        /** May be null for anchor-only hyperlinks. */
        String getRelationshipId();

        void setRelationshipId(String id);

        List<TextRun> getRuns();

        default String getText() {
            StringBuilder sb = new StringBuilder();
            for (TextRun r : getRuns()) sb.append(r.getText());
            return sb.toString();
        }
    }

    interface TextRun {
        String getText();

        void setText(String text);
    }

    interface Table {
        List<Row> getRows();
    }

    interface Row {
        List<Cell> getCells();
    }

    interface Cell {
        List<Paragraph> getParagraphs();

        List<Table> getTables();
    }

    interface LinkRelationship {
        String getId();

        String getTarget();

        boolean isExternal();
    }
}
