package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Literal, case-insensitive find/replace over the body text of one document:
 * body paragraphs and the paragraphs of table cells, nested tables included.
 */
@Slf4j
@Service
public class TextFindReplaceService {

    private final DocumentSource documents;
    private final BackupWriter backupWriter;

    public TextFindReplaceService(DocumentSource documents, BackupWriter backupWriter) {
        this.documents = documents;
        this.backupWriter = backupWriter;
    }

    /**
     * @param replaceText null for find-only
     * @param backupPath  where to copy the original when something matched, may be null
     * @throws DocumentOpenException when the file cannot be read as a document
     * @throws DocumentSaveException when the mutated document cannot be written back
     */
    public FindReplaceResult findReplace(Path file, String findText, String replaceText, Path backupPath)
            throws IOException {
        if (findText == null || findText.isEmpty()) {
            return FindReplaceResult.noFindText(file.toString());
        }
        LiteralMatcher matcher = new LiteralMatcher(findText);
        FindReplaceResult result = new FindReplaceResult();
        result.setPath(file.toString());

        try (DocumentHandle doc = documents.open(file)) {
            int matches = 0;
            for (DocumentHandle.Paragraph p : doc.getAllParagraphs()) {
                String text = p.getText();
                int found = matcher.count(text);
                if (found == 0) continue;
                matches += found;
                result.getSnippets().add(matcher.snippet(text));
                if (replaceText != null) {
                    p.setText(matcher.replaceAll(text, replaceText));
                }
            }
            result.setMatchesCount(matches);

            // the file on disk is still untouched here
            if (matches > 0 && backupPath != null) {
                Path copy = backupWriter.copyOriginal(file, backupPath);
                if (copy != null) result.setCopyPath(copy.toString());
            }

            if (replaceText != null && matches > 0) {
                doc.save();
                result.setStatus(FindReplaceStatus.REPLACED_AND_SAVED);
            } else {
                result.setStatus(FindReplaceStatus.FOUND);
            }
        }
        log.debug("text find '{}' in {}: {} match(es), {}", findText, file, result.getMatchesCount(), result.getStatus());
        return result;
    }
}
