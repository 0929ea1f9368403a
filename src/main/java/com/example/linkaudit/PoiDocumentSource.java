package com.example.linkaudit;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Opens .docx files with Apache POI. The whole package is read into memory, the file is not kept open. */
@Component
public class PoiDocumentSource implements DocumentSource {

    @Override
    public DocumentHandle open(Path file) throws DocumentOpenException {
        try (InputStream in = Files.newInputStream(file)) {
            return new PoiDocumentHandle(file, new XWPFDocument(in));
        } catch (IOException | RuntimeException e) {
            throw new DocumentOpenException("Cannot open " + file + ": " + e.getMessage(), e);
        }
    }
}
