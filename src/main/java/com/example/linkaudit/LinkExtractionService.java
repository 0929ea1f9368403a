package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Read-only hyperlink extraction, classified by {@link LinkNormalizer}. */
@Slf4j
@Service
public class LinkExtractionService {

    static final String NO_TEXT = "[Image/Object]";

    private final DocumentSource documents;
    private final LinkNormalizer normalizer;

    public LinkExtractionService(DocumentSource documents, LinkNormalizer normalizer) {
        this.documents = documents;
        this.normalizer = normalizer;
    }

    /** Relationship hyperlinks of every paragraph; hyperlinks whose relationship is missing are ignored. */
    public List<Link> extractLinks(DocumentHandle doc, Path docPath, Path baseDir) {
        String docPathStr = docPath == null ? null : LinkPaths.of(docPath);
        String baseDirStr = baseDir == null ? null : LinkPaths.of(baseDir);

        List<Link> links = new ArrayList<>();
        for (DocumentHandle.Paragraph p : doc.getAllParagraphs()) {
            for (DocumentHandle.Hyperlink hl : p.getHyperlinks()) {
                Optional<DocumentHandle.LinkRelationship> rel = doc.getRelationship(hl.getRelationshipId());
                if (rel.isEmpty()) continue;
                String url = rel.get().getTarget();
                if (url == null || url.isEmpty()) continue;

                String text = hl.getText();
                NormalizedLink n = normalizer.normalize(url, docPathStr, baseDirStr);
                links.add(new Link(text.isEmpty() ? NO_TEXT : text, url, n.getTarget(), n.getType()));
            }
        }
        return links;
    }

    /** One entry per file, in input order; unreadable files carry an error and no links. */
    public List<FileLinks> collectLinksForFiles(List<Path> files, Path baseDir) {
        List<FileLinks> out = new ArrayList<>(files.size());
        for (Path file : files) {
            Path base = baseDir != null ? baseDir : file.toAbsolutePath().getParent();
            try (DocumentHandle doc = documents.open(file)) {
                out.add(new FileLinks(file.toString(), extractLinks(doc, file, base), null));
            } catch (IOException | RuntimeException e) {
                log.warn("link extraction failed for {}: {}", file, e.getMessage());
                out.add(new FileLinks(file.toString(), List.of(), e.getMessage()));
            }
        }
        return out;
    }

    /** Track-changes flag plus links resolved against the file's own folder. */
    public FileAnalysis analyzeFile(Path file) throws IOException {
        try (DocumentHandle doc = documents.open(file)) {
            List<Link> links = extractLinks(doc, file, file.toAbsolutePath().getParent());
            return new FileAnalysis(file.toString(), doc.isTrackRevisions(), links);
        }
    }
}
