package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class LinkAuditController {

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final DocxFileScanner scanner;
    private final LinkExtractionService linkExtraction;
    private final DependencyGraphBuilder graphBuilder;
    private final LinkExportService exportService;
    private final TextFindReplaceService textEngine;
    private final LinkFindReplaceService linkEngine;
    private final BulkFindReplaceService bulk;

    public LinkAuditController(DocxFileScanner scanner,
                               LinkExtractionService linkExtraction,
                               DependencyGraphBuilder graphBuilder,
                               LinkExportService exportService,
                               TextFindReplaceService textEngine,
                               LinkFindReplaceService linkEngine,
                               BulkFindReplaceService bulk) {
        this.scanner = scanner;
        this.linkExtraction = linkExtraction;
        this.graphBuilder = graphBuilder;
        this.exportService = exportService;
        this.textEngine = textEngine;
        this.linkEngine = linkEngine;
        this.bulk = bulk;
    }

    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody LinkAuditRequest req) {
        Path root = existing(req.getPath());
        if (root == null) return error(HttpStatus.BAD_REQUEST, "Path does not exist");
        return ResponseEntity.ok(Map.of("structure", scanner.scanFolderStructure(root)));
    }

    @PostMapping("/bulk_links")
    public ResponseEntity<?> bulkLinks(@RequestBody LinkAuditRequest req) {
        Path root = existing(req.getPath());
        if (root == null) return error(HttpStatus.BAD_REQUEST, "Path does not exist");

        List<Path> files = scanner.listDocxFiles(root);
        List<FileLinks> linkData = linkExtraction.collectLinksForFiles(files, root);
        int totalLinks = linkData.stream().mapToInt(f -> f.getLinks().size()).sum();
        log.info("bulk links under {}: {} file(s), {} link(s)", root, files.size(), totalLinks);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("files", linkData);
        body.put("total_links", totalLinks);
        body.put("dependencies", graphBuilder.build(root, files, linkData));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/export_links_xlsx")
    public ResponseEntity<?> exportLinksXlsx(@RequestBody LinkAuditRequest req) throws Exception {
        List<List<String>> rows;
        if (req.getPath() != null && !req.getPath().isEmpty()) {
            Path root = existing(req.getPath());
            if (root == null) return error(HttpStatus.BAD_REQUEST, "Path does not exist");
            rows = exportService.rowsFor(linkExtraction.collectLinksForFiles(scanner.listDocxFiles(root), root));
        } else {
            rows = req.getRows() == null ? List.of() : req.getRows();
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=links.xlsx")
                .contentType(XLSX)
                .body(exportService.toXlsx(rows));
    }

    @PostMapping("/find_replace")
    public ResponseEntity<?> findReplace(@RequestBody LinkAuditRequest req) {
        Path file = existing(req.getPath());
        if (file == null) return error(HttpStatus.NOT_FOUND, "File not found");
        try {
            return ResponseEntity.ok(textEngine.findReplace(file, req.getFindText(), req.getReplaceText(), null));
        } catch (Exception e) {
            log.warn("find/replace failed for {}: {}", file, e.getMessage());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PostMapping("/links_find_replace")
    public ResponseEntity<?> linksFindReplace(@RequestBody LinkAuditRequest req) {
        Path file = existing(req.getPath());
        if (file == null) return error(HttpStatus.NOT_FOUND, "File not found");
        LinkScope scope;
        try {
            scope = LinkScope.parse(req.getTarget());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        try {
            return ResponseEntity.ok(linkEngine.findReplace(file, req.getFindText(), req.getReplaceText(), scope, null));
        } catch (Exception e) {
            log.warn("link find/replace failed for {}: {}", file, e.getMessage());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    @PostMapping("/bulk_find_replace")
    public ResponseEntity<?> bulkFindReplace(@RequestBody LinkAuditRequest req) {
        Path root = existing(req.getPath());
        if (root == null) return error(HttpStatus.BAD_REQUEST, "Path does not exist");
        if (isEmpty(req.getFindText())) return noFindText();

        return ResponseEntity.ok(bulk.findReplaceTextUnder(root, req.getFindText(), req.getReplaceText(),
                req.isSaveCopiesOrDefault()));
    }

    @PostMapping("/bulk_links_find_replace")
    public ResponseEntity<?> bulkLinksFindReplace(@RequestBody LinkAuditRequest req) {
        Path root = existing(req.getPath());
        if (root == null) return error(HttpStatus.BAD_REQUEST, "Path does not exist");
        if (isEmpty(req.getFindText())) return noFindText();
        LinkScope scope;
        try {
            scope = LinkScope.parse(req.getTarget());
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        return ResponseEntity.ok(bulk.findReplaceLinksUnder(root, req.getFindText(), req.getReplaceText(), scope,
                req.isSaveCopiesOrDefault()));
    }

    @PostMapping("/analyze_file")
    public ResponseEntity<?> analyzeFile(@RequestBody LinkAuditRequest req) {
        Path file = existing(req.getPath());
        if (file == null) return error(HttpStatus.NOT_FOUND, "File not found");
        try {
            return ResponseEntity.ok(linkExtraction.analyzeFile(file));
        } catch (Exception e) {
            log.warn("analysis failed for {}: {}", file, e.getMessage());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private static Path existing(String path) {
        if (isEmpty(path)) return null;
        Path p = Paths.get(path);
        return Files.exists(p) ? p : null;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? status.getReasonPhrase() : message);
        return ResponseEntity.status(status).body(body);
    }

    private static ResponseEntity<Map<String, Object>> noFindText() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "No find_text provided");
        body.put("total_matches", 0);
        body.put("files", List.of());
        return ResponseEntity.badRequest().body(body);
    }
}
