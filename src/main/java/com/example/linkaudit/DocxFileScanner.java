package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recursive listing of eligible documents. Lock files (~$name.docx) are skipped,
 * unreadable subfolders are skipped without failing the scan.
 */
@Slf4j
@Component
public class DocxFileScanner {

    private final String extension;
    private final String lockPrefix;

    public DocxFileScanner(@Value("${linkaudit.files.extension:.docx}") String extension,
                           @Value("${linkaudit.files.lock-prefix:~$}") String lockPrefix) {
        this.extension = extension;
        this.lockPrefix = lockPrefix;
    }

    public boolean isEligible(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(extension) && !name.startsWith(lockPrefix);
    }

    public List<Path> listDocxFiles(Path root) {
        List<Path> out = new ArrayList<>();
        for (Path entry : entries(root)) {
            if (Files.isDirectory(entry)) {
                out.addAll(listDocxFiles(entry));
            } else if (Files.isRegularFile(entry) && isEligible(entry)) {
                out.add(entry);
            }
        }
        return out;
    }

    public FolderNode scanFolderStructure(Path root) {
        Path name = root.getFileName();
        FolderNode tree = FolderNode.folder(name == null ? root.toString() : name.toString(), root.toString());
        for (Path entry : entries(root)) {
            if (Files.isDirectory(entry)) {
                tree.getChildren().add(scanFolderStructure(entry));
            } else if (Files.isRegularFile(entry) && isEligible(entry)) {
                tree.getChildren().add(FolderNode.file(entry.getFileName().toString(), entry.toString()));
            }
        }
        return tree;
    }

    private List<Path> entries(Path dir) {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) out.add(p);
        } catch (IOException e) {
            log.debug("skipping unreadable folder {}: {}", dir, e.getMessage());
            return out;
        }
        out.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return out;
    }
}
