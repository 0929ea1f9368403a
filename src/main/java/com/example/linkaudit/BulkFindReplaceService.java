package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the text and link engines over a set of files. Failures stay with the file they happened on;
 * copies of originals go to a backup root that mirrors each file's path under the scan root.
 */
@Slf4j
@Service
public class BulkFindReplaceService {

    private final TextFindReplaceService textEngine;
    private final LinkFindReplaceService linkEngine;
    private final DocxFileScanner scanner;
    private final String backupFolderName;
    private final Path userHome;

    public BulkFindReplaceService(TextFindReplaceService textEngine,
                                  LinkFindReplaceService linkEngine,
                                  DocxFileScanner scanner,
                                  @Value("${linkaudit.backup.folder-name:bulk_found}") String backupFolderName,
                                  @Value("${linkaudit.backup.user-home:${user.home}}") String userHome) {
        this.textEngine = textEngine;
        this.linkEngine = linkEngine;
        this.scanner = scanner;
        this.backupFolderName = backupFolderName;
        this.userHome = Paths.get(userHome);
    }

    /** Desktop/&lt;folder&gt; when the user has a Desktop folder, otherwise &lt;scan root&gt;/&lt;folder&gt;. */
    public Path resolveBackupRoot(Path scanRoot) {
        Path desktop = userHome.resolve("Desktop");
        if (Files.isDirectory(desktop)) return desktop.resolve(backupFolderName);
        return scanRoot.resolve(backupFolderName);
    }

    public BulkRunConfig configFor(Path scanRoot, boolean saveCopies) {
        return saveCopies ? new BulkRunConfig(scanRoot, resolveBackupRoot(scanRoot)) : BulkRunConfig.withoutBackup(scanRoot);
    }

    /** Whole-tree body text run: scan, resolve the backup root, drop earlier copies, process. */
    public BulkResult findReplaceTextUnder(Path scanRoot, String findText, String replaceText, boolean saveCopies) {
        BulkRunConfig config = configFor(scanRoot, saveCopies);
        List<Path> files = excludeBackupTree(scanner.listDocxFiles(scanRoot), config);
        BulkResult result = findReplaceText(files, findText, replaceText, config);
        if (config.keepsCopies()) result.setSaveRoot(config.getBackupRoot().toString());
        return result;
    }

    /** Whole-tree hyperlink run, same policy as {@link #findReplaceTextUnder}. */
    public BulkResult findReplaceLinksUnder(Path scanRoot, String findText, String replaceText, LinkScope scope,
                                            boolean saveCopies) {
        BulkRunConfig config = configFor(scanRoot, saveCopies);
        List<Path> files = excludeBackupTree(scanner.listDocxFiles(scanRoot), config);
        BulkResult result = findReplaceLinks(files, findText, replaceText, scope, config);
        if (config.keepsCopies()) result.setSaveRoot(config.getBackupRoot().toString());
        return result;
    }

    /**
     * Body text find/replace over files. Every file with a match gets a backup when the config keeps
     * copies, find-only runs included.
     */
    public BulkResult findReplaceText(List<Path> files, String findText, String replaceText, BulkRunConfig config) {
        requireFindText(findText);
        long t0 = System.currentTimeMillis();
        BulkResult result = newResult(replaceText);

        for (Path file : files) {
            if (isUnderBackupRoot(file, config)) continue;
            FindReplaceResult r;
            try {
                r = textEngine.findReplace(file, findText, replaceText, backupPathFor(file, config));
            } catch (Exception e) {
                log.warn("text find/replace failed for {}: {}", file, e.getMessage());
                r = FindReplaceResult.failed(file.toString(), e);
            }
            add(result, r);
        }
        log.info("bulk text {}: {} file(s), {} match(es) in {} ms",
                result.getMode(), result.getFiles().size(), result.getTotalMatches(), System.currentTimeMillis() - t0);
        return result;
    }

    /**
     * Hyperlink find/replace over files. Each file is first scanned without a backup path; only a
     * replace run with matches goes through the mutating pass that writes the backup.
     */
    public BulkResult findReplaceLinks(List<Path> files, String findText, String replaceText, LinkScope scope,
                                       BulkRunConfig config) {
        requireFindText(findText);
        LinkScope target = scope == null ? LinkScope.BOTH : scope;
        long t0 = System.currentTimeMillis();
        BulkResult result = newResult(replaceText);
        result.setTarget(target);

        for (Path file : files) {
            if (isUnderBackupRoot(file, config)) continue;
            FindReplaceResult r;
            try {
                FindReplaceResult detect = linkEngine.findReplace(file, findText, null, target, null);
                if (detect.getMatchesCount() > 0 && replaceText != null) {
                    r = linkEngine.findReplace(file, findText, replaceText, target, backupPathFor(file, config));
                } else {
                    r = detect;
                }
            } catch (Exception e) {
                log.warn("link find/replace failed for {}: {}", file, e.getMessage());
                r = FindReplaceResult.failed(file.toString(), e);
            }
            add(result, r);
        }
        log.info("bulk link {} ({}): {} file(s), {} match(es) in {} ms", result.getMode(), target.label(),
                result.getFiles().size(), result.getTotalMatches(), System.currentTimeMillis() - t0);
        return result;
    }

    /** Drops files inside the backup root when that root lives under the scan root. */
    public List<Path> excludeBackupTree(List<Path> files, BulkRunConfig config) {
        if (!config.keepsCopies()) return files;
        Path backup = absolute(config.getBackupRoot());
        if (!backup.startsWith(absolute(config.getBaseDir()))) return files;
        List<Path> out = new ArrayList<>(files.size());
        for (Path f : files) {
            if (!absolute(f).startsWith(backup)) out.add(f);
        }
        return out;
    }

    /** backupRoot joined with the file's path under baseDir, or with its name when it is outside baseDir. */
    Path backupPathFor(Path file, BulkRunConfig config) {
        if (!config.keepsCopies()) return null;
        Path abs = absolute(file);
        Path rel = null;
        if (config.getBaseDir() != null) {
            Path base = absolute(config.getBaseDir());
            if (abs.startsWith(base)) rel = base.relativize(abs);
        }
        if (rel == null || rel.toString().isEmpty()) rel = abs.getFileName();
        return config.getBackupRoot().resolve(rel.toString());
    }

    private static boolean isUnderBackupRoot(Path file, BulkRunConfig config) {
        return config.keepsCopies() && absolute(file).startsWith(absolute(config.getBackupRoot()));
    }

    private static Path absolute(Path p) {
        return p.toAbsolutePath().normalize();
    }

    private static void requireFindText(String findText) {
        if (findText == null || findText.isEmpty()) throw new IllegalArgumentException("No find_text provided");
    }

    private static BulkResult newResult(String replaceText) {
        BulkResult result = new BulkResult();
        result.setMode(replaceText != null ? "replace" : "find");
        return result;
    }

    private static void add(BulkResult result, FindReplaceResult r) {
        result.setTotalMatches(result.getTotalMatches() + r.getMatchesCount());
        result.getFiles().add(r);
    }
}
