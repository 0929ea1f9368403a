package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Copies a pristine original aside before it is overwritten. */
@Slf4j
@Component
public class BackupWriter {

    /**
     * @return the copy, or null when copying failed; a failed backup never blocks the caller
     */
    public Path copyOriginal(Path source, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.debug("backup {} -> {}", source, target);
            return target;
        } catch (IOException | RuntimeException e) {
            log.warn("backup of {} to {} failed: {}", source, target, e.getMessage());
            return null;
        }
    }
}
