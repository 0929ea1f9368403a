package com.example.linkaudit;

import lombok.Value;

import java.nio.file.Path;

/** Per-call settings of a bulk run. backupRoot is null when no copies are kept. */
@Value
public class BulkRunConfig {
    Path baseDir;
    Path backupRoot;

    public static BulkRunConfig withoutBackup(Path baseDir) {
        return new BulkRunConfig(baseDir, null);
    }

    public boolean keepsCopies() {
        return backupRoot != null;
    }
}
