package com.example.linkaudit;

import lombok.Value;

/** Graph node identity: one per distinct absolute path of the scan. */
@Value
public class FileRecord {
    int id;
    String absolutePath;
    /** relative to the scan root, '/' separated */
    String relativePath;
    /** file name without extension, lower case */
    String baseName;
}
