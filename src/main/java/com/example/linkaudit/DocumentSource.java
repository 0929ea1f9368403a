package com.example.linkaudit;

import java.nio.file.Path;

/** Opens documents. Each handle belongs to the call that opened it. */
public interface DocumentSource {

    DocumentHandle open(Path file) throws DocumentOpenException;
}
