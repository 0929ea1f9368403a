package com.example.linkaudit;

import java.io.IOException;

/** Serializing or writing a mutated document failed. */
public class DocumentSaveException extends IOException {
    public DocumentSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
