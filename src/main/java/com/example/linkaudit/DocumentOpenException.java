package com.example.linkaudit;

import java.io.IOException;

/** The file is unreadable or is not a valid Word container. */
public class DocumentOpenException extends IOException {
    public DocumentOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
