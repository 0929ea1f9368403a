package com.example.linkaudit;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Outgoing and incoming document edges of one file. Counts are distinct files, details are per link. */
@Data
public class DependencyRecord {
    private String path;
    private String relativePath;
    private int outgoingCount;
    private int incomingCount;
    private List<OutgoingEdge> outgoingDetails = new ArrayList<>();
    private List<IncomingEdge> incomingDetails = new ArrayList<>();

    @lombok.Value
    public static class OutgoingEdge {
        String text;
        String href;
        String targetRelativePath;
    }

    @lombok.Value
    public static class IncomingEdge {
        String fromRelativePath;
        String text;
        String href;
    }
}
