package com.example.linkaudit;

import lombok.Value;

import java.util.List;

@Value
public class FileAnalysis {
    String path;
    boolean trackedChanges;
    List<Link> links;
}
