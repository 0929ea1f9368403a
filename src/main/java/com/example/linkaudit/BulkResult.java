package com.example.linkaudit;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BulkResult {
    private int totalMatches;
    private List<FindReplaceResult> files = new ArrayList<>();
    /** "find" or "replace" */
    private String mode;
    /** link runs only */
    private LinkScope target;
    private String saveRoot;
}
