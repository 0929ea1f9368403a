package com.example.linkaudit;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Outcome of one find/replace call on one file. */
@Data
public class FindReplaceResult {
    private String path;
    private int matchesCount;
    private FindReplaceStatus status;
    private List<String> snippets = new ArrayList<>();
    private String copyPath;
    /** link engine only, first-seen order, no duplicates */
    private List<String> foundUrls;
    private List<String> foundTexts;
    private Boolean didReplace;
    private String error;

    public static FindReplaceResult noFindText(String path) {
        FindReplaceResult r = new FindReplaceResult();
        r.setPath(path);
        r.setStatus(FindReplaceStatus.NO_FIND_TEXT);
        return r;
    }

    public static FindReplaceResult failed(String path, Exception e) {
        FindReplaceResult r = new FindReplaceResult();
        r.setPath(path);
        r.setStatus(FindReplaceStatus.ERROR);
        r.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return r;
    }
}
