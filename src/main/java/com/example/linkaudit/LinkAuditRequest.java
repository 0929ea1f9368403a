package com.example.linkaudit;

import lombok.Data;

import java.util.List;

/** JSON body shared by the /api routes; each route reads the fields it needs. */
@Data
public class LinkAuditRequest {
    private String path;
    private String findText;
    private String replaceText;
    private String target;
    private Boolean saveCopies;
    /** export only: rows given directly instead of a folder */
    private List<List<String>> rows;

    public boolean isSaveCopiesOrDefault() {
        return saveCopies == null || saveCopies;
    }
}
