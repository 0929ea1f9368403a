package com.example.linkaudit;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Folder tree entry; files carry no children list. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FolderNode {
    private String name;
    private String type;
    private String path;
    private List<FolderNode> children;

    static FolderNode folder(String name, String path) {
        return new FolderNode(name, "folder", path, new ArrayList<>());
    }

    static FolderNode file(String name, String path) {
        return new FolderNode(name, "file", path, null);
    }
}
