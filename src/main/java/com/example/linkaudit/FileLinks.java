package com.example.linkaudit;

import lombok.Value;

import java.util.List;

/** Links of one file, or the reason they could not be read. */
@Value
public class FileLinks {
    String path;
    List<Link> links;
    String error;
}
