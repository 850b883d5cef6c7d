package com.example.bulkfile.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One fully resolved unit of planned work: where the file goes, how large it is and which
 * department tag drives its ownership.
 */
public record WorkItem(
        String targetPath,
        long sizeKb,
        String tag,
        ItemKind kind
) {
    public WorkItem {
        Objects.requireNonNull(targetPath, "targetPath");
        if (targetPath.isBlank()) {
            throw new IllegalArgumentException("targetPath must not be blank");
        }
        if (sizeKb < 0) {
            throw new IllegalArgumentException("sizeKb must not be negative: " + sizeKb);
        }
        tag = tag == null ? "" : tag;
        kind = kind == null ? ItemKind.FILE : kind;
    }

    public static WorkItem file(String targetPath, long sizeKb, String tag) {
        return new WorkItem(targetPath, sizeKb, tag, ItemKind.FILE);
    }

    public Path path() {
        return Path.of(targetPath);
    }
}
