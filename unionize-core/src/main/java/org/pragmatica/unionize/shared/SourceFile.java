package org.pragmatica.unionize.shared;

import java.nio.file.Path;

/// Python source file content paired with the path it was read from.
public record SourceFile(Path path, String content) {
    public static SourceFile sourceFile(Path path, String content) {
        return new SourceFile(path, content);
    }

    public String fileName() {
        return path.toString();
    }

    public SourceFile withContent(String newContent) {
        return new SourceFile(path, newContent);
    }
}
