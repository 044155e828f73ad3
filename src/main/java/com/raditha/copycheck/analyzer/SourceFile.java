package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.model.Document;

import java.nio.file.Path;

/**
 * A source file read from disk.
 *
 * @param path    location of the file
 * @param content full text of the file
 */
public record SourceFile(Path path, String content) {

    public String displayName() {
        return path.getFileName().toString();
    }

    public Document toDocument() {
        return Document.of(content);
    }
}
