package com.vidnyan.attackgraph.adapter.out;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The file extension does not name a supported format. The format is never
 * guessed from the content.
 */
@Getter
public class UnsupportedFileFormatException extends RuntimeException {

    private final Path path;

    public UnsupportedFileFormatException(Path path, String supported) {
        super("Unsupported file format for " + path + ", expected one of: " + supported);
        this.path = path;
    }
}
