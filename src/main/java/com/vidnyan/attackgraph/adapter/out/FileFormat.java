package com.vidnyan.attackgraph.adapter.out;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Serialization formats selected by file extension.
 */
public enum FileFormat {
    JSON(List.of(".json")),
    YAML(List.of(".yml", ".yaml"));

    private final List<String> extensions;

    FileFormat(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * @throws UnsupportedFileFormatException for any other extension
     */
    public static FileFormat fromPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        for (FileFormat format : values()) {
            if (format.extensions.stream().anyMatch(name::endsWith)) {
                return format;
            }
        }
        throw new UnsupportedFileFormatException(path, ".json, .yml, .yaml");
    }
}
