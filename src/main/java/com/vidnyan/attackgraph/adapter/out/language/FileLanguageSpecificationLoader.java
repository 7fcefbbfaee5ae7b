package com.vidnyan.attackgraph.adapter.out.language;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.attackgraph.adapter.out.UnsupportedFileFormatException;
import com.vidnyan.attackgraph.application.port.out.LanguageSpecificationLoader;
import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Loads compiled language specifications from a {@code langspec.json} file
 * or from a {@code .mar} archive containing one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileLanguageSpecificationLoader implements LanguageSpecificationLoader {

    static final String ARCHIVE_ENTRY = "langspec.json";

    private final ObjectMapper objectMapper;

    @Override
    public LanguageSpecification load(Path path) {
        String name = String.valueOf(path.getFileName()).toLowerCase(Locale.ROOT);
        log.info("Loading language specification from {}", path);
        try {
            JsonNode root;
            if (name.endsWith(".json")) {
                try (InputStream in = Files.newInputStream(path)) {
                    root = objectMapper.readTree(in);
                }
            } else if (name.endsWith(".mar")) {
                root = readArchive(path);
            } else {
                throw new UnsupportedFileFormatException(path, ".json, .mar");
            }
            return new JsonLanguageSpecification(root, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read language specification " + path, e);
        }
    }

    private JsonNode readArchive(Path path) throws IOException {
        try (ZipFile archive = new ZipFile(path.toFile())) {
            ZipEntry entry = archive.getEntry(ARCHIVE_ENTRY);
            if (entry == null) {
                throw new LanguageSpecificationException("Archive " + path + " has no " + ARCHIVE_ENTRY);
            }
            try (InputStream in = archive.getInputStream(entry)) {
                return objectMapper.readTree(in);
            }
        }
    }
}
