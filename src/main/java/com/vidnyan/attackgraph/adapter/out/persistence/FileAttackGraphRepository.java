package com.vidnyan.attackgraph.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.attackgraph.adapter.out.FileFormat;
import com.vidnyan.attackgraph.application.port.out.AttackGraphRepository;
import com.vidnyan.attackgraph.domain.graph.AttackGraph;
import com.vidnyan.attackgraph.domain.model.InstanceModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stores attack graphs as JSON or YAML files, chosen by extension.
 */
@Slf4j
@Component
public class FileAttackGraphRepository implements AttackGraphRepository {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final AttackGraphDocumentMapper documentMapper = new AttackGraphDocumentMapper();

    public FileAttackGraphRepository(ObjectMapper jsonMapper, @Qualifier("yamlObjectMapper") ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    @Override
    public void save(AttackGraph graph, Path path) {
        ObjectMapper mapper = mapperFor(path);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), documentMapper.toDocument(graph));
            log.info("Saved attack graph with {} nodes to {}", graph.getNodes().size(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save attack graph to " + path, e);
        }
    }

    @Override
    public AttackGraph load(Path path, InstanceModel model) {
        ObjectMapper mapper = mapperFor(path);
        try {
            AttackGraphDocument document = mapper.readValue(path.toFile(), AttackGraphDocument.class);
            log.info("Loading attack graph from {}{}", path, model == null ? " without a model" : "");
            return documentMapper.fromDocument(document, model);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load attack graph from " + path, e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        return switch (FileFormat.fromPath(path)) {
            case JSON -> jsonMapper;
            case YAML -> yamlMapper;
        };
    }
}
