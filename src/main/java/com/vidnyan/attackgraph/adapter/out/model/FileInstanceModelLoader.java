package com.vidnyan.attackgraph.adapter.out.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.attackgraph.adapter.out.FileFormat;
import com.vidnyan.attackgraph.application.port.out.InstanceModelLoader;
import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.AttackerDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads instance models from JSON or YAML files.
 *
 * <pre>
 * metadata: {name: ...}
 * assets: {id: {name, type, defenses: {defenseName: value}}}
 * associations: [{association, left: {field, assets: [id]}, right: {field, assets: [id]}}]
 * attackers: {id: {name, entry_points: {assetName: {attack_steps: [...]}}}}
 * </pre>
 */
@Slf4j
@Component
public class FileInstanceModelLoader implements InstanceModelLoader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public FileInstanceModelLoader(ObjectMapper jsonMapper, @Qualifier("yamlObjectMapper") ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    @Override
    public InMemoryInstanceModel load(Path path, LanguageSpecification language) {
        ObjectMapper mapper = FileFormat.fromPath(path) == FileFormat.YAML ? yamlMapper : jsonMapper;
        log.info("Loading instance model from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(mapper.readTree(in), mapper, language);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read instance model " + path, e);
        }
    }

    InMemoryInstanceModel read(JsonNode root, ObjectMapper mapper, LanguageSpecification language) {
        InMemoryInstanceModel.Builder builder =
                InMemoryInstanceModel.builder(root.path("metadata").path("name").asText("Unnamed model"));
        Map<Long, Asset> assetsById = new HashMap<>();

        Iterator<Map.Entry<String, JsonNode>> assets = root.path("assets").fields();
        while (assets.hasNext()) {
            Map.Entry<String, JsonNode> entry = assets.next();
            long id = Long.parseLong(entry.getKey());
            JsonNode node = entry.getValue();
            String type = node.path("type").asText();
            if (language != null && !language.hasAssetType(type)) {
                throw new LanguageSpecificationException(
                        "Asset " + node.path("name").asText() + " has type " + type + " unknown to language " + language.id());
            }
            Map<String, Object> defenses = node.hasNonNull("defenses")
                    ? mapper.convertValue(node.get("defenses"), MAP_TYPE)
                    : Map.of();
            Asset asset = new Asset(id, node.path("name").asText(), type, defenses);
            builder.addAsset(asset);
            assetsById.put(id, asset);
        }

        for (JsonNode association : root.path("associations")) {
            JsonNode left = association.path("left");
            JsonNode right = association.path("right");
            builder.addAssociation(
                    association.path("association").asText(),
                    left.path("field").asText(), resolve(left.path("assets"), assetsById),
                    right.path("field").asText(), resolve(right.path("assets"), assetsById));
        }

        Map<String, Asset> assetsByName = new HashMap<>();
        assetsById.values().forEach(a -> assetsByName.put(a.name(), a));

        Iterator<Map.Entry<String, JsonNode>> attackers = root.path("attackers").fields();
        while (attackers.hasNext()) {
            Map.Entry<String, JsonNode> entry = attackers.next();
            builder.addAttacker(readAttacker(Long.parseLong(entry.getKey()), entry.getValue(), assetsByName));
        }
        return builder.build();
    }

    private AttackerDefinition readAttacker(long id, JsonNode node, Map<String, Asset> assetsByName) {
        String name = node.path("name").asText("Attacker:" + id);
        List<AttackerDefinition.EntryPoint> entryPoints = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = node.path("entry_points").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Asset asset = assetsByName.get(entry.getKey());
            if (asset == null) {
                log.warn("Attacker '{}' has an entry point on unknown asset {}", name, entry.getKey());
                continue;
            }
            List<String> steps = new ArrayList<>();
            entry.getValue().path("attack_steps").forEach(step -> steps.add(step.asText()));
            entryPoints.add(new AttackerDefinition.EntryPoint(asset, steps));
        }
        return new AttackerDefinition(id, name, entryPoints);
    }

    private static List<Asset> resolve(JsonNode ids, Map<Long, Asset> assetsById) {
        List<Asset> assets = new ArrayList<>();
        for (JsonNode id : ids) {
            Asset asset = assetsById.get(id.asLong());
            if (asset == null) {
                throw new IllegalArgumentException("Association refers to unknown asset id " + id.asText());
            }
            assets.add(asset);
        }
        return assets;
    }
}
