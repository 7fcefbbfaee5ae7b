package com.vidnyan.attackgraph.adapter.out.model;

import com.vidnyan.attackgraph.TestFixtures;
import com.vidnyan.attackgraph.adapter.out.UnsupportedFileFormatException;
import com.vidnyan.attackgraph.domain.language.LanguageSpecification;
import com.vidnyan.attackgraph.domain.language.LanguageSpecificationException;
import com.vidnyan.attackgraph.domain.model.Asset;
import com.vidnyan.attackgraph.domain.model.AttackerDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileInstanceModelLoaderTest {

    @TempDir
    Path tempDir;

    private final LanguageSpecification language = TestFixtures.language();

    @Test
    void load_ShouldReadYamlModel() {
        InMemoryInstanceModel model = TestFixtures.model(language);

        assertEquals("Test model", model.name());
        assertEquals(7, model.assets().size());
        assertEquals(4, model.associations().size());
        Asset admin = model.getAssetById(5).orElseThrow();
        assertEquals("Admin Password", admin.name());
        assertEquals("Credentials", admin.type());
        assertEquals(true, model.getProperty(model.getAssetByName("Web Server").orElseThrow(), "notPresent").orElseThrow());
        assertTrue(model.getProperty(admin, "notPresent").isEmpty());
    }

    @Test
    void load_ShouldSkipEntryPointsOnUnknownAssets() {
        InMemoryInstanceModel model = TestFixtures.model(language);

        AttackerDefinition attacker = model.attackers().get(0);

        assertEquals(0L, attacker.id());
        assertEquals("Remote Attacker", attacker.name());
        assertEquals(1, attacker.entryPoints().size());
        assertEquals(List.of("Internet:access"), attacker.entryPoints().get(0).fullNames());
    }

    @Test
    void associatedAssets_ShouldDependOnFieldSide() {
        InMemoryInstanceModel model = TestFixtures.model(language);
        Asset webServer = model.getAssetByName("Web Server").orElseThrow();
        Asset backend = model.getAssetByName("Backend").orElseThrow();

        assertEquals(List.of(backend), model.getAssociatedAssetsByFieldName(webServer, "appExecutedApps"));
        assertEquals(List.of(webServer), model.getAssociatedAssetsByFieldName(backend, "hostApp"));
        assertTrue(model.getAssociatedAssetsByFieldName(webServer, "hostApp").isEmpty());
    }

    @Test
    void load_ShouldReadJsonModel() throws IOException {
        Path file = tempDir.resolve("model.json");
        Files.writeString(file, """
                {
                  "metadata": {"name": "json model"},
                  "assets": {
                    "10": {"name": "Lan", "type": "Network"},
                    "11": {"name": "App", "type": "Application", "defenses": {"notPresent": 0.75}}
                  },
                  "associations": [
                    {"association": "NetworkExposure",
                     "left": {"field": "networks", "assets": [10]},
                     "right": {"field": "applications", "assets": [11]}}
                  ],
                  "attackers": {}
                }
                """);

        InMemoryInstanceModel model = TestFixtures.modelLoader().load(file, language);

        Asset lan = model.getAssetById(10).orElseThrow();
        assertEquals("json model", model.name());
        assertEquals(List.of("App"), model.getAssociatedAssetsByFieldName(lan, "applications").stream()
                .map(Asset::name).toList());
        assertEquals(0.75, model.getProperty(model.getAssetById(11).orElseThrow(), "notPresent").orElseThrow());
        assertTrue(model.attackers().isEmpty());
    }

    @Test
    void load_ShouldRejectAssetTypeUnknownToLanguage() throws IOException {
        Path file = tempDir.resolve("model.yaml");
        Files.writeString(file, "assets:\n  0:\n    name: Printer\n    type: Printer\n");

        assertThrows(LanguageSpecificationException.class, () -> TestFixtures.modelLoader().load(file, language));
    }

    @Test
    void load_ShouldRejectUnknownExtension() {
        assertThrows(UnsupportedFileFormatException.class,
                () -> TestFixtures.modelLoader().load(tempDir.resolve("model.xml"), language));
    }
}
