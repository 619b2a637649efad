package com.ozmeta.compiler.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.exception.ConnectionFailedException;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.exception.ValidationFailedException;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.snapshot.SnapshotLoader;
import com.ozmeta.compiler.snapshot.Violation;
import com.ozmeta.compiler.util.JsonSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for exporting snapshots through the bundled providers.
 */
class SnapshotExportServiceTest {

    private static final UUID PROJECT = UUID.fromString("7d1c2f4e-9a3b-4c5d-8e6f-0123456789ab");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00.750Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SnapshotExportService service;

    @BeforeEach
    void setUp() {
        service = new SnapshotExportService(SnapshotExporterRegistry.withDefaults(CLOCK), new SnapshotLoader());
    }

    @Test
    void testStubExportIsLoadable() throws IOException {
        Path out = tempDir.resolve("snapshot.json");

        SnapshotDocument exported = service.export("stub", "", PROJECT, out);
        SnapshotDocument reloaded = new SnapshotLoader().load(out);

        assertThat(exported.getModel().getTables()).hasSize(1);
        assertThat(reloaded.getMeta().getExportedAtUTC()).isEqualTo("2024-05-01T08:00:00Z");
        assertThat(reloaded.getMeta().getProjectId()).isEqualTo(PROJECT.toString());
        assertThat(reloaded.getModel().getTables().get(0).getFields()).hasSize(9);
    }

    @Test
    void testStubExportIsStable() throws IOException {
        Path first = tempDir.resolve("first.json");
        Path second = tempDir.resolve("second.json");

        service.export("STUB", "", PROJECT, first);
        service.export("stub", "", PROJECT, second);

        assertThat(Files.readAllBytes(second)).isEqualTo(Files.readAllBytes(first));
    }

    @Test
    void testExtractDirectoryAssemblesAreas() throws IOException {
        Path extract = extractDirectory(TestSnapshots.SCENARIO_A);
        Path out = tempDir.resolve("snapshot.json");

        SnapshotDocument exported = service.export("extract", extract.toString(), PROJECT, out);

        assertThat(exported.getMeta().getVersion()).isEqualTo(ExtractDirectorySnapshotExporter.SNAPSHOT_VERSION);
        assertThat(exported.getModel().getTables().get(0).getCode()).isEqualTo("TR");
        assertThat(exported.getPlatforms().getPlatforms()).hasSize(1);
        assertThat(out).exists();
    }

    @Test
    void testInvalidExtractIsNotWritten() throws IOException {
        Path extract = extractDirectory(TestSnapshots.MISSING_TENANT);
        Path out = tempDir.resolve("snapshot.json");

        assertThatThrownBy(() -> service.export("extract", extract.toString(), PROJECT, out))
                .isInstanceOf(SnapshotInvalidException.class)
                .satisfies(e -> assertThat(((SnapshotInvalidException) e).getViolations())
                        .extracting(Violation::getMessage)
                        .anyMatch(m -> m.contains("_TenantID")));
        assertThat(out).doesNotExist();
    }

    @Test
    void testMalformedAreaFile() throws IOException {
        Path extract = tempDir.resolve("extract");
        Files.createDirectories(extract);
        Files.writeString(extract.resolve("model.json"), "{ \"tables\": [");

        assertThatThrownBy(() -> service.export("extract", extract.toString(), PROJECT, tempDir.resolve("s.json")))
                .isInstanceOf(SnapshotInvalidException.class)
                .satisfies(e -> assertThat(((SnapshotInvalidException) e).getViolations())
                        .extracting(Violation::getRule)
                        .containsExactly("json.malformed"));
    }

    @Test
    void testMissingOrEmptyExtractDirectory() throws IOException {
        Path empty = tempDir.resolve("empty");
        Files.createDirectories(empty);

        assertThatThrownBy(() -> service.export("extract", tempDir.resolve("none").toString(), PROJECT,
                tempDir.resolve("s.json")))
                .isInstanceOf(ConnectionFailedException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> service.export("extract", empty.toString(), PROJECT, tempDir.resolve("s.json")))
                .isInstanceOf(ConnectionFailedException.class)
                .hasMessageContaining("no area files");
    }

    @Test
    void testUnknownProvider() {
        assertThatThrownBy(() -> service.export("metadb", "", PROJECT, tempDir.resolve("s.json")))
                .isInstanceOf(ValidationFailedException.class)
                .hasMessage("Unknown export provider 'metadb'; available: extract, stub");
    }

    private Path extractDirectory(String fixture) throws IOException {
        JsonNode objects = JsonSupport.mapper().readTree(TestSnapshots.path(fixture).toFile()).get("objects");
        Path extract = tempDir.resolve("extract");
        Files.createDirectories(extract);
        Files.writeString(extract.resolve("model.json"), objects.get("model").toString());
        Files.writeString(extract.resolve("platforms.json"), objects.get("platforms").toString());
        Files.writeString(extract.resolve("notes.txt"), "ignored");
        return extract;
    }
}
