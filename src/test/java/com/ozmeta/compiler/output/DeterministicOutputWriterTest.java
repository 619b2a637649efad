package com.ozmeta.compiler.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.output.ArtifactType;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.util.Hashing;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for writing output directories with a manifest.
 */
class DeterministicOutputWriterTest {

    @TempDir
    Path tempDir;

    private final DeterministicOutputWriter writer = new DeterministicOutputWriter();

    private static EmittedFile file(String path, String contents) {
        return EmittedFile.builder().path(path).contents(contents).type(ArtifactType.DDL).build();
    }

    @Test
    void testWritesFilesAndSortedManifest() throws IOException {
        Path out = tempDir.resolve("out");
        Manifest manifest = writer.write(out, List.of(
                file("sql/transaction.sql", "CREATE TABLE t ();\n"),
                file("README.md", "# readme\n"),
                file("drift/rules.json", "{}\n")));

        assertThat(manifest.getAlgorithm()).isEqualTo("SHA-256");
        assertThat(manifest.getFiles().keySet())
                .containsExactly("README.md", "drift/rules.json", "sql/transaction.sql");
        assertThat(Files.readString(out.resolve("sql/transaction.sql"))).isEqualTo("CREATE TABLE t ();\n");
        assertThat(manifest.hashOf("sql/transaction.sql"))
                .isEqualTo(Hashing.sha256Hex(Files.readAllBytes(out.resolve("sql/transaction.sql"))));
        assertThat(Files.readAllBytes(out.resolve(Manifest.FILE_NAME)))
                .isEqualTo(DeterministicOutputWriter.manifestBytes(manifest));
    }

    @Test
    void testInputOrderDoesNotChangeOutput() throws IOException {
        List<EmittedFile> files = List.of(file("b.sql", "b\n"), file("a/c.sql", "c\n"), file("a.sql", "a\n"));
        List<EmittedFile> reversed = List.of(files.get(2), files.get(1), files.get(0));

        writer.write(tempDir.resolve("one"), files);
        writer.write(tempDir.resolve("two"), reversed);

        assertThat(Files.readAllBytes(tempDir.resolve("two").resolve(Manifest.FILE_NAME)))
                .isEqualTo(Files.readAllBytes(tempDir.resolve("one").resolve(Manifest.FILE_NAME)));
    }

    @Test
    void testReplacesPreviousOutput() throws IOException {
        Path out = tempDir.resolve("out");
        Files.createDirectories(out);
        Files.writeString(out.resolve("stale.sql"), "old");

        writer.write(out, List.of(file("fresh.sql", "new\n")));

        assertThat(out.resolve("stale.sql")).doesNotExist();
        assertThat(Files.readString(out.resolve("fresh.sql"))).isEqualTo("new\n");
        try (Stream<Path> siblings = Files.list(tempDir)) {
            assertThat(siblings).containsExactly(out);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"../escape.sql", "/etc/passwd", "sql//double.sql", "sql/./x.sql", "C:/x.sql",
            "sql\\x.sql", "manifest.json"})
    void testRejectsUnsafePaths(String path) throws IOException {
        Path out = tempDir.resolve("out");

        assertThatThrownBy(() -> writer.write(out, List.of(file("ok.sql", "ok\n"), file(path, "bad\n"))))
                .isInstanceOf(CompilationException.class);

        assertThat(out).doesNotExist();
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    void testRejectsDuplicatePaths() {
        Path out = tempDir.resolve("out");

        assertThatThrownBy(() -> writer.write(out, List.of(file("a.sql", "1\n"), file("a.sql", "2\n"))))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Duplicate artifact path");
        assertThat(out).doesNotExist();
    }
}
