package com.ozmeta.compiler.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.exception.ConnectionFailedException;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.snapshot.Violation;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Assembles a snapshot from the output of the metadata extraction queries:
 * a directory with one {@code <area>.json} file per snapshot area
 * ({@code model.json}, {@code targets.json}, ...). The connection string is
 * the directory path.
 */
public class ExtractDirectorySnapshotExporter implements SnapshotExporter {

    private static final Logger log = LoggerFactory.getLogger(ExtractDirectorySnapshotExporter.class);

    public static final String PROVIDER = "extract";
    public static final String SNAPSHOT_VERSION = "1.0";
    private static final String EXTENSION = ".json";

    private final Clock clock;

    public ExtractDirectorySnapshotExporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public ObjectNode export(String connection, UUID projectId) throws IOException {
        Path directory = Paths.get(connection);
        if (!Files.isDirectory(directory)) {
            throw new ConnectionFailedException("Extract directory not found: " + directory);
        }

        List<Path> areaFiles;
        try (Stream<Path> files = Files.list(directory)) {
            areaFiles = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (areaFiles.isEmpty()) {
            throw new ConnectionFailedException("Extract directory " + directory + " contains no area files");
        }

        ObjectNode root = JsonSupport.mapper().createObjectNode();
        root.set("meta", ExportMeta.meta(SNAPSHOT_VERSION, projectId, clock, "ozmeta-export(extract)"));
        ObjectNode objects = root.putObject("objects");
        for (Path file : areaFiles) {
            String fileName = file.getFileName().toString();
            String area = fileName.substring(0, fileName.length() - EXTENSION.length());
            objects.set(area, readArea(file));
            log.debug("Read area {} from {}", area, file);
        }
        log.info("Assembled {} area(s) from {}", areaFiles.size(), directory);
        return root;
    }

    private static JsonNode readArea(Path file) throws IOException {
        try {
            return JsonSupport.mapper().readTree(Files.readAllBytes(file));
        } catch (JsonProcessingException e) {
            throw new SnapshotInvalidException(List.of(Violation.of("json.malformed", file.getFileName().toString(),
                    e.getOriginalMessage())));
        }
    }
}
