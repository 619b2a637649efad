package com.ozmeta.compiler.export;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.snapshot.ProfileSetLoader;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.snapshot.SnapshotLoader;
import com.ozmeta.compiler.snapshot.SnapshotValidator;
import com.ozmeta.compiler.snapshot.Violation;
import com.ozmeta.compiler.util.FileWriteUtil;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Exports a snapshot, checks that it satisfies the snapshot contract and
 * writes it. Nothing is written when the contract is violated.
 */
public class SnapshotExportService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExportService.class);

    private final SnapshotExporterRegistry registry;
    private final SnapshotLoader loader;
    private final ProfileSetLoader profiles = new ProfileSetLoader();
    private final SnapshotValidator validator = new SnapshotValidator();

    public SnapshotExportService(SnapshotExporterRegistry registry, SnapshotLoader loader) {
        this.registry = registry;
        this.loader = loader;
    }

    /**
     * @throws SnapshotInvalidException when the exported document violates the snapshot contract
     */
    public SnapshotDocument export(String provider, String connection, UUID projectId, Path out) throws IOException {
        SnapshotExporter exporter = registry.require(provider);
        log.info("Exporting project {} with provider {}", projectId, exporter.provider());
        ObjectNode document = exporter.export(connection, projectId);

        SnapshotDocument snapshot = loader.read(document);
        List<Violation> violations =
                validator.validate(new SnapshotIndex(snapshot, profiles.effectiveProfiles(snapshot, null)));
        if (!violations.isEmpty()) {
            throw new SnapshotInvalidException(violations);
        }

        FileWriteUtil.safeWrite(out, JsonSupport.toCanonicalJson(document).getBytes(StandardCharsets.UTF_8));
        log.info("Snapshot written to {}", out);
        return snapshot;
    }
}
