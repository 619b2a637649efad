package com.ozmeta.compiler.snapshot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.model.canonical.IntegrationArea;
import com.ozmeta.compiler.model.canonical.JobArea;
import com.ozmeta.compiler.model.canonical.MetricArea;
import com.ozmeta.compiler.model.canonical.ModelArea;
import com.ozmeta.compiler.model.canonical.PlatformArea;
import com.ozmeta.compiler.model.canonical.SecurityArea;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.SnapshotMeta;
import com.ozmeta.compiler.model.canonical.TargetArea;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Reads a snapshot file, checks it against the JSON schema and maps it onto the
 * canonical model. Semantic checks run separately through
 * {@link SnapshotValidator} so callers can supply the effective profile set.
 */
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final Set<String> MAPPED_AREAS =
            Set.of("model", "platforms", "targets", "integrations", "jobs", "metrics", "security");

    private final SnapshotSchemaValidator schemaValidator;
    private final ObjectMapper mapper = JsonSupport.mapper();

    public SnapshotLoader() {
        this(SnapshotSchemaValidator.bundled());
    }

    public SnapshotLoader(SnapshotSchemaValidator schemaValidator) {
        this.schemaValidator = schemaValidator;
    }

    /**
     * @throws IOException when the file cannot be read
     * @throws SnapshotInvalidException when the content is malformed or does not conform
     */
    public SnapshotDocument load(Path snapshotPath) throws IOException {
        log.debug("Reading snapshot {}", snapshotPath);
        byte[] content = Files.readAllBytes(snapshotPath);
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SnapshotInvalidException(List.of(Violation.of("json.malformed", snapshotPath.toString(),
                    e.getOriginalMessage())));
        }
        return read(root);
    }

    public SnapshotDocument read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SnapshotInvalidException(List.of(Violation.of("json.malformed", "$",
                    "Snapshot document must be a JSON object")));
        }
        List<Violation> schemaViolations = schemaValidator.validate(root);
        if (!schemaViolations.isEmpty()) {
            throw new SnapshotInvalidException(schemaViolations);
        }

        List<Violation> mappingViolations = new ArrayList<>();
        JsonNode objects = root.path("objects");
        SnapshotMeta meta = map(root.get("meta"), SnapshotMeta.class, "meta", mappingViolations);
        if (meta == null) {
            throw new SnapshotInvalidException(mappingViolations);
        }

        SnapshotDocument.SnapshotDocumentBuilder builder = SnapshotDocument.builder().meta(meta);
        if (objects.has("model")) {
            builder.model(map(objects.get("model"), ModelArea.class, "objects.model", mappingViolations));
        }
        if (objects.has("platforms")) {
            builder.platforms(map(objects.get("platforms"), PlatformArea.class, "objects.platforms", mappingViolations));
        }
        if (objects.has("targets")) {
            builder.targets(map(objects.get("targets"), TargetArea.class, "objects.targets", mappingViolations));
        }
        if (objects.has("integrations")) {
            builder.integrations(map(objects.get("integrations"), IntegrationArea.class, "objects.integrations",
                    mappingViolations));
        }
        if (objects.has("jobs")) {
            builder.jobs(map(objects.get("jobs"), JobArea.class, "objects.jobs", mappingViolations));
        }
        if (objects.has("metrics")) {
            builder.metrics(map(objects.get("metrics"), MetricArea.class, "objects.metrics", mappingViolations));
        }
        if (objects.has("security")) {
            builder.security(map(objects.get("security"), SecurityArea.class, "objects.security", mappingViolations));
        }

        Map<String, JsonNode> other = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> areas = objects.fields();
        while (areas.hasNext()) {
            Map.Entry<String, JsonNode> area = areas.next();
            if (!MAPPED_AREAS.contains(area.getKey())) {
                other.put(area.getKey(), area.getValue());
            }
        }
        builder.otherAreas(other);

        if (!mappingViolations.isEmpty()) {
            throw new SnapshotInvalidException(mappingViolations);
        }
        return builder.build();
    }

    private <T> T map(JsonNode node, Class<T> type, String path, List<Violation> violations) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            violations.add(Violation.of("json.mapping", path, e.getMessage()));
            return null;
        }
    }
}
