package com.ozmeta.compiler.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * JSON-Schema conformance check for snapshot documents.
 */
public class SnapshotSchemaValidator {

    public static final String BUNDLED_SCHEMA = "/schema/ozmeta.snapshot.schema.json";

    private final JsonSchema schema;

    private SnapshotSchemaValidator(JsonNode schemaNode) {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        this.schema = factory.getSchema(schemaNode);
    }

    public static SnapshotSchemaValidator bundled() {
        try (InputStream in = SnapshotSchemaValidator.class.getResourceAsStream(BUNDLED_SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException("Bundled snapshot schema not found: " + BUNDLED_SCHEMA);
            }
            return new SnapshotSchemaValidator(JsonSupport.mapper().readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled snapshot schema", e);
        }
    }

    public static SnapshotSchemaValidator fromFile(Path schemaPath) throws IOException {
        return new SnapshotSchemaValidator(JsonSupport.mapper().readTree(Files.readAllBytes(schemaPath)));
    }

    public List<Violation> validate(JsonNode document) {
        Set<ValidationMessage> messages = schema.validate(document);
        return messages.stream()
                .map(m -> Violation.of("schema." + m.getType(), "$", m.getMessage()))
                .sorted(Comparator.comparing(Violation::getMessage))
                .collect(Collectors.toList());
    }
}
