package com.ozmeta.compiler.export;

import java.time.Clock;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.snapshot.InternalFields;
import com.ozmeta.compiler.util.Hashing;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Offline provider returning a small but complete snapshot with one
 * tenant-scoped {@code Transaction} table. Ids derive from the project id, so
 * two exports of the same project differ only in their timestamp.
 */
public class StubSnapshotExporter implements SnapshotExporter {

    public static final String PROVIDER = "stub";

    private static final String[][] LOGICAL_TYPES = {
            { "Uuid", "Globally unique identifier" },
            { "String", "Bounded text" },
            { "Money", "Currency amount" },
            { "DateTime", "UTC timestamp" }
    };

    private final Clock clock;

    public StubSnapshotExporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public ObjectNode export(String connection, UUID projectId) {
        ObjectNode root = JsonSupport.mapper().createObjectNode();
        root.set("meta", ExportMeta.meta("0.1", projectId, clock, "ozmeta-export(stub)"));

        ObjectNode model = root.putObject("objects").putObject("model");
        ArrayNode logicalTypes = model.putArray("logicalTypes");
        for (String[] type : LOGICAL_TYPES) {
            logicalTypes.addObject().put("code", type[0]).put("description", type[1]);
        }

        UUID tableId = Hashing.derivedId(projectId, "table", "TR");
        ObjectNode table = model.putArray("tables").addObject();
        table.put("id", tableId.toString());
        table.put("code", "TR");
        table.put("name", "Transaction");
        table.put("schema", "dp");
        table.put("requiresTenant", true);

        ArrayNode fields = table.putArray("fields");
        int ordinal = 0;
        addField(fields, projectId, "TR_ID", "Uuid", ordinal++, false).put("primaryKey", true);
        addField(fields, projectId, "TR_Amount", "Money", ordinal++, false);
        addField(fields, projectId, "TR_Currency", "String", ordinal++, false);
        addField(fields, projectId, InternalFields.TENANT_ID, "Uuid", ordinal++, false).put("internal", true);
        addField(fields, projectId, InternalFields.CREATE_DATE, "DateTime", ordinal++, false).put("internal", true);
        addField(fields, projectId, InternalFields.SOURCE_SYSTEM, "String", ordinal++, true).put("internal", true);
        addField(fields, projectId, InternalFields.SOURCE_KEY, "String", ordinal++, true).put("internal", true);
        addField(fields, projectId, InternalFields.SYNC_DATE, "DateTime", ordinal++, true).put("internal", true);
        addField(fields, projectId, InternalFields.DELETE_DATE, "DateTime", ordinal, true).put("internal", true);

        model.putArray("codeRegistry").addObject()
                .put("code", "TR")
                .put("tableId", tableId.toString())
                .put("retired", false);
        return root;
    }

    private static ObjectNode addField(ArrayNode fields, UUID projectId, String name, String logicalType, int ordinal,
            boolean nullable) {
        return fields.addObject()
                .put("id", Hashing.derivedId(projectId, "field", "TR", name).toString())
                .put("name", name)
                .put("logicalType", logicalType)
                .put("ordinal", ordinal)
                .put("nullable", nullable);
    }
}
