package com.ozmeta.compiler.export;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.util.JsonSupport;

final class ExportMeta {

    private static final DateTimeFormatter UTC_SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private ExportMeta() {
        // Utility class
    }

    static ObjectNode meta(String version, UUID projectId, Clock clock, String exporter) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        ObjectNode meta = JsonSupport.mapper().createObjectNode();
        meta.put("version", version);
        meta.put("projectId", projectId.toString());
        meta.put("exportedAtUTC", UTC_SECONDS.format(now));
        meta.put("exporter", exporter);
        return meta;
    }
}
