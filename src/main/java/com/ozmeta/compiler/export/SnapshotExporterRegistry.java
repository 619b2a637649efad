package com.ozmeta.compiler.export;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import com.ozmeta.compiler.exception.ValidationFailedException;

public class SnapshotExporterRegistry {

    private final Map<String, SnapshotExporter> exporters = new TreeMap<>();

    public static SnapshotExporterRegistry withDefaults(Clock clock) {
        SnapshotExporterRegistry registry = new SnapshotExporterRegistry();
        registry.register(new StubSnapshotExporter(clock));
        registry.register(new ExtractDirectorySnapshotExporter(clock));
        return registry;
    }

    public void register(SnapshotExporter exporter) {
        exporters.put(exporter.provider().toLowerCase(Locale.ROOT), exporter);
    }

    public Optional<SnapshotExporter> find(String provider) {
        return Optional.ofNullable(exporters.get(provider.toLowerCase(Locale.ROOT)));
    }

    public SnapshotExporter require(String provider) {
        return find(provider).orElseThrow(() -> new ValidationFailedException(
                "Unknown export provider '" + provider + "'; available: " + String.join(", ", providers())));
    }

    public Set<String> providers() {
        return exporters.keySet();
    }
}
