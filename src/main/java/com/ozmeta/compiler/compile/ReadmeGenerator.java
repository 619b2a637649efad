package com.ozmeta.compiler.compile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ozmeta.compiler.emit.TemplateRenderer;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.output.ArtifactType;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.physical.PhysicalObject;

/**
 * Generates the top-level README.md describing a generate run. Only inputs
 * go into it, never the wall clock, so reruns stay byte-identical.
 */
public class ReadmeGenerator {

    private final TemplateRenderer templates;

    public ReadmeGenerator(TemplateRenderer templates) {
        this.templates = templates;
    }

    public EmittedFile generate(SnapshotDocument snapshot, List<TargetCompilationResult> results,
            Map<String, String> folders) {
        List<Map<String, Object>> targets = new ArrayList<>();
        for (TargetCompilationResult result : results) {
            Map<String, Object> target = new LinkedHashMap<>();
            target.put("key", result.key());
            target.put("platform", result.getBinding().getPlatform().getCode());
            target.put("category", result.getBinding().getPlatform().getCategory().name());
            target.put("role", result.getBinding().getTargetPlatform().getRole().name());
            target.put("folder", folders.getOrDefault(result.key(), "."));
            target.put("success", result.isSuccess());
            target.put("error", result.getErrorMessage() == null ? "" : result.getErrorMessage());
            List<Map<String, String>> objects = new ArrayList<>();
            if (result.isSuccess()) {
                for (PhysicalObject object : result.getProjection().getObjects()) {
                    Map<String, String> row = new LinkedHashMap<>();
                    row.put("code", object.getTableCode());
                    row.put("canonical", object.getCanonicalName());
                    row.put("physical", object.qualifiedName());
                    row.put("columns", String.valueOf(object.getFields().size()));
                    objects.add(row);
                }
            }
            target.put("objects", objects);
            targets.add(target);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("projectId", nullToEmpty(snapshot.getMeta().getProjectId()));
        model.put("version", nullToEmpty(snapshot.getMeta().getVersion()));
        model.put("exportedAt", nullToEmpty(snapshot.getMeta().getExportedAtUTC()));
        model.put("tableCount", snapshot.getModel().getTables().size());
        model.put("targets", targets);

        return EmittedFile.builder()
                .path("README.md")
                .contents(templates.render("README.md.ftl", model))
                .type(ArtifactType.DOCUMENTATION)
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
