package com.ozmeta.compiler.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.compile.TargetBinder;
import com.ozmeta.compiler.model.canonical.PlatformArea;
import com.ozmeta.compiler.model.canonical.SecurityArea;
import com.ozmeta.compiler.model.canonical.SecurityMode;
import com.ozmeta.compiler.model.canonical.SecurityPolicyDefinition;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.TableSecurityDefinition;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.naming.CodeRegistry;
import com.ozmeta.compiler.projection.ProjectionResolver;
import com.ozmeta.compiler.snapshot.ProfileSetLoader;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.snapshot.SnapshotLoader;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Projects the snapshot fixtures onto a platform of the bundled profile set.
 */
final class EmitterFixtures {

    static final UUID TENANT_POLICY_ID = UUID.fromString("00000000-0000-4000-8000-000000000801");
    static final UUID CURRENCY_POLICY_ID = UUID.fromString("00000000-0000-4000-8000-000000000802");

    private EmitterFixtures() {
    }

    static TargetProjection project(String platformCode) throws IOException {
        SnapshotDocument loaded = new SnapshotLoader().load(TestSnapshots.path(TestSnapshots.SCENARIO_A));
        SnapshotDocument snapshot = loaded.toBuilder().platforms(PlatformArea.builder().build()).build();
        SnapshotIndex index = new SnapshotIndex(snapshot, new ProfileSetLoader().loadDefaults());
        TargetPlatformBinding binding = new TargetBinder(platformCode).bind(index, new ToolDiagnostics()).get(0);
        return new ProjectionResolver(index, CodeRegistry.fromSnapshot(snapshot))
                .project(binding, new ToolDiagnostics());
    }

    /**
     * Scenario A with two row policies on Transaction: a currency filter and
     * tenant isolation applied to reads and writes.
     */
    static TargetProjection projectSecured(String platformCode) throws IOException {
        return projectWithSecurity(platformCode, SecurityArea.builder()
                .policies(List.of(
                        policy(TENANT_POLICY_ID, "tenant_isolation", TextNode.valueOf("tenant")),
                        policy(CURRENCY_POLICY_ID, "currency_eur", JsonSupport.mapper().readTree(
                                "{\"op\": \"eq\", \"args\": [{\"ref\": \"TR_Currency\"}, {\"lit\": \"EUR\"}]}"))))
                .tableSecurity(List.of(
                        applied(TENANT_POLICY_ID, SecurityMode.BOTH),
                        applied(CURRENCY_POLICY_ID, SecurityMode.FILTER)))
                .build());
    }

    static TargetProjection projectWithSecurity(String platformCode, SecurityArea security) throws IOException {
        SnapshotDocument loaded = new SnapshotLoader().load(TestSnapshots.path(TestSnapshots.SCENARIO_A));
        SnapshotDocument snapshot = loaded.toBuilder()
                .platforms(PlatformArea.builder().build())
                .security(security)
                .build();
        SnapshotIndex index = new SnapshotIndex(snapshot, new ProfileSetLoader().loadDefaults());
        TargetPlatformBinding binding = new TargetBinder(platformCode).bind(index, new ToolDiagnostics()).get(0);
        return new ProjectionResolver(index, CodeRegistry.fromSnapshot(snapshot))
                .project(binding, new ToolDiagnostics());
    }

    static SecurityPolicyDefinition policy(UUID id, String code, JsonNode expression) {
        return SecurityPolicyDefinition.builder().id(id).code(code).expression(expression).build();
    }

    static TableSecurityDefinition applied(UUID policyId, SecurityMode mode) {
        return TableSecurityDefinition.builder()
                .id(UUID.nameUUIDFromBytes(policyId.toString().getBytes(StandardCharsets.UTF_8)))
                .tableId(TestSnapshots.TRANSACTION_ID)
                .policyId(policyId)
                .mode(mode)
                .build();
    }

    static TargetProjection projectMultiTarget(UUID targetPlatformId) throws IOException {
        SnapshotDocument snapshot = new SnapshotLoader().load(TestSnapshots.path(TestSnapshots.MULTI_TARGET));
        SnapshotIndex index = new SnapshotIndex(snapshot);
        TargetPlatformBinding binding = new TargetBinder("Postgres").bind(index, new ToolDiagnostics()).stream()
                .filter(b -> TargetBinder.sameTargetPlatform(b, targetPlatformId))
                .findFirst()
                .orElseThrow();
        return new ProjectionResolver(index, CodeRegistry.fromSnapshot(snapshot))
                .project(binding, new ToolDiagnostics());
    }

    static String contents(EmitResult result, String path) {
        return result.getFiles().stream()
                .filter(f -> f.getPath().equals(path))
                .map(EmittedFile::getContents)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No file " + path));
    }
}
