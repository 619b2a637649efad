package com.ozmeta.compiler.compile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.emit.EmitterRegistry;
import com.ozmeta.compiler.exception.ErrorKind;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.snapshot.Violation;
import com.ozmeta.compiler.util.JsonSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for generate runs over the snapshot fixtures.
 */
class CompilationPipelineTest {

    private static final String PG_FOLDER = "targets/SFO-Dev-Fabric-All-USW.Postgres/";
    private static final String BQ_FOLDER = "targets/SFO-Dev-Fabric-All-USW.BigQuery/";
    private static final String DBX_FOLDER = "targets/SFO-Dev-Fabric-All-USW.Databricks/";

    @TempDir
    Path tempDir;

    private CompilationResult generate(String fixture, Path out) {
        return new CompilationPipeline(TestSnapshots.config(fixture, out), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());
    }

    @Test
    void testSingleTableSnapshot() throws IOException {
        Path out = tempDir.resolve("out");
        CompilationResult result = generate(TestSnapshots.SCENARIO_A, out);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrorKind()).isNull();
        assertThat(result.getObjectsProjected()).isEqualTo(1);
        assertThat(result.getManifest().getFiles().keySet())
                .containsExactly("README.md", "drift/rules.json", "sql/00-schemas.sql", "sql/transaction.sql");
        assertThat(result.getFilesWritten()).isEqualTo(5);

        assertThat(out.resolve(Manifest.FILE_NAME)).exists();
        assertThat(Files.readString(out.resolve("sql/transaction.sql")))
                .contains("CREATE TABLE IF NOT EXISTS \"dp\".\"transaction\" (")
                .contains("\"_tenantid\" uuid NOT NULL");
        assertThat(Files.readString(out.resolve("README.md")))
                .contains("default-Dev-Postgres-All-Local.Postgres")
                .contains("| TR | Transaction | `dp.transaction` | 9 |");
    }

    @Test
    void testInvalidSnapshotWritesNothing() {
        Path out = tempDir.resolve("out");
        CompilationResult result = generate(TestSnapshots.MISSING_TENANT, out);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SNAPSHOT_INVALID);
        assertThat(result.getViolations()).hasSize(1);
        assertThat(result.getViolations().get(0).getMessage()).contains("_TenantID");
        assertThat(result.getManifest()).isNull();
        assertThat(out).doesNotExist();
    }

    @Test
    void testFailingTargetDoesNotBlockOthers() throws IOException {
        Path out = tempDir.resolve("out");
        CompilationResult result = generate(TestSnapshots.MULTI_TARGET, out);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.UNMAPPED_TYPE);
        assertThat(result.getTargets()).hasSize(3);
        assertThat(result.failedTargets()).isEqualTo(1);
        assertThat(result.getTargets().get(1).getErrorMessage()).contains("Money").contains("BigQuery");

        assertThat(result.getManifest()).isNotNull();
        assertThat(out.resolve(PG_FOLDER + "sql/transaction.sql")).exists();
        assertThat(out.resolve(DBX_FOLDER + "sql/transaction.sql")).exists();
        assertThat(out.resolve(BQ_FOLDER)).doesNotExist();
        assertThat(result.getManifest().getFiles().keySet()).noneMatch(p -> p.startsWith(BQ_FOLDER));

        assertThat(Files.readString(out.resolve(PG_FOLDER + "sql/90-foreign-keys.sql")))
                .contains("ALTER TABLE \"dp\".\"transaction\" ADD CONSTRAINT \"fk_tr_cu_tr_customerid\" "
                        + "FOREIGN KEY (\"tr_customerid\") REFERENCES \"dp\".\"customer\" (\"cu_id\");");
        assertThat(out.resolve(DBX_FOLDER + "sql/90-foreign-keys.sql")).doesNotExist();
        assertThat(out.resolve(PG_FOLDER + "jobs/load_dp.sql")).exists();
        assertThat(out.resolve(DBX_FOLDER + "jobs/load_dp.py")).exists();
        assertThat(Files.readString(out.resolve(PG_FOLDER + "semantic/metrics.json"))).contains("TOTAL_AMOUNT");
        assertThat(Files.readString(out.resolve("README.md"))).contains("FAILED");
    }

    @Test
    void testLineageGapsAreWarningsOnly() {
        CompilationResult result = generate(TestSnapshots.MULTI_TARGET, tempDir.resolve("out"));

        assertThat(result.getWarnings())
                .contains("Field Transaction.TR_Currency is mapped from a source object but has no source lineage")
                .noneMatch(w -> w.contains("TR_Amount"));
    }

    @Test
    void testRepeatedRunsAreByteIdentical() throws IOException {
        Path first = tempDir.resolve("first");
        Path second = tempDir.resolve("second");
        CompilationResult one = generate(TestSnapshots.MULTI_TARGET, first);
        CompilationResult two = new CompilationPipeline(CompilerConfig.builder()
                .snapshotPath(TestSnapshots.path(TestSnapshots.MULTI_TARGET))
                .outputDir(second)
                .parallelism(1)
                .build(), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());

        assertThat(two.getManifest()).isEqualTo(one.getManifest());
        assertThat(Files.readAllBytes(second.resolve(Manifest.FILE_NAME)))
                .isEqualTo(Files.readAllBytes(first.resolve(Manifest.FILE_NAME)));
    }

    @Test
    void testCancelledRunWritesNothing() {
        Path out = tempDir.resolve("out");
        CancellationToken token = new CancellationToken();
        token.cancel();

        CompilationResult result = new CompilationPipeline(TestSnapshots.config(TestSnapshots.SCENARIO_A, out),
                EmitterRegistry.withDefaults()).generate(token);

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(out).doesNotExist();
    }

    @Test
    void testSnapshotWithoutPlatformsUsesDefaultProfiles() throws IOException {
        Path snapshot = tempDir.resolve("no-platforms.json");
        String json = Files.readString(TestSnapshots.path(TestSnapshots.SCENARIO_A));
        ObjectNode root = (ObjectNode) JsonSupport.mapper().readTree(json);
        ((ObjectNode) root.get("objects")).remove("platforms");
        Files.writeString(snapshot, root.toString());

        Path out = tempDir.resolve("out");
        CompilationResult result = new CompilationPipeline(CompilerConfig.builder()
                .snapshotPath(snapshot)
                .outputDir(out)
                .defaultPlatformCode("Snowflake")
                .build(), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(out.resolve("sql/TRANSACTION.sql")).exists();
    }

    @Test
    void testDuplicatePlatformBindingIsRejectedBeforeWriting() throws IOException {
        Path snapshot = tempDir.resolve("shared-platform.json");
        String json = Files.readString(TestSnapshots.path(TestSnapshots.MULTI_TARGET));
        ObjectNode root = (ObjectNode) JsonSupport.mapper().readTree(json);
        for (JsonNode binding : root.path("objects").path("targets").path("targetPlatforms")) {
            if ("DR".equals(binding.path("role").asText())) {
                ((ObjectNode) binding).put("platformId", "00000000-0000-4000-8000-000000000901");
            }
        }
        Files.writeString(snapshot, root.toString());

        Path out = tempDir.resolve("out");
        CompilationResult result = new CompilationPipeline(CompilerConfig.builder()
                .snapshotPath(snapshot)
                .outputDir(out)
                .build(), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SNAPSHOT_INVALID);
        assertThat(result.getViolations())
                .extracting(Violation::getRule)
                .containsExactly("targetPlatform.platform.duplicate");
        assertThat(out).doesNotExist();
    }

    @Test
    void testTenantPolicyProducesRowSecurityScript() throws IOException {
        Path snapshot = tempDir.resolve("secured.json");
        ObjectNode root = (ObjectNode) JsonSupport.mapper().readTree(
                Files.readString(TestSnapshots.path(TestSnapshots.SCENARIO_A)));
        ObjectNode security = ((ObjectNode) root.path("objects")).putObject("security");
        security.putArray("policies").addObject()
                .put("id", "00000000-0000-4000-8000-000000000801")
                .put("code", "tenant_isolation")
                .put("expression", "tenant");
        security.putArray("tableSecurity").addObject()
                .put("id", "00000000-0000-4000-8000-000000000811")
                .put("tableId", TestSnapshots.TRANSACTION_ID.toString())
                .put("policyId", "00000000-0000-4000-8000-000000000801")
                .put("mode", "Both");
        Files.writeString(snapshot, root.toString());

        Path out = tempDir.resolve("out");
        CompilationResult result = new CompilationPipeline(CompilerConfig.builder()
                .snapshotPath(snapshot)
                .outputDir(out)
                .build(), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getManifest().getFiles()).containsKey("sql/85-rls.sql");
        assertThat(Files.readString(out.resolve("sql/85-rls.sql")))
                .contains("CREATE POLICY \"rls_tr\" ON \"dp\".\"transaction\" "
                        + "USING (\"_tenantid\" = CAST(current_setting('app.tenant_id') AS uuid)) "
                        + "WITH CHECK (\"_tenantid\" = CAST(current_setting('app.tenant_id') AS uuid));");
    }

    @Test
    void testUnreadablePolicyIsRejectedBeforeWriting() throws IOException {
        Path snapshot = tempDir.resolve("bad-policy.json");
        ObjectNode root = (ObjectNode) JsonSupport.mapper().readTree(
                Files.readString(TestSnapshots.path(TestSnapshots.SCENARIO_A)));
        ((ObjectNode) root.path("objects")).putObject("security").putArray("policies").addObject()
                .put("id", "00000000-0000-4000-8000-000000000801")
                .put("code", "region_only")
                .put("expression", "region = 'EMEA'");
        Files.writeString(snapshot, root.toString());

        Path out = tempDir.resolve("out");
        CompilationResult result = new CompilationPipeline(CompilerConfig.builder()
                .snapshotPath(snapshot)
                .outputDir(out)
                .build(), EmitterRegistry.withDefaults())
                .generate(CancellationToken.none());

        assertThat(result.getErrorKind()).isEqualTo(ErrorKind.SNAPSHOT_INVALID);
        assertThat(result.getViolations())
                .extracting(Violation::getRule)
                .containsExactly("policy.expression.invalid");
        assertThat(out).doesNotExist();
    }
}
