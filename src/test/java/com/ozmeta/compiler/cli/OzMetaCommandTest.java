package com.ozmeta.compiler.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.compile.CancellationToken;
import com.ozmeta.compiler.compile.CompilationPipeline;
import com.ozmeta.compiler.compile.TargetBinder;
import com.ozmeta.compiler.drift.LiveTargetObservation;
import com.ozmeta.compiler.drift.ObservedColumn;
import com.ozmeta.compiler.drift.ObservedObject;
import com.ozmeta.compiler.emit.EmitterRegistry;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.util.JsonSupport;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Exit code tests for the ozmeta subcommands.
 */
class OzMetaCommandTest {

    @TempDir
    Path tempDir;

    private static int run(String... args) {
        return new CommandLine(new OzMetaCommand()).execute(args);
    }

    private static String fixture(String name) {
        return TestSnapshots.path(name).toString();
    }

    @Test
    void testValidate() {
        assertThat(run("validate", "--snapshot", fixture(TestSnapshots.SCENARIO_A))).isEqualTo(ExitCodes.OK);
        assertThat(run("validate", "-s", fixture(TestSnapshots.MULTI_TARGET))).isEqualTo(ExitCodes.OK);
        assertThat(run("validate", "-s", fixture(TestSnapshots.MISSING_TENANT))).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("validate", "-s", tempDir.resolve("absent.json").toString())).isEqualTo(ExitCodes.FILE_ERROR);
    }

    @Test
    void testValidateMalformedJson() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"meta\": ");

        assertThat(run("validate", "-s", broken.toString())).isEqualTo(ExitCodes.INPUT_INVALID);
    }

    @Test
    void testGenerate() {
        Path out = tempDir.resolve("out");

        int exitCode = run("generate", "-s", fixture(TestSnapshots.SCENARIO_A), "-o", out.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.resolve("sql/transaction.sql")).exists();
        assertThat(out.resolve("manifest.json")).exists();
    }

    @Test
    void testGeneratePartialFailure() {
        Path out = tempDir.resolve("out");

        int exitCode = run("generate", "-s", fixture(TestSnapshots.MULTI_TARGET), "-o", out.toString(),
                "--parallelism", "3");

        assertThat(exitCode).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(out.resolve("targets/SFO-Dev-Fabric-All-USW.Postgres/sql/transaction.sql")).exists();
    }

    @Test
    void testGenerateRejectsBadOptions() {
        String out = tempDir.resolve("out").toString();

        assertThat(run("generate", "-s", tempDir.resolve("absent.json").toString(), "-o", out))
                .isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("generate", "-s", fixture(TestSnapshots.SCENARIO_A), "-o", out, "--parallelism", "-1"))
                .isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void testGenerateWithBundledSnowflakeProfile() throws IOException {
        Path out = tempDir.resolve("out");
        Path snapshot = tempDir.resolve("no-platforms.json");
        ObjectNode root = (ObjectNode) JsonSupport.mapper()
                .readTree(TestSnapshots.path(TestSnapshots.SCENARIO_A).toFile());
        ((ObjectNode) root.get("objects")).remove("platforms");
        Files.writeString(snapshot, root.toString());

        int exitCode = run("generate", "-s", snapshot.toString(), "-o", out.toString(),
                "--default-platform", "Snowflake");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(Files.readString(out.resolve("sql/TRANSACTION.sql"))).contains("CLUSTER BY");
    }

    @Test
    void testDriftDetected() throws IOException {
        Path observation = tempDir.resolve("observation.json");
        Files.writeString(observation, "{ \"objects\": [] }");
        Path report = tempDir.resolve("report.json");

        int exitCode = run("drift", "-s", fixture(TestSnapshots.MULTI_TARGET),
                "--observation", observation.toString(),
                "--target-platform", TestSnapshots.POSTGRES_TP.toString(),
                "--report", report.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.DRIFT_DETECTED);
        assertThat(Files.readString(report)).contains("MISSING_OBJECT").contains("dp.transaction");
    }

    @Test
    void testNoDrift() throws IOException {
        Path observation = tempDir.resolve("observation.json");
        Files.writeString(observation, JsonSupport.mapper().writeValueAsString(matchingObservation()));

        int exitCode = run("drift", "-s", fixture(TestSnapshots.MULTI_TARGET),
                "--observation", observation.toString(),
                "--target-platform", TestSnapshots.POSTGRES_TP.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
    }

    @Test
    void testDriftRejectsBadInput() throws IOException {
        Path observation = tempDir.resolve("observation.json");
        Files.writeString(observation, "{ \"objects\": [] }");
        String snapshot = fixture(TestSnapshots.MULTI_TARGET);

        assertThat(run("drift", "-s", snapshot, "--observation", observation.toString(),
                "--target-platform", "not-a-uuid")).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("drift", "-s", snapshot, "--observation", observation.toString(),
                "--target-platform", UUID.randomUUID().toString())).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("drift", "-s", snapshot, "--observation", observation.toString(),
                "--target-platform", TestSnapshots.BIGQUERY_TP.toString())).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("drift", "-s", snapshot, "--observation", tempDir.resolve("absent.json").toString(),
                "--target-platform", TestSnapshots.POSTGRES_TP.toString())).isEqualTo(ExitCodes.INPUT_INVALID);
    }

    @Test
    void testExportExitCodes() {
        String out = tempDir.resolve("snapshot.json").toString();
        String project = "7d1c2f4e-9a3b-4c5d-8e6f-0123456789ab";

        assertThat(run("export", "--project-id", project, "--out", out)).isEqualTo(ExitCodes.OK);
        assertThat(run("validate", "-s", out)).isEqualTo(ExitCodes.OK);
        assertThat(run("export", "--project-id", "x", "--out", out)).isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("export", "--provider", "metadb", "--project-id", project, "--out", out))
                .isEqualTo(ExitCodes.INPUT_INVALID);
        assertThat(run("export", "--provider", "extract", "--connection", tempDir.resolve("none").toString(),
                "--project-id", project, "--out", out)).isEqualTo(ExitCodes.CONNECTION_FAILED);
    }

    private static LiveTargetObservation matchingObservation() throws IOException {
        CompilationPipeline pipeline = new CompilationPipeline(
                TestSnapshots.config(TestSnapshots.MULTI_TARGET, null), EmitterRegistry.withDefaults());
        TargetProjection projection = pipeline.compileTargets(pipeline.loadAndValidate(),
                b -> TargetBinder.sameTargetPlatform(b, TestSnapshots.POSTGRES_TP), CancellationToken.none())
                .get(0).getProjection();

        LiveTargetObservation.LiveTargetObservationBuilder observation = LiveTargetObservation.builder()
                .targetPlatformId(projection.getTargetPlatformId());
        for (PhysicalObject object : projection.getObjects()) {
            ObservedObject.ObservedObjectBuilder observed = ObservedObject.builder()
                    .schema(object.getPhysicalSchema())
                    .name(object.getPhysicalName());
            for (PhysicalField field : object.getFields()) {
                observed.column(ObservedColumn.builder().name(field.getPhysicalName()).type(field.getPhysicalType())
                        .build());
            }
            observation.object(observed.build());
        }
        return observation.build();
    }
}
