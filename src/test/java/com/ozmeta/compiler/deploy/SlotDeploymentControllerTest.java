package com.ozmeta.compiler.deploy;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.compile.CancellationToken;
import com.ozmeta.compiler.exception.DeployFailedException;
import com.ozmeta.compiler.snapshot.SnapshotLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for A/B slot deployment with stubbed build, deploy and validate steps.
 */
class SlotDeploymentControllerTest {

    private static final String GROUP = "SFO-BI";
    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Slot> deployedSlots = new ArrayList<>();
    private DeploymentHistory history;

    private final SlotBuilder okBuilder = (group, slot, cancellation) -> SlotBuild.builder().slot(slot).build();
    private final ArtifactDeployer recordingDeployer = (group, build) -> deployedSlots.add(build.getSlot());
    private final SlotValidator passingValidator = (group, build) -> List.of();

    @BeforeEach
    void setUp() {
        history = new DeploymentHistory();
    }

    private SlotDeploymentController controller(SlotBuilder builder, ArtifactDeployer deployer,
            SlotValidator validator) {
        SlotDeploymentController controller = new SlotDeploymentController(builder, deployer, validator, history,
                Duration.ofMillis(200), clock);
        controller.register(new SwitchGroup(GROUP, Slot.PROD_A));
        return controller;
    }

    private static DeploymentRequest request() {
        return DeploymentRequest.builder().switchGroup(GROUP).actor("ops").snapshotVersion("1.0").build();
    }

    @Test
    void testSuccessfulDeploymentPromotesInactiveSlot() {
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, passingValidator);

        DeploymentOutcome outcome = controller.deploy(request());

        assertThat(outcome.isPromoted()).isTrue();
        assertThat(outcome.getActiveSlot()).isEqualTo(Slot.PROD_B);
        assertThat(deployedSlots).containsExactly(Slot.PROD_B);

        DeploymentRecord record = outcome.getRecord();
        assertThat(record.getPreviousActive()).isEqualTo(Slot.PROD_A);
        assertThat(record.getCandidate()).isEqualTo(Slot.PROD_B);
        assertThat(record.getActiveAfter()).isEqualTo(Slot.PROD_B);
        assertThat(record.getActor()).isEqualTo("ops");
        assertThat(record.getFailedIn()).isNull();
        assertThat(record.getStartedAtUTC()).isEqualTo(NOW);
        assertThat(history.records()).containsExactly(record);
        assertThat(controller.findGroup(GROUP).orElseThrow().getState()).isEqualTo(SlotState.IDLE);
    }

    @Test
    void testSecondDeploymentFlipsBack() {
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, passingValidator);

        controller.deploy(request());
        DeploymentOutcome second = controller.deploy(request());

        assertThat(second.getActiveSlot()).isEqualTo(Slot.PROD_A);
        assertThat(deployedSlots).containsExactly(Slot.PROD_B, Slot.PROD_A);
        assertThat(history.forGroup(GROUP)).hasSize(2);
    }

    @Test
    void testValidationFailureKeepsActiveSlot() {
        SlotValidator failing = (group, build) -> List.of("row count anomaly on dp.transaction");
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, failing);

        DeploymentOutcome outcome = controller.deploy(request());

        assertThat(outcome.getActiveSlot()).isEqualTo(Slot.PROD_A);
        DeploymentRecord record = outcome.getRecord();
        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.ROLLED_BACK);
        assertThat(record.getFailedIn()).isEqualTo(SlotState.VALIDATING);
        assertThat(record.getFailureReason()).isEqualTo("Validation failed: row count anomaly on dp.transaction");
        assertThat(record.getActiveAfter()).isEqualTo(Slot.PROD_A);
        assertThat(controller.findGroup(GROUP).orElseThrow().getActiveSlot()).isEqualTo(Slot.PROD_A);
        assertThat(history.toJson()).contains("ROLLED_BACK");
    }

    @Test
    void testDeployErrorRollsBack() {
        ArtifactDeployer failing = (group, build) -> {
            throw new IOException("target unreachable");
        };
        List<String> validated = new ArrayList<>();
        SlotDeploymentController controller = controller(okBuilder, failing, (group, build) -> {
            validated.add(group);
            return List.of();
        });

        DeploymentRecord record = controller.deploy(request()).getRecord();

        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.ROLLED_BACK);
        assertThat(record.getFailedIn()).isEqualTo(SlotState.DEPLOYING);
        assertThat(record.getFailureReason()).isEqualTo("Deploy failed: target unreachable");
        assertThat(validated).isEmpty();
    }

    @Test
    void testDeployTimeoutRollsBack() {
        ArtifactDeployer hanging = (group, build) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        SlotDeploymentController controller = controller(okBuilder, hanging, passingValidator);

        DeploymentOutcome outcome = controller.deploy(DeploymentRequest.builder()
                .switchGroup(GROUP)
                .callTimeout(Duration.ofMillis(100))
                .build());

        assertThat(outcome.getActiveSlot()).isEqualTo(Slot.PROD_A);
        assertThat(outcome.getRecord().getFailedIn()).isEqualTo(SlotState.DEPLOYING);
        assertThat(outcome.getRecord().getFailureReason()).contains("did not finish within");
    }

    @Test
    void testValidationTimeoutRollsBack() {
        SlotValidator hanging = (group, build) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, hanging);

        DeploymentOutcome outcome = controller.deploy(DeploymentRequest.builder()
                .switchGroup(GROUP)
                .callTimeout(Duration.ofMillis(100))
                .build());

        DeploymentRecord record = outcome.getRecord();
        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.ROLLED_BACK);
        assertThat(record.getFailedIn()).isEqualTo(SlotState.VALIDATING);
        assertThat(record.getFailureReason()).startsWith("Validation timed out: ");
        assertThat(deployedSlots).containsExactly(Slot.PROD_B);
        assertThat(outcome.getActiveSlot()).isEqualTo(Slot.PROD_A);
        assertThat(controller.findGroup(GROUP).orElseThrow().getActiveSlot()).isEqualTo(Slot.PROD_A);
        assertThat(controller.findGroup(GROUP).orElseThrow().getState()).isEqualTo(SlotState.IDLE);
    }

    @Test
    void testCompilationErrorsStopBeforeDeploy() {
        SlotBuilder broken = (group, slot, cancellation) -> SlotBuild.builder()
                .slot(slot)
                .error("Postgres: unmapped type")
                .build();
        SlotDeploymentController controller = controller(broken, recordingDeployer, passingValidator);

        DeploymentRecord record = controller.deploy(request()).getRecord();

        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(record.getFailedIn()).isEqualTo(SlotState.COMPILING);
        assertThat(record.getFailureReason()).isEqualTo("Postgres: unmapped type");
        assertThat(deployedSlots).isEmpty();
    }

    @Test
    void testCancelledBeforeStart() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, passingValidator);

        DeploymentRecord record = controller.deploy(DeploymentRequest.builder()
                .switchGroup(GROUP)
                .cancellation(token)
                .build()).getRecord();

        assertThat(record.getStatus()).isEqualTo(DeploymentStatus.CANCELLED);
        assertThat(record.getFailedIn()).isEqualTo(SlotState.COMPILING);
        assertThat(deployedSlots).isEmpty();
    }

    @Test
    void testCancelledDuringDeployRollsBack() {
        CancellationToken token = new CancellationToken();
        ArtifactDeployer cancelling = (group, build) -> token.cancel();
        SlotDeploymentController controller = controller(okBuilder, cancelling, passingValidator);

        DeploymentOutcome outcome = controller.deploy(DeploymentRequest.builder()
                .switchGroup(GROUP)
                .cancellation(token)
                .build());

        assertThat(outcome.getRecord().getStatus()).isEqualTo(DeploymentStatus.CANCELLED);
        assertThat(outcome.getRecord().getFailedIn()).isEqualTo(SlotState.VALIDATING);
        assertThat(outcome.getActiveSlot()).isEqualTo(Slot.PROD_A);
    }

    @Test
    void testUnknownGroup() {
        SlotDeploymentController controller = controller(okBuilder, recordingDeployer, passingValidator);

        assertThatThrownBy(() -> controller.deploy(DeploymentRequest.builder().switchGroup("NOPE").build()))
                .isInstanceOf(DeployFailedException.class)
                .hasMessage("Unknown switch group: NOPE");
        assertThat(history.records()).isEmpty();
    }

    @Test
    void testBusyGroupIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ArtifactDeployer blocking = (group, build) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        SlotDeploymentController controller = controller(okBuilder, blocking, passingValidator);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<DeploymentOutcome> first = executor.submit(() -> controller.deploy(request()));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> controller.deploy(request()))
                    .isInstanceOf(DeployFailedException.class)
                    .hasMessageContaining("busy");

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).isPromoted()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testRegisterFromSnapshot() throws IOException {
        SlotDeploymentController controller = new SlotDeploymentController(okBuilder, recordingDeployer,
                passingValidator, history);

        controller.registerFromSnapshot(new SnapshotLoader().load(TestSnapshots.path(TestSnapshots.SLOTS)));

        assertThat(controller.findGroup(GROUP)).hasValueSatisfying(
                group -> assertThat(group.getActiveSlot()).isEqualTo(Slot.PROD_A));
        assertThat(controller.findGroup("SFO-Dev-Fabric-All-USW")).isEmpty();
    }
}
