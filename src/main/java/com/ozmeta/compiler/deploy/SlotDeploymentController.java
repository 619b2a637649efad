package com.ozmeta.compiler.deploy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.exception.DeployFailedException;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.output.DeterministicOutputWriter;
import com.ozmeta.compiler.util.BoundedCall;
import com.ozmeta.compiler.util.Hashing;

/**
 * Runs compile, deploy, validate and promote against the inactive slot of a
 * switch group. Operations on one group are serialized; groups are
 * independent. Whatever fails, the previously active slot stays active.
 */
public class SlotDeploymentController {

    private static final Logger log = LoggerFactory.getLogger(SlotDeploymentController.class);

    private final SlotBuilder builder;
    private final ArtifactDeployer deployer;
    private final SlotValidator validator;
    private final DeploymentHistory history;
    private final Duration lockTimeout;
    private final Clock clock;

    private final Map<String, SwitchGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public SlotDeploymentController(SlotBuilder builder, ArtifactDeployer deployer, SlotValidator validator,
            DeploymentHistory history, Duration lockTimeout, Clock clock) {
        this.builder = builder;
        this.deployer = deployer;
        this.validator = validator;
        this.history = history;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    public SlotDeploymentController(SlotBuilder builder, ArtifactDeployer deployer, SlotValidator validator,
            DeploymentHistory history) {
        this(builder, deployer, validator, history, Duration.ofSeconds(30), Clock.systemUTC());
    }

    public void register(SwitchGroup group) {
        groups.put(group.getName(), group);
    }

    /**
     * Registers every switch group found in the snapshot's targets, with the
     * slot of its active target as the active slot.
     */
    public void registerFromSnapshot(SnapshotDocument snapshot) {
        for (TargetDefinition target : snapshot.getTargets().getTargets()) {
            if (target.getSwitchGroup() == null || !target.isProductionSlot() || !target.isActive()) {
                continue;
            }
            register(new SwitchGroup(target.getSwitchGroup(), Slot.fromEnv(target.getEnv())));
        }
    }

    public Optional<SwitchGroup> findGroup(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    /**
     * Deploys to the inactive slot and promotes it when every step succeeds.
     *
     * @throws DeployFailedException when the group is unknown or busy beyond the lock timeout
     */
    public DeploymentOutcome deploy(DeploymentRequest request) {
        SwitchGroup group = findGroup(request.getSwitchGroup())
                .orElseThrow(() -> new DeployFailedException("Unknown switch group: " + request.getSwitchGroup()));
        ReentrantLock lock = locks.computeIfAbsent(group.getName(), n -> new ReentrantLock());
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new DeployFailedException("Switch group " + group.getName() + " is busy");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeployFailedException("Interrupted while waiting for switch group " + group.getName(), e);
        }
        try {
            return run(group, request);
        } finally {
            lock.unlock();
        }
    }

    private DeploymentOutcome run(SwitchGroup group, DeploymentRequest request) {
        Attempt attempt = new Attempt(group, request, clock.instant());
        SlotStateMachine machine = group.stateMachine();
        log.info("Deploying {} into slot {} (active: {})", group.getName(), attempt.candidate.getEnv(),
                attempt.previous.getEnv());

        // Compile
        machine.transitionTo(SlotState.COMPILING);
        SlotBuild build;
        try {
            request.getCancellation().throwIfCancellationRequested("compiling");
            build = builder.build(group.getName(), attempt.candidate, request.getCancellation());
        } catch (CancellationException e) {
            machine.transitionTo(SlotState.IDLE);
            return attempt.finish(DeploymentStatus.CANCELLED, SlotState.COMPILING, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Compilation for {} failed", group.getName(), e);
            machine.transitionTo(SlotState.IDLE);
            return attempt.finish(DeploymentStatus.FAILED, SlotState.COMPILING, describe(e), null);
        }
        if (build.hasErrors()) {
            machine.transitionTo(SlotState.IDLE);
            return attempt.finish(DeploymentStatus.FAILED, SlotState.COMPILING,
                    String.join("; ", build.getErrors()), build.getManifest());
        }
        build.getWarnings().forEach(w -> log.warn("  {}", w));

        // Deploy
        machine.transitionTo(SlotState.DEPLOYING);
        try {
            request.getCancellation().throwIfCancellationRequested("deploying");
            BoundedCall.call("deploy-" + group.getName(), request.getCallTimeout(), () -> {
                deployer.deploy(group.getName(), build);
                return null;
            });
        } catch (CancellationException e) {
            return rollBack(attempt, DeploymentStatus.CANCELLED, SlotState.DEPLOYING, e.getMessage(), build);
        } catch (TimeoutException | ExecutionException | InterruptedException | RuntimeException e) {
            restoreInterrupt(e);
            return rollBack(attempt, DeploymentStatus.ROLLED_BACK, SlotState.DEPLOYING,
                    "Deploy failed: " + describe(e), build);
        }

        // Validate
        machine.transitionTo(SlotState.VALIDATING);
        try {
            request.getCancellation().throwIfCancellationRequested("validating");
            List<String> failures = BoundedCall.call("validate-" + group.getName(), request.getCallTimeout(),
                    () -> validator.validate(group.getName(), build));
            if (!failures.isEmpty()) {
                return rollBack(attempt, DeploymentStatus.ROLLED_BACK, SlotState.VALIDATING,
                        "Validation failed: " + String.join("; ", failures), build);
            }
        } catch (CancellationException e) {
            return rollBack(attempt, DeploymentStatus.CANCELLED, SlotState.VALIDATING, e.getMessage(), build);
        } catch (TimeoutException e) {
            return rollBack(attempt, DeploymentStatus.ROLLED_BACK, SlotState.VALIDATING,
                    "Validation timed out: " + e.getMessage(), build);
        } catch (ExecutionException | InterruptedException | RuntimeException e) {
            restoreInterrupt(e);
            return rollBack(attempt, DeploymentStatus.ROLLED_BACK, SlotState.VALIDATING,
                    "Validation failed: " + describe(e), build);
        }

        // Promote
        machine.transitionTo(SlotState.PROMOTING);
        if (request.getCancellation().isCancellationRequested()) {
            return rollBack(attempt, DeploymentStatus.CANCELLED, SlotState.PROMOTING, "Cancelled before promoting",
                    build);
        }
        if (!group.flip(attempt.previous, attempt.candidate)) {
            return rollBack(attempt, DeploymentStatus.ROLLED_BACK, SlotState.PROMOTING,
                    "Active slot changed during promotion", build);
        }
        machine.transitionTo(SlotState.IDLE);
        log.info("Promoted {} to slot {}", group.getName(), attempt.candidate.getEnv());
        return attempt.finish(DeploymentStatus.PROMOTED, null, null, build.getManifest());
    }

    private DeploymentOutcome rollBack(Attempt attempt, DeploymentStatus status, SlotState failedIn, String reason,
            SlotBuild build) {
        SlotStateMachine machine = attempt.group.stateMachine();
        machine.transitionTo(SlotState.ROLLING_BACK);
        log.warn("Rolling back {} ({}): {}", attempt.group.getName(), failedIn, reason);
        machine.transitionTo(SlotState.IDLE);
        return attempt.finish(status, failedIn, reason, build.getManifest());
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Throwable e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private final class Attempt {
        private final SwitchGroup group;
        private final DeploymentRequest request;
        private final Instant startedAt;
        private final Slot previous;
        private final Slot candidate;

        private Attempt(SwitchGroup group, DeploymentRequest request, Instant startedAt) {
            this.group = group;
            this.request = request;
            this.startedAt = startedAt;
            this.previous = group.getActiveSlot();
            this.candidate = group.getInactiveSlot();
        }

        private DeploymentOutcome finish(DeploymentStatus status, SlotState failedIn, String reason,
                Manifest manifest) {
            DeploymentRecord record = DeploymentRecord.builder()
                    .id(UUID.randomUUID())
                    .switchGroup(group.getName())
                    .actor(request.getActor())
                    .snapshotVersion(request.getSnapshotVersion())
                    .manifestHash(manifest == null ? null
                            : Hashing.sha256Hex(DeterministicOutputWriter.manifestBytes(manifest)))
                    .previousActive(previous)
                    .candidate(candidate)
                    .activeAfter(group.getActiveSlot())
                    .status(status)
                    .failedIn(failedIn)
                    .failureReason(reason)
                    .startedAtUTC(startedAt)
                    .finishedAtUTC(clock.instant())
                    .build();
            history.append(record);
            return new DeploymentOutcome(record, group.getActiveSlot());
        }
    }
}
