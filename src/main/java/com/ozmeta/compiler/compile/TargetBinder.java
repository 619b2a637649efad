package com.ozmeta.compiler.compile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.PlatformDefinition;
import com.ozmeta.compiler.model.canonical.TargetDefinition;
import com.ozmeta.compiler.model.canonical.TargetPlatformDefinition;
import com.ozmeta.compiler.model.canonical.TargetRole;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.util.Hashing;

/**
 * Resolves the snapshot's target platforms into bindings, ordered by target
 * name, failover order and platform code.
 */
public class TargetBinder {

    private static final Logger log = LoggerFactory.getLogger(TargetBinder.class);

    private static final Comparator<TargetPlatformBinding> ORDER = Comparator
            .comparing((TargetPlatformBinding b) -> b.getTarget().getCanonicalName())
            .thenComparingInt(b -> b.getTargetPlatform().getFailoverOrder())
            .thenComparing(b -> b.getPlatform().getCode());

    private final String defaultPlatformCode;

    public TargetBinder(String defaultPlatformCode) {
        this.defaultPlatformCode = defaultPlatformCode;
    }

    public List<TargetPlatformBinding> bind(SnapshotIndex index, ToolDiagnostics diagnostics) {
        if (index.getSnapshot().getTargets().getTargets().isEmpty()) {
            return List.of(implicitBinding(index, diagnostics));
        }

        List<TargetPlatformBinding> bindings = new ArrayList<>();
        for (TargetPlatformDefinition targetPlatform : index.getSnapshot().getTargets().getTargetPlatforms()) {
            TargetDefinition target = index.findTarget(targetPlatform.getTargetId()).orElseThrow();
            PlatformDefinition platform = index.findPlatform(targetPlatform.getPlatformId()).orElseThrow();
            if (!platform.isEnabled()) {
                diagnostics.warn("Platform " + platform.getCode() + " is disabled; skipping "
                        + target.getCanonicalName());
                continue;
            }
            bindings.add(binding(index, target, targetPlatform, platform));
        }
        bindings.sort(ORDER);
        return bindings;
    }

    private TargetPlatformBinding implicitBinding(SnapshotIndex index, ToolDiagnostics diagnostics) {
        PlatformDefinition platform = index.findPlatformByCode(defaultPlatformCode)
                .orElseThrow(() -> new CompilationException("Snapshot defines no targets and default platform '"
                        + defaultPlatformCode + "' is not in the profile set"));
        String projectId = index.getSnapshot().getMeta().getProjectId();
        TargetDefinition target = TargetDefinition.builder()
                .id(Hashing.derivedId("implicit-target", projectId))
                .client("default")
                .env("Dev")
                .platform(platform.getCode())
                .domain(TargetDefinition.ALL_DOMAINS)
                .region("Local")
                .build();
        TargetPlatformDefinition targetPlatform = TargetPlatformDefinition.builder()
                .id(Hashing.derivedId("implicit-target-platform", projectId, platform.getId()))
                .targetId(target.getId())
                .platformId(platform.getId())
                .role(TargetRole.PRIMARY)
                .build();
        log.info("Snapshot defines no targets, compiling implicit target {}", target.getCanonicalName());
        diagnostics.info("Using implicit target " + target.getCanonicalName());
        return binding(index, target, targetPlatform, platform);
    }

    private TargetPlatformBinding binding(SnapshotIndex index, TargetDefinition target,
            TargetPlatformDefinition targetPlatform, PlatformDefinition platform) {
        ConstraintProfile profile = index.findConstraintProfile(platform.getConstraintProfile()).orElseThrow();
        return TargetPlatformBinding.builder()
                .target(target)
                .targetPlatform(targetPlatform)
                .platform(platform)
                .constraintProfile(profile)
                .build();
    }

    /**
     * Selects bindings whose target belongs to {@code switchGroup} and runs in
     * environment {@code env}.
     */
    public static Predicate<TargetPlatformBinding> inSlot(String switchGroup, String env) {
        return binding -> {
            TargetDefinition target = binding.getTarget();
            return switchGroup.equalsIgnoreCase(target.getSwitchGroup()) && env.equalsIgnoreCase(target.getEnv());
        };
    }

    public static boolean sameTargetPlatform(TargetPlatformBinding binding, UUID targetPlatformId) {
        return binding.getTargetPlatform().getId().equals(targetPlatformId);
    }
}
