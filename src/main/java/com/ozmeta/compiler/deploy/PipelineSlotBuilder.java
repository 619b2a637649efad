package com.ozmeta.compiler.deploy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ozmeta.compiler.compile.CancellationToken;
import com.ozmeta.compiler.compile.CompilationPipeline;
import com.ozmeta.compiler.compile.CompilationPipeline.ValidatedSnapshot;
import com.ozmeta.compiler.compile.TargetBinder;
import com.ozmeta.compiler.compile.TargetCompilationResult;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.output.DeterministicOutputWriter;

/**
 * Builds a slot by compiling only the targets of that slot's environment and
 * writing them to {@code <outputRoot>/<switchGroup>/<env>}.
 */
public class PipelineSlotBuilder implements SlotBuilder {

    private final CompilationPipeline pipeline;
    private final ValidatedSnapshot snapshot;
    private final Path outputRoot;
    private final DeterministicOutputWriter writer = new DeterministicOutputWriter();

    public PipelineSlotBuilder(CompilationPipeline pipeline, ValidatedSnapshot snapshot, Path outputRoot) {
        this.pipeline = pipeline;
        this.snapshot = snapshot;
        this.outputRoot = outputRoot;
    }

    @Override
    public SlotBuild build(String switchGroup, Slot slot, CancellationToken cancellation) {
        List<TargetCompilationResult> results = pipeline.compileTargets(snapshot,
                TargetBinder.inSlot(switchGroup, slot.getEnv()), cancellation);

        SlotBuild.SlotBuildBuilder build = SlotBuild.builder().slot(slot);
        if (results.isEmpty()) {
            return build.error("No targets in switch group " + switchGroup + " for " + slot.getEnv()).build();
        }

        List<EmittedFile> files = new ArrayList<>();
        boolean failed = false;
        for (TargetCompilationResult result : results) {
            result.getDiagnostics().getWarnings().forEach(w -> build.warning(result.key() + ": " + w));
            if (!result.isSuccess()) {
                build.error(result.key() + ": " + result.getErrorMessage());
                failed = true;
                continue;
            }
            build.projection(result.getProjection());
            for (EmittedFile file : result.getEmitResult().getFiles()) {
                files.add(results.size() > 1 ? file.under(CompilationPipeline.TARGETS_FOLDER + "/" + result.key())
                        : file);
            }
        }
        if (failed) {
            return build.build();
        }

        cancellation.throwIfCancellationRequested("writing slot " + slot.getEnv());
        Path slotDir = outputRoot.resolve(switchGroup).resolve(slot.getEnv());
        try {
            Manifest manifest = writer.write(slotDir, files);
            return build.outputDir(slotDir).manifest(manifest).build();
        } catch (IOException e) {
            return build.error("Failed to write slot artifacts to " + slotDir + ": " + e.getMessage()).build();
        }
    }
}
