package com.ozmeta.compiler.compile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.emit.ArtifactEmitter;
import com.ozmeta.compiler.emit.EmitterRegistry;
import com.ozmeta.compiler.emit.TemplateRenderer;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.exception.ErrorKind;
import com.ozmeta.compiler.exception.OzMetaException;
import com.ozmeta.compiler.exception.SnapshotInvalidException;
import com.ozmeta.compiler.lineage.LineageCompletenessChecker;
import com.ozmeta.compiler.lineage.LineageGraph;
import com.ozmeta.compiler.model.canonical.PlatformArea;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.naming.CodeRegistry;
import com.ozmeta.compiler.output.DeterministicOutputWriter;
import com.ozmeta.compiler.projection.ProjectionResolver;
import com.ozmeta.compiler.snapshot.ProfileSetLoader;
import com.ozmeta.compiler.snapshot.SnapshotIndex;
import com.ozmeta.compiler.snapshot.SnapshotLoader;
import com.ozmeta.compiler.snapshot.SnapshotSchemaValidator;
import com.ozmeta.compiler.snapshot.SnapshotValidator;
import com.ozmeta.compiler.snapshot.Violation;

/**
 * Drives a compilation run: load, validate, project and emit every target
 * platform in parallel, then write one deterministic output directory.
 * A failing target does not stop the others.
 */
public class CompilationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CompilationPipeline.class);

    public static final String TARGETS_FOLDER = "targets";

    private final CompilerConfig config;
    private final EmitterRegistry emitters;
    private final TemplateRenderer templates = new TemplateRenderer();
    private final ProfileSetLoader profileLoader = new ProfileSetLoader();
    private final SnapshotValidator validator = new SnapshotValidator();
    private final DeterministicOutputWriter writer = new DeterministicOutputWriter();

    public CompilationPipeline(CompilerConfig config, EmitterRegistry emitters) {
        this.config = config;
        this.emitters = emitters;
    }

    /**
     * Snapshot plus the profile set it resolves against, after validation.
     */
    public static final class ValidatedSnapshot {
        private final SnapshotIndex index;

        ValidatedSnapshot(SnapshotIndex index) {
            this.index = index;
        }

        public SnapshotIndex getIndex() {
            return index;
        }

        public SnapshotDocument getSnapshot() {
            return index.getSnapshot();
        }
    }

    /**
     * Generate the complete output directory described by the configuration.
     */
    public CompilationResult generate(CancellationToken cancellation) {
        try {
            log.info("Starting compilation...");

            // Step 1: Load and validate the snapshot
            log.info("Step 1: Loading snapshot {}...", config.getSnapshotPath());
            ValidatedSnapshot validated = loadAndValidate();

            // Step 2: Compile targets
            cancellation.throwIfCancellationRequested("compiling targets");
            log.info("Step 2: Compiling targets...");
            List<TargetCompilationResult> results = compileTargets(validated, b -> true, cancellation);

            // Step 3: Lineage
            log.info("Step 3: Checking lineage...");
            List<String> warnings = checkLineage(validated.getSnapshot(), results);
            warnings.forEach(w -> log.warn("Lineage: {}", w));

            // Step 4: Assemble artifacts
            cancellation.throwIfCancellationRequested("writing output");
            log.info("Step 4: Assembling artifacts...");
            List<EmittedFile> files = assemble(validated.getSnapshot(), results);

            // Step 5: Write output
            log.info("Step 5: Writing {} files to {}...", files.size() + 1, config.getOutputDir());
            Manifest manifest = writer.write(config.getOutputDir(), files);

            boolean allSucceeded = results.stream().allMatch(TargetCompilationResult::isSuccess);
            ErrorKind firstFailure = results.stream()
                    .filter(r -> !r.isSuccess())
                    .map(TargetCompilationResult::getErrorKind)
                    .findFirst()
                    .orElse(null);

            return CompilationResult.builder()
                    .success(allSucceeded)
                    .errorKind(firstFailure)
                    .errorMessage(allSucceeded ? null : "One or more targets failed to compile")
                    .outputPath(config.getOutputDir())
                    .manifest(manifest)
                    .targets(results)
                    .warnings(warnings)
                    .objectsProjected(results.stream()
                            .filter(TargetCompilationResult::isSuccess)
                            .mapToInt(r -> r.getProjection().getObjects().size())
                            .sum())
                    .filesWritten(manifest.getFiles().size() + 1)
                    .build();

        } catch (SnapshotInvalidException e) {
            return CompilationResult.invalidSnapshot(e.getViolations());
        } catch (CancellationException e) {
            log.warn("Compilation cancelled: {}", e.getMessage());
            return CompilationResult.failure(ErrorKind.CANCELLED, e.getMessage());
        } catch (OzMetaException e) {
            log.error("Compilation failed", e);
            return CompilationResult.failure(e.getKind(), e.getMessage());
        } catch (IOException e) {
            log.error("I/O failure during compilation", e);
            return CompilationResult.failure(ErrorKind.UNEXPECTED, "I/O failure: " + e.getMessage());
        }
    }

    /**
     * Reads the configured snapshot file and validates it.
     *
     * @throws IOException when the snapshot, schema or profile file cannot be read
     * @throws SnapshotInvalidException listing every violation found
     */
    public ValidatedSnapshot loadAndValidate() throws IOException {
        return validate(loader().load(config.getSnapshotPath()));
    }

    /**
     * Resolves profiles and runs every semantic check.
     *
     * @throws SnapshotInvalidException listing every violation found
     */
    public ValidatedSnapshot validate(SnapshotDocument snapshot) throws IOException {
        PlatformArea profiles = profileLoader.effectiveProfiles(snapshot, config.getProfilesPath());
        SnapshotIndex index = new SnapshotIndex(snapshot, profiles);
        List<Violation> violations = validator.validate(index);
        if (!violations.isEmpty()) {
            throw new SnapshotInvalidException(violations);
        }
        return new ValidatedSnapshot(index);
    }

    /**
     * Compiles the selected target platforms, one task per platform. Results
     * come back in binding order regardless of completion order.
     */
    public List<TargetCompilationResult> compileTargets(ValidatedSnapshot validated,
            Predicate<TargetPlatformBinding> selection, CancellationToken cancellation) {
        ToolDiagnostics bindingDiagnostics = new ToolDiagnostics();
        List<TargetPlatformBinding> bindings = new ArrayList<>();
        for (TargetPlatformBinding binding : new TargetBinder(config.getDefaultPlatformCode())
                .bind(validated.getIndex(), bindingDiagnostics)) {
            if (selection.test(binding)) {
                bindings.add(binding);
            }
        }
        bindingDiagnostics.getWarnings().forEach(w -> log.warn(w));
        if (bindings.isEmpty()) {
            return List.of();
        }

        CodeRegistry codes = CodeRegistry.fromSnapshot(validated.getSnapshot());
        ProjectionResolver resolver = new ProjectionResolver(validated.getIndex(), codes);

        int threads = Math.max(1, Math.min(config.getParallelism(), bindings.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<TargetCompilationResult>> futures = new ArrayList<>();
            for (TargetPlatformBinding binding : bindings) {
                futures.add(executor.submit(() -> compileTarget(binding, resolver, cancellation)));
            }
            List<TargetCompilationResult> results = new ArrayList<>();
            for (Future<TargetCompilationResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private TargetCompilationResult await(Future<TargetCompilationResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while compiling targets");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                throw (CancellationException) e.getCause();
            }
            throw new CompilationException("Target compilation crashed", e.getCause());
        }
    }

    private TargetCompilationResult compileTarget(TargetPlatformBinding binding, ProjectionResolver resolver,
            CancellationToken cancellation) {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        try {
            cancellation.throwIfCancellationRequested("projecting " + binding.key());
            log.info("  Projecting {}", binding.key());
            TargetProjection projection = resolver.project(binding, diagnostics);

            cancellation.throwIfCancellationRequested("emitting " + binding.key());
            ArtifactEmitter emitter = emitters.require(binding.getPlatform().getCode());
            EmitResult emitted = emitter.emit(projection);
            log.info("  Emitted {} files for {}", emitted.getFiles().size(), binding.key());

            return TargetCompilationResult.builder()
                    .binding(binding)
                    .success(true)
                    .projection(projection)
                    .emitResult(emitted)
                    .diagnostics(diagnostics)
                    .build();
        } catch (OzMetaException e) {
            log.error("  Target {} failed: {}", binding.key(), e.getMessage());
            return TargetCompilationResult.failure(binding, e.getKind(), e.getMessage(), diagnostics);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("  Target {} failed unexpectedly", binding.key(), e);
            return TargetCompilationResult.failure(binding, ErrorKind.UNEXPECTED,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), diagnostics);
        }
    }

    private List<String> checkLineage(SnapshotDocument snapshot, List<TargetCompilationResult> results) {
        List<TargetProjection> projections = new ArrayList<>();
        Set<UUID> physicalFields = new HashSet<>();
        for (TargetCompilationResult result : results) {
            if (result.isSuccess()) {
                projections.add(result.getProjection());
                for (PhysicalObject object : result.getProjection().getObjects()) {
                    for (PhysicalField field : object.getFields()) {
                        physicalFields.add(field.getId());
                    }
                }
            }
        }
        LineageGraph graph = LineageGraph.build(snapshot.getIntegrations(), projections);
        return new LineageCompletenessChecker().check(snapshot, graph, physicalFields);
    }

    /**
     * Lays out every successful target's files. With one target they sit at
     * the root; with several, each target gets {@code targets/<key>/}.
     */
    List<EmittedFile> assemble(SnapshotDocument snapshot, List<TargetCompilationResult> results) {
        boolean nested = results.size() > 1;
        Map<String, String> folders = new LinkedHashMap<>();
        List<EmittedFile> files = new ArrayList<>();
        for (TargetCompilationResult result : results) {
            String folder = nested ? TARGETS_FOLDER + "/" + result.key() : ".";
            folders.put(result.key(), folder);
            if (!result.isSuccess()) {
                continue;
            }
            for (EmittedFile file : result.getEmitResult().getFiles()) {
                files.add(nested ? file.under(folder) : file);
            }
        }
        files.add(new ReadmeGenerator(templates).generate(snapshot, results, folders));
        return files;
    }

    private SnapshotLoader loader() throws IOException {
        if (config.getSchemaPath() == null) {
            return new SnapshotLoader();
        }
        return new SnapshotLoader(SnapshotSchemaValidator.fromFile(config.getSchemaPath()));
    }
}
