package com.ozmeta.compiler.compile;

import java.nio.file.Path;
import java.util.List;

import com.ozmeta.compiler.exception.ErrorKind;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.snapshot.Violation;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generate run.
 */
@Data
@Builder
public class CompilationResult {
    private boolean success;
    private ErrorKind errorKind;
    private String errorMessage;
    private Path outputPath;
    private Manifest manifest;

    @Builder.Default
    private List<Violation> violations = List.of();
    @Builder.Default
    private List<TargetCompilationResult> targets = List.of();
    @Builder.Default
    private List<String> warnings = List.of();

    private int objectsProjected;
    private int filesWritten;

    public static CompilationResult failure(ErrorKind kind, String errorMessage) {
        return CompilationResult.builder()
                .success(false)
                .errorKind(kind)
                .errorMessage(errorMessage)
                .build();
    }

    public static CompilationResult invalidSnapshot(List<Violation> violations) {
        return CompilationResult.builder()
                .success(false)
                .errorKind(ErrorKind.SNAPSHOT_INVALID)
                .errorMessage(violations.size() + " snapshot violation(s)")
                .violations(List.copyOf(violations))
                .build();
    }

    public long failedTargets() {
        return targets.stream().filter(t -> !t.isSuccess()).count();
    }
}
