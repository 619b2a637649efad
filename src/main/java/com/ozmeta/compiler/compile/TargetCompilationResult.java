package com.ozmeta.compiler.compile;

import com.ozmeta.compiler.exception.ErrorKind;
import com.ozmeta.compiler.model.core.context.ToolDiagnostics;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.physical.TargetPlatformBinding;
import com.ozmeta.compiler.model.physical.TargetProjection;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome for one target platform. Failures carry the error kind; successes
 * carry the projection and emitted artifacts.
 */
@Value
@Builder
public class TargetCompilationResult {
    TargetPlatformBinding binding;
    boolean success;
    ErrorKind errorKind;
    String errorMessage;
    TargetProjection projection;
    EmitResult emitResult;
    ToolDiagnostics diagnostics;

    public String key() {
        return binding.key();
    }

    public static TargetCompilationResult failure(TargetPlatformBinding binding, ErrorKind kind, String message,
            ToolDiagnostics diagnostics) {
        diagnostics.error(message);
        return TargetCompilationResult.builder()
                .binding(binding)
                .success(false)
                .errorKind(kind)
                .errorMessage(message)
                .diagnostics(diagnostics)
                .build();
    }
}
