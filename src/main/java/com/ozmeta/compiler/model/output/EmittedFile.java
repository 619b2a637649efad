package com.ozmeta.compiler.model.output;

import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated artifact, addressed by a forward-slash path relative to the
 * output root.
 */
@Value
@Builder(toBuilder = true)
public class EmittedFile {
    @NonNull
    String path;
    @NonNull
    String contents;
    @NonNull
    ArtifactType type;

    public byte[] bytes() {
        return contents.getBytes(StandardCharsets.UTF_8);
    }

    public EmittedFile under(String prefix) {
        return toBuilder().path(prefix + "/" + path).build();
    }
}
