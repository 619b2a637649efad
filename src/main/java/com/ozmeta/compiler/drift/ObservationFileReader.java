package com.ozmeta.compiler.drift;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ozmeta.compiler.model.physical.TargetProjection;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Observer backed by a JSON document exported by an external collector.
 */
public class ObservationFileReader implements LiveTargetObserver {

    private final Path observationFile;

    public ObservationFileReader(Path observationFile) {
        this.observationFile = observationFile;
    }

    @Override
    public LiveTargetObservation observe(TargetProjection projection) throws IOException {
        return read(observationFile);
    }

    public static LiveTargetObservation read(Path observationFile) throws IOException {
        if (!Files.isRegularFile(observationFile)) {
            throw new IOException("Observation file not found: " + observationFile);
        }
        try {
            return JsonSupport.mapper().readValue(observationFile.toFile(), LiveTargetObservation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed observation " + observationFile + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}
