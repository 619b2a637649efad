package com.ozmeta.compiler.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.model.canonical.PlatformArea;
import com.ozmeta.compiler.model.canonical.SnapshotDocument;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Loads platform, constraint and type-mapping profiles. A snapshot that carries
 * its own {@code platforms} area uses it exclusively; otherwise the configured
 * profile set applies.
 */
public class ProfileSetLoader {

    private static final Logger log = LoggerFactory.getLogger(ProfileSetLoader.class);

    public static final String DEFAULT_PROFILES = "/profiles/default-profiles.json";

    public PlatformArea loadDefaults() {
        try (InputStream in = ProfileSetLoader.class.getResourceAsStream(DEFAULT_PROFILES)) {
            if (in == null) {
                throw new IllegalStateException("Default profile set not found on classpath: " + DEFAULT_PROFILES);
            }
            return JsonSupport.mapper().readValue(in, PlatformArea.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read default profile set", e);
        }
    }

    public PlatformArea load(Path profilesFile) throws IOException {
        return JsonSupport.mapper().readValue(Files.readAllBytes(profilesFile), PlatformArea.class);
    }

    /**
     * @param override profile file from the command line, may be null
     */
    public PlatformArea effectiveProfiles(SnapshotDocument snapshot, Path override) throws IOException {
        if (!snapshot.getPlatforms().isEmpty()) {
            return snapshot.getPlatforms();
        }
        if (override != null) {
            log.info("Using profile set from {}", override);
            return load(override);
        }
        log.info("Snapshot has no platforms area, using bundled default profiles");
        return loadDefaults();
    }
}
