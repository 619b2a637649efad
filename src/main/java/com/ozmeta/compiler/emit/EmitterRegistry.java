package com.ozmeta.compiler.emit;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.ozmeta.compiler.exception.CompilationException;

/**
 * Emitters keyed by platform code, case-insensitive.
 */
public class EmitterRegistry {

    private final Map<String, ArtifactEmitter> emitters = new HashMap<>();

    public static EmitterRegistry withDefaults() {
        TemplateRenderer templates = new TemplateRenderer();
        EmitterRegistry registry = new EmitterRegistry();
        registry.register(new PostgresEmitter(templates));
        registry.register(new SnowflakeEmitter(templates));
        registry.register(new BigQueryEmitter(templates));
        registry.register(new SparkEmitter(templates));
        registry.register(new RedshiftEmitter(templates));
        return registry;
    }

    public EmitterRegistry register(ArtifactEmitter emitter) {
        for (String code : emitter.platformCodes()) {
            emitters.put(code.toLowerCase(Locale.ROOT), emitter);
        }
        return this;
    }

    public Optional<ArtifactEmitter> find(String platformCode) {
        return Optional.ofNullable(emitters.get(platformCode.toLowerCase(Locale.ROOT)));
    }

    public ArtifactEmitter require(String platformCode) {
        return find(platformCode)
                .orElseThrow(() -> new CompilationException("No artifact emitter registered for platform '"
                        + platformCode + "'"));
    }
}
