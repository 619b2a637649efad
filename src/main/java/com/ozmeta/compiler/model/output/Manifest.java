package com.ozmeta.compiler.model.output;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Content hashes of an output directory, keyed by relative path in sorted
 * order. Serialized as {@code manifest.json}.
 */
@EqualsAndHashCode
@ToString
public class Manifest {

    public static final String FILE_NAME = "manifest.json";
    public static final String ALGORITHM = "SHA-256";

    private final String algorithm;
    private final TreeMap<String, String> files;

    @JsonCreator
    public Manifest(@JsonProperty("algorithm") String algorithm, @JsonProperty("files") Map<String, String> files) {
        this.algorithm = algorithm;
        this.files = new TreeMap<>(files);
    }

    public static Manifest of(Map<String, String> files) {
        return new Manifest(ALGORITHM, files);
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public Map<String, String> getFiles() {
        return Collections.unmodifiableMap(files);
    }

    public String hashOf(String path) {
        return files.get(path);
    }
}
