package com.ozmeta.compiler.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.output.Manifest;
import com.ozmeta.compiler.util.FileWriteUtil;
import com.ozmeta.compiler.util.Hashing;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Writes a complete output directory or nothing. Files are staged next to
 * the destination and swapped in by rename; the previous directory is
 * restored if the swap fails.
 */
public class DeterministicOutputWriter {

    private static final Logger log = LoggerFactory.getLogger(DeterministicOutputWriter.class);

    public Manifest write(Path outputDir, List<EmittedFile> files) throws IOException {
        List<EmittedFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparing(EmittedFile::getPath));
        checkPaths(sorted);

        Path target = outputDir.toAbsolutePath().normalize();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path staging = Files.createTempDirectory(parent, "." + target.getFileName() + ".staging-");
        try {
            Map<String, String> hashes = new TreeMap<>();
            for (EmittedFile file : sorted) {
                byte[] bytes = file.bytes();
                FileWriteUtil.safeWrite(staging.resolve(file.getPath()), bytes);
                hashes.put(file.getPath(), Hashing.sha256Hex(bytes));
            }
            Manifest manifest = Manifest.of(hashes);
            FileWriteUtil.safeWrite(staging.resolve(Manifest.FILE_NAME), manifestBytes(manifest));

            commit(staging, target);
            log.debug("Wrote {} files to {}", sorted.size() + 1, target);
            return manifest;
        } catch (IOException | UncheckedIOException e) {
            try {
                FileWriteUtil.deleteDirectory(staging);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Serialized form of {@code manifest.json}.
     */
    public static byte[] manifestBytes(Manifest manifest) {
        return JsonSupport.toCanonicalJson(manifest).getBytes(StandardCharsets.UTF_8);
    }

    private void commit(Path staging, Path target) throws IOException {
        if (!Files.exists(target)) {
            FileWriteUtil.move(staging, target);
            return;
        }
        Path backup = target.resolveSibling("." + target.getFileName() + ".previous-" + System.nanoTime());
        FileWriteUtil.move(target, backup);
        try {
            FileWriteUtil.move(staging, target);
        } catch (IOException e) {
            log.error("Swapping in new output failed, restoring {}", target);
            FileWriteUtil.move(backup, target);
            throw e;
        }
        FileWriteUtil.deleteDirectory(backup);
    }

    private void checkPaths(List<EmittedFile> files) {
        Set<String> seen = new HashSet<>();
        for (EmittedFile file : files) {
            String path = file.getPath();
            if (path.isEmpty() || path.startsWith("/") || path.contains("\\") || path.contains(":")) {
                throw new CompilationException("Artifact path must be relative: " + path);
            }
            for (String segment : path.split("/")) {
                if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                    throw new CompilationException("Artifact path has an invalid segment: " + path);
                }
            }
            if (Manifest.FILE_NAME.equals(path)) {
                throw new CompilationException("Artifact path is reserved: " + path);
            }
            if (!seen.add(path)) {
                throw new CompilationException("Duplicate artifact path: " + path);
            }
        }
    }
}
