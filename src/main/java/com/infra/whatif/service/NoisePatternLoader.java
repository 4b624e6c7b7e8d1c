package com.infra.whatif.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads noise phrases from newline-delimited text. Blank lines and lines starting
 * with '#' are skipped; surrounding whitespace is trimmed.
 */
@Service
public class NoisePatternLoader {

    private static final Logger log = LoggerFactory.getLogger(NoisePatternLoader.class);

    /**
     * Load a file from configuration. The path is trusted.
     */
    public List<String> load(String file) {
        try {
            return read(Path.of(file), file);
        } catch (InvalidPathException e) {
            throw new NoisePatternSourceException(file, e);
        }
    }

    /**
     * Load a file named by a caller. The name must resolve to a regular file inside
     * {@code directory}; anything else is rejected before the file system is read.
     *
     * @throws IllegalArgumentException     if no directory is configured or the name escapes it
     * @throws NoisePatternSourceException  if the file inside the directory cannot be read
     */
    public List<String> loadNamed(String directory, String name) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException(
                    "noisePatternFile is not accepted: no noise pattern directory is configured");
        }
        Path base;
        Path resolved;
        try {
            base = Path.of(directory).toAbsolutePath().normalize();
            Path requested = Path.of(name);
            if (requested.isAbsolute()) {
                throw outsideDirectory(name);
            }
            resolved = base.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("noisePatternFile is not a valid file name: " + name);
        }
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw outsideDirectory(name);
        }
        if (Files.exists(resolved) && !followsInto(resolved, base)) {
            throw outsideDirectory(name);
        }
        return read(resolved, name);
    }

    public List<String> parse(List<String> lines) {
        List<String> patterns = new ArrayList<>();
        for (String line : lines) {
            if (line == null) continue;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            patterns.add(trimmed);
        }
        return patterns;
    }

    // Reported source is the caller-visible name, never the resolved server path
    private List<String> read(Path path, String source) {
        try {
            List<String> patterns = parse(Files.readAllLines(path, StandardCharsets.UTF_8));
            log.info("Loaded {} noise patterns from {}", patterns.size(), path);
            return patterns;
        } catch (IOException | RuntimeException e) {
            throw new NoisePatternSourceException(source, e);
        }
    }

    // Symlinks inside the directory must not point out of it
    private static boolean followsInto(Path resolved, Path base) {
        try {
            return resolved.toRealPath().startsWith(base.toRealPath());
        } catch (IOException e) {
            log.warn("Cannot resolve real path of noise pattern file {}: {}", resolved, e.getMessage());
            return false;
        }
    }

    private static IllegalArgumentException outsideDirectory(String name) {
        return new IllegalArgumentException(
                "noisePatternFile must name a file inside the noise pattern directory: " + name);
    }
}
