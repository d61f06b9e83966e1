package com.project.sketch.scoring.service;

import com.project.sketch.scoring.exceptions.MissingReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves reference URLs handed out to clients, e.g. {@code /generated-images/curated/easy-apple.png},
 * to files inside the reference directory.
 */
@Service
public class ReferenceImageLocator {
    private static final Logger log = LoggerFactory.getLogger(ReferenceImageLocator.class);
    public static final String URL_PREFIX = "/generated-images/";

    private final Path referenceDir;

    public ReferenceImageLocator(@Value("${app.reference.dir:generated-images}") String referenceDir) {
        this.referenceDir = Paths.get(referenceDir).toAbsolutePath().normalize();
        log.info("Using reference directory: {}", this.referenceDir);
    }

    public Path referenceDir() {
        return referenceDir;
    }

    /**
     * @throws MissingReferenceException if no readable file exists for the URL
     * @throws IllegalArgumentException if the URL points outside the reference directory
     */
    public Path locate(String referenceUrl) {
        if (referenceUrl == null || referenceUrl.isBlank()) {
            throw new MissingReferenceException("No reference URL provided");
        }
        String relative = referenceUrl.trim();
        if (relative.startsWith(URL_PREFIX)) {
            relative = relative.substring(URL_PREFIX.length());
        }
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }

        Path resolved = referenceDir.resolve(relative).normalize();
        if (!resolved.startsWith(referenceDir)) {
            throw new IllegalArgumentException("Reference URL points outside the reference directory: " + referenceUrl);
        }
        if (!Files.isRegularFile(resolved) || !Files.isReadable(resolved)) {
            throw new MissingReferenceException("Reference image not found: " + referenceUrl);
        }
        return resolved;
    }

    public byte[] read(String referenceUrl) {
        Path path = locate(referenceUrl);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new MissingReferenceException("Reference image could not be read: " + referenceUrl, e);
        }
    }
}
