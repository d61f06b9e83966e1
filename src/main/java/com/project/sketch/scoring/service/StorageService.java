package com.project.sketch.scoring.service;

import com.project.sketch.scoring.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Keeps submitted sketches under {@code <upload dir>/submissions} so clients can show thumbnails.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final String SUBMISSIONS = "submissions";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;
    private final Path submissionsDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        this.submissionsDir = rootDir.resolve(SUBMISSIONS);
        try {
            Files.createDirectories(this.submissionsDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + submissionsDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "sketch.png" : file.getOriginalFilename());
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        String filename = uniquePrefix() + "_" + safeBase;
        Path target = submissionsDir.resolve(filename);
        try {
            Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
            return stored(target, filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Stores a sketch that arrived as raw bytes (base64 API). */
    public StoredFile storeSubmission(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new StorageException("Empty upload");
        }
        String filename = uniquePrefix() + "_sketch.png";
        Path target = submissionsDir.resolve(filename);
        try {
            Files.write(target, imageBytes);
            return stored(target, filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store submission", e);
        }
    }

    public Path rootDir() {
        return rootDir;
    }

    private static StoredFile stored(Path target, String filename) {
        return new StoredFile(target, filename, "uploads/" + SUBMISSIONS + "/" + filename);
    }

    // timestamps alone collide when players submit in the same millisecond
    private static String uniquePrefix() {
        return TIMESTAMP.format(LocalDateTime.now()) + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
