package com.project.sketch.scoring.service;

import com.project.sketch.scoring.DTOs.ScoringResponse;
import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.engine.ImageNormalizer;
import com.project.sketch.scoring.engine.PngEncoding;
import com.project.sketch.scoring.engine.ScoringEngine;
import com.project.sketch.scoring.engine.ScoringOutcome;
import com.project.sketch.scoring.exceptions.ImageDecodeException;
import com.project.sketch.scoring.exceptions.MissingReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Entry point for scoring requests: decodes uploads, locates the reference, runs the engine and
 * encodes the diagnostics. Holds no per-request state.
 */
@Service
public class ScoringService {
    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);
    private static final Pattern DATA_URI_HEADER = Pattern.compile("^data:image/\\w+;base64,");
    // same cap as multipart uploads
    private static final int MAX_SKETCH_BYTES = 10 * 1024 * 1024;

    private final ScoringEngine engine;
    private final ReferenceImageLocator referenceLocator;
    private final StorageService storageService;

    public ScoringService(ScoringEngine engine, ReferenceImageLocator referenceLocator, StorageService storageService) {
        this.engine = engine;
        this.referenceLocator = referenceLocator;
        this.storageService = storageService;
    }

    /** Multipart API: the sketch is an uploaded file, the reference a locatable URL. */
    public ScoringResponse scoreUpload(MultipartFile sketch, String referenceUrl, Difficulty difficulty) {
        byte[] sketchBytes = readUpload(sketch, "sketch");
        BufferedImage submission = engine.normalizer().decode(sketchBytes, "sketch");
        var stored = storageService.store(sketch);
        return scoreAgainstUrl(submission, referenceUrl, difficulty, "/" + stored.relativeWebPath());
    }

    /** JSON API: the sketch arrives base64 encoded, optionally as a data URI. */
    public ScoringResponse scoreBase64(String sketchBase64, String referenceUrl, Difficulty difficulty) {
        byte[] sketchBytes = decodeBase64(sketchBase64);
        BufferedImage submission = engine.normalizer().decode(sketchBytes, "sketch");
        var stored = storageService.storeSubmission(sketchBytes);
        return scoreAgainstUrl(submission, referenceUrl, difficulty, "/" + stored.relativeWebPath());
    }

    /** Browser form: both images are uploaded, nothing is stored. */
    public ScoringResponse scoreImages(byte[] referenceBytes, byte[] sketchBytes, Difficulty difficulty) {
        ImageNormalizer normalizer = engine.normalizer();
        BufferedImage reference = normalizer.decode(referenceBytes, "reference");
        BufferedImage submission = normalizer.decode(sketchBytes, "sketch");
        return toResponse(run(reference, submission, difficulty), false, null);
    }

    private ScoringResponse scoreAgainstUrl(BufferedImage submission, String referenceUrl,
                                            Difficulty difficulty, String submissionUrl) {
        BufferedImage reference;
        boolean substituted = false;
        try {
            reference = engine.normalizer().decode(referenceLocator.read(referenceUrl), "reference");
        } catch (MissingReferenceException e) {
            // degenerate self-comparison instead of failing the round
            log.warn("{}; scoring the submission against itself", e.getMessage());
            reference = submission;
            substituted = true;
        }
        return toResponse(run(reference, submission, difficulty), substituted, submissionUrl);
    }

    private ScoringOutcome run(BufferedImage reference, BufferedImage submission, Difficulty difficulty) {
        long start = System.nanoTime();
        ScoringOutcome outcome = engine.score(reference, submission, difficulty);
        log.info("Scored sketch ({}): {}% in {} ms", difficulty.id(), outcome.score(),
                (System.nanoTime() - start) / 1_000_000);
        return outcome;
    }

    private static ScoringResponse toResponse(ScoringOutcome outcome, boolean referenceSubstituted,
                                              String submissionUrl) {
        return new ScoringResponse(
                outcome.score(),
                outcome.difficulty().id(),
                outcome.breakdown(),
                outcome.details(),
                referenceSubstituted,
                PngEncoding.toDataUri(outcome.heatmap()),
                PngEncoding.toDataUri(outcome.sideBySide()),
                PngEncoding.toDataUri(outcome.overlay()),
                PngEncoding.toDataUri(outcome.normalizedReference()),
                PngEncoding.toDataUri(outcome.normalizedSubmission()),
                submissionUrl
        );
    }

    static byte[] decodeBase64(String value) {
        if (value == null || value.isBlank()) {
            throw new ImageDecodeException("The sketch image is empty.");
        }
        String payload = DATA_URI_HEADER.matcher(value.trim()).replaceFirst("");
        // reject before allocating the decoded buffer
        if ((long) payload.length() / 4 * 3 > (long) MAX_SKETCH_BYTES + 3) {
            throw tooLarge();
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new ImageDecodeException("The sketch is not valid base64.", e);
        }
        if (bytes.length > MAX_SKETCH_BYTES) {
            throw tooLarge();
        }
        return bytes;
    }

    private static IllegalArgumentException tooLarge() {
        return new IllegalArgumentException("The sketch is too large. Maximum size: 10MB");
    }

    private static byte[] readUpload(MultipartFile file, String what) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No " + what + " file uploaded");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ImageDecodeException("The " + what + " upload could not be read.", e);
        }
    }
}
