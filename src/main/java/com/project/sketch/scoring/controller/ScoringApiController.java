package com.project.sketch.scoring.controller;

import com.project.sketch.scoring.DTOs.Base64ScoringRequest;
import com.project.sketch.scoring.DTOs.DifficultyInfo;
import com.project.sketch.scoring.DTOs.ReferenceImage;
import com.project.sketch.scoring.DTOs.ScoringResponse;
import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.service.CuratedReferenceCatalog;
import com.project.sketch.scoring.service.ScoringService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * JSON API used by the game client.
 */
@RestController
@RequestMapping("/api")
public class ScoringApiController {
    private static final Logger log = LoggerFactory.getLogger(ScoringApiController.class);

    private final ScoringService scoringService;
    private final CuratedReferenceCatalog catalog;

    public ScoringApiController(ScoringService scoringService, CuratedReferenceCatalog catalog) {
        this.scoringService = scoringService;
        this.catalog = catalog;
    }

    @PostMapping(value = "/scoring/compute", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ScoringResponse compute(
            @RequestParam(name = "sketch", required = false) MultipartFile sketch,
            @RequestParam(name = "referenceUrl", required = false) String referenceUrl,
            @RequestParam(name = "difficulty", required = false) String difficulty) {
        if (sketch == null || sketch.isEmpty()) {
            throw new IllegalArgumentException("No sketch file uploaded");
        }
        if (referenceUrl == null || referenceUrl.isBlank()) {
            throw new IllegalArgumentException("No reference URL provided");
        }
        Difficulty diff = Difficulty.fromId(difficulty);
        log.info("Scoring upload {} ({}KB) against {}", sketch.getOriginalFilename(), sketch.getSize() / 1024, referenceUrl);
        return scoringService.scoreUpload(sketch, referenceUrl, diff);
    }

    @PostMapping(value = "/scoring/compute-base64", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScoringResponse computeBase64(@Valid @RequestBody Base64ScoringRequest request) {
        Difficulty diff = Difficulty.fromId(request.difficulty());
        log.info("Scoring base64 sketch against {}", request.referenceUrl());
        return scoringService.scoreBase64(request.sketch(), request.referenceUrl(), diff);
    }

    @GetMapping("/references/{difficulty}")
    public List<ReferenceImage> references(@PathVariable String difficulty) {
        return catalog.referencesFor(Difficulty.fromId(difficulty));
    }

    @GetMapping("/difficulties")
    public List<DifficultyInfo> difficulties() {
        return catalog.difficulties();
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok", "timestamp", System.currentTimeMillis());
    }
}
