package com.project.sketch.scoring.controller;

import com.project.sketch.scoring.DTOs.ScoringResponse;
import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.exceptions.ScoringException;
import com.project.sketch.scoring.service.ScoringService;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Browser page for scoring a sketch against an uploaded reference, mostly used to tune
 * references before they go into the curated pack.
 */
@Controller
@Validated
public class ScoringController {
    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB

    private final ScoringService scoringService;
    private final ScoringFormModel formModel;

    public ScoringController(ScoringService scoringService, ScoringFormModel formModel) {
        this.scoringService = scoringService;
        this.formModel = formModel;
    }

    @GetMapping("/score")
    public String showForm(Model model) {
        formModel.populate(model);
        return "score";
    }

    @PostMapping(value = "/score", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("reference") @NotNull MultipartFile reference,
            @RequestParam("sketch") @NotNull MultipartFile sketch,
            @RequestParam(name = "difficulty", defaultValue = "medium")
            @Pattern(regexp = "(?i)easy|medium|hard", message = "Трудността трябва да бъде easy, medium или hard")
            String difficulty,
            Model model
    ) throws IOException {

        // Валидация на двата файла
        validateUploadedFile(reference, "референтното изображение");
        validateUploadedFile(sketch, "скицата");

        log.info("Scoring sketch {} ({}KB) against {} ({}KB), difficulty: {}",
                sketch.getOriginalFilename(), sketch.getSize() / 1024,
                reference.getOriginalFilename(), reference.getSize() / 1024, difficulty);

        try {
            // Оценяване, без запазване на файловете
            ScoringResponse result = scoringService.scoreImages(
                    reference.getBytes(), sketch.getBytes(), Difficulty.fromId(difficulty));
            populateResultModel(model, result);
            return "result";
        } catch (ScoringException e) {
            log.warn("Scoring failed for {}: {}", sketch.getOriginalFilename(), e.getMessage());
            formModel.populate(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", "Опитайте с PNG или JPEG експорт на рисунката.");
            return "score";
        }
    }

    private void validateUploadedFile(MultipartFile file, String what) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Моля изберете файл за " + what);
        }

        String contentType = file.getContentType();
        if (contentType == null || !ScoringFormModel.SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Неподдържан формат за " + what + ": " + contentType +
                            ". Поддържани формати: " + String.join(", ", ScoringFormModel.SUPPORTED_FORMATS)
            );
        }

        // Проверка за максимален размер (допълнително към Spring конфигурацията)
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("Файлът за " + what + " е твърде голям. Максимален размер: 10MB");
        }
    }

    private void populateResultModel(Model model, ScoringResponse result) {
        model.addAttribute("score", String.format("%.2f", result.score()));
        model.addAttribute("difficulty", result.difficulty());
        model.addAttribute("breakdown", result.breakdown());
        model.addAttribute("details", result.details());
        model.addAttribute("heatmap", result.heatmap());
        model.addAttribute("sideBySide", result.sideBySide());
        model.addAttribute("overlay", result.overlay());
    }
}
