package com.project.sketch.scoring.controller;

import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.service.CuratedReferenceCatalog;
import org.springframework.stereotype.Component;
import org.springframework.ui.Model;

import java.util.List;

/**
 * Model attributes the scoring form needs to render: the difficulty options and the accepted
 * upload formats. Shared by {@link ScoringController} and the error handler that re-renders the form.
 */
@Component
public class ScoringFormModel {
    public static final List<String> SUPPORTED_FORMATS = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp", "image/webp"
    );

    private final CuratedReferenceCatalog catalog;

    public ScoringFormModel(CuratedReferenceCatalog catalog) {
        this.catalog = catalog;
    }

    public void populate(Model model) {
        model.addAttribute("difficulties", catalog.difficulties());
        model.addAttribute("defaultDifficulty", Difficulty.DEFAULT.id());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }
}
