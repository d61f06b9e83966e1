package com.project.sketch.scoring.service;

import com.project.sketch.scoring.DTOs.DifficultyInfo;
import com.project.sketch.scoring.DTOs.ReferenceImage;
import com.project.sketch.scoring.engine.Difficulty;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-picked reference images per difficulty, served from the reference directory.
 */
@Service
public class CuratedReferenceCatalog {
    private static final String CURATED = ReferenceImageLocator.URL_PREFIX + "curated/";

    private final Map<Difficulty, List<ReferenceImage>> references = new EnumMap<>(Difficulty.class);

    public CuratedReferenceCatalog() {
        references.put(Difficulty.EASY, List.of(
                new ReferenceImage("easy-1", "Apple", CURATED + "easy-apple.png"),
                new ReferenceImage("easy-2", "Star", CURATED + "easy-star.png"),
                new ReferenceImage("easy-3", "Cup", CURATED + "easy-cup.png")
        ));
        references.put(Difficulty.MEDIUM, List.of(
                new ReferenceImage("med-1", "Oak Tree", CURATED + "medium-tree.png"),
                new ReferenceImage("med-2", "Bicycle", CURATED + "medium-bicycle.png"),
                new ReferenceImage("med-3", "Guitar", CURATED + "medium-guitar.png")
        ));
        references.put(Difficulty.HARD, List.of(
                new ReferenceImage("hard-1", "Portrait", CURATED + "hard-portrait.png"),
                new ReferenceImage("hard-2", "Cat", CURATED + "hard-cat.png"),
                new ReferenceImage("hard-3", "Rose", CURATED + "hard-rose.png")
        ));
    }

    public List<ReferenceImage> referencesFor(Difficulty difficulty) {
        return references.get(difficulty);
    }

    public List<DifficultyInfo> difficulties() {
        return Arrays.stream(Difficulty.values())
                .map(d -> new DifficultyInfo(d.id(), d.label(), d.description()))
                .toList();
    }
}
