package com.project.sketch.scoring;

import com.project.sketch.scoring.DTOs.ScoreBreakdown;
import com.project.sketch.scoring.engine.Difficulty;
import com.project.sketch.scoring.engine.ScoringEngine;
import com.project.sketch.scoring.engine.ScoringOutcome;
import com.project.sketch.scoring.engine.ScoringSettings;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {
    private final ScoringEngine engine = new ScoringEngine(ScoringSettings.defaults());

    @Test
    void identicalDrawing_scoresFullMarks() {
        BufferedImage rect = TestImages.rectangle();

        ScoringOutcome out = engine.score(rect, TestImages.copy(rect), Difficulty.MEDIUM);

        assertThat(out.breakdown().contourScore()).isEqualTo(100.0);
        assertThat(out.breakdown().keypointScore()).isEqualTo(100.0);
        assertThat(out.breakdown().localSimilarityScore()).isCloseTo(100.0, within(0.01));
        assertThat(out.details().inkPenalty()).isEqualTo(1.0);
        assertThat(out.details().spatialPenalty()).isEqualTo(1.0);
        assertThat(out.details().referenceKeypoints()).isPositive();
        assertThat(out.score()).isCloseTo(100.0, within(0.01));
    }

    @Test
    void repeatedRuns_areBitIdentical() {
        BufferedImage ref = TestImages.rectangle();
        BufferedImage sketch = TestImages.rectangle(4, -3);
        TestImages.diagonal(sketch, 40, 40, 120, 90);

        ScoringOutcome first = engine.score(ref, sketch, Difficulty.HARD);
        ScoringOutcome second = engine.score(ref, sketch, Difficulty.HARD);

        assertThat(second.breakdown()).isEqualTo(first.breakdown());
        assertThat(second.details()).isEqualTo(first.details());
    }

    @Test
    void parallelRuns_matchSequentialResult() throws Exception {
        BufferedImage ref = TestImages.rectangle();
        BufferedImage sketch = TestImages.rectangle(2, 5);
        ScoreBreakdown expected = engine.score(ref, sketch, Difficulty.EASY).breakdown();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ScoreBreakdown>> jobs = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                jobs.add(() -> engine.score(ref, sketch, Difficulty.EASY).breakdown());
            }
            for (Future<ScoreBreakdown> f : pool.invokeAll(jobs)) {
                assertThat(f.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void addingStrokesInEmptyAreas_neverRaisesTheScore() {
        BufferedImage ref = TestImages.rectangle();
        BufferedImage sketch = TestImages.copy(ref);

        // 32px cells well clear of the rectangle, one stroke per cell
        List<int[]> cells = new ArrayList<>();
        for (int cy = 0; cy < TestImages.SIZE; cy += 32) {
            for (int cx = 0; cx < TestImages.SIZE; cx += 32) {
                boolean clearX = cx + 31 < TestImages.RECT_MIN - 8 || cx > TestImages.RECT_MAX + 8;
                boolean clearY = cy + 31 < TestImages.RECT_MIN - 8 || cy > TestImages.RECT_MAX + 8;
                if (clearX || clearY) cells.add(new int[]{cx, cy});
            }
        }
        Collections.shuffle(cells, new Random(42));

        double previous = engine.score(ref, sketch, Difficulty.MEDIUM).score();
        double first = previous;
        for (int i = 0; i < 6; i++) {
            TestImages.strokeInCell(sketch, cells.get(i)[0], cells.get(i)[1]);
            double current = engine.score(ref, sketch, Difficulty.MEDIUM).score();
            assertThat(current).isLessThanOrEqualTo(previous);
            previous = current;
        }
        assertThat(previous).isLessThan(first);
    }

    @Test
    void allBlackSubmission_scoresNearZero() {
        ScoringOutcome out = engine.score(TestImages.rectangle(), TestImages.filled(512, Color.BLACK), Difficulty.EASY);

        assertThat(out.details().inkPenalty()).isLessThanOrEqualTo(0.15);
        assertThat(out.score()).isLessThan(5.0);
    }

    @Test
    void nearFullCoverageScribble_isPenalized() {
        BufferedImage scribble = TestImages.rectangle();
        Graphics2D g = scribble.createGraphics();
        g.setColor(Color.DARK_GRAY);
        g.fillRect(40, 40, 440, 440);
        g.dispose();

        ScoringOutcome out = engine.score(TestImages.rectangle(), scribble, Difficulty.EASY);

        assertThat(out.details().inkPenalty()).isLessThanOrEqualTo(0.15);
        assertThat(out.score()).isLessThan(15.0);
    }

    @Test
    void blankReference_usesDocumentedFallbacks() {
        ScoringOutcome out = engine.score(TestImages.blank(512), TestImages.rectangle(), Difficulty.MEDIUM);

        assertThat(out.details().referenceEdgePixels()).isZero();
        assertThat(out.details().contourRecall()).isEqualTo(1.0);
        assertThat(out.details().contourPrecision()).isEqualTo(0.0);
        assertThat(out.breakdown().keypointScore()).isEqualTo(50.0);
        assertThat(out.score()).isNotNaN().isBetween(0.0, 100.0);
    }

    @Test
    void blankAgainstBlank_doesNotDivideByZero() {
        ScoringOutcome out = engine.score(TestImages.blank(512), TestImages.blank(512), Difficulty.MEDIUM);

        assertThat(out.breakdown().contourScore()).isEqualTo(0.0);
        assertThat(out.breakdown().keypointScore()).isEqualTo(50.0);
        assertThat(out.breakdown().localSimilarityScore()).isEqualTo(100.0);
        // 0.33 * 0.5 + 0.07 * 1.0
        assertThat(out.score()).isCloseTo(23.5, within(0.01));
    }

    @Test
    void sameHorizontalLine_matchesPerfectly() {
        ScoringOutcome out = engine.score(TestImages.horizontalLine(256), TestImages.horizontalLine(256), Difficulty.MEDIUM);

        assertThat(out.details().contourPrecision()).isEqualTo(1.0);
        assertThat(out.details().contourRecall()).isEqualTo(1.0);
        assertThat(out.breakdown().contourScore()).isEqualTo(100.0);
        // a line spanning the canvas has no corners
        assertThat(out.details().referenceKeypoints()).isZero();
        assertThat(out.breakdown().keypointScore()).isEqualTo(50.0);
    }

    @Test
    void lineShiftedBeyondTolerance_losesContourScore() {
        ScoringOutcome out = engine.score(TestImages.horizontalLine(256), TestImages.horizontalLine(266), Difficulty.MEDIUM);

        assertThat(out.details().contourPrecision()).isEqualTo(0.0);
        assertThat(out.details().contourRecall()).isEqualTo(0.0);
        assertThat(out.breakdown().contourScore()).isEqualTo(0.0);
    }

    @Test
    void smallerUploads_areNormalizedToCanonicalSize() {
        BufferedImage small = new BufferedImage(128, 96, BufferedImage.TYPE_INT_RGB);

        ScoringOutcome out = engine.score(TestImages.rectangle(), small, Difficulty.MEDIUM);

        assertThat(out.normalizedSubmission().getWidth()).isEqualTo(512);
        assertThat(out.normalizedSubmission().getHeight()).isEqualTo(512);
        assertThat(out.sideBySide().getWidth()).isEqualTo(512 * 2 + 20);
        assertThat(out.heatmap().getWidth()).isEqualTo(512);
    }

    @Test
    void hardDifficulty_weighsDetailMoreThanEasy() {
        // no corners in the sketch: keypoints score zero, contours partially match
        BufferedImage ref = TestImages.rectangle();
        BufferedImage sketch = TestImages.horizontalLine(TestImages.RECT_MIN + 1);

        double easy = engine.score(ref, sketch, Difficulty.EASY).score();
        double hard = engine.score(ref, sketch, Difficulty.HARD).score();

        assertThat(easy).isNotEqualTo(hard);
    }
}
