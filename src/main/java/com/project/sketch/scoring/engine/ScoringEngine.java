package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.DTOs.ScoreBreakdown;
import com.project.sketch.scoring.DTOs.ScoreDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Scores a freehand sketch against a reference image.
 *
 * <p>Pipeline: normalize both images to the canonical size, extract binary edge maps, then combine
 * contour F1, keypoint matching and patch SSIM by difficulty weight and scale the result by the
 * ink-density and spatial extra-ink penalties. Finally the heatmap, side-by-side and overlay
 * diagnostics are rendered.
 *
 * <p>Instances hold only immutable configuration and may be shared between threads. Identical
 * inputs always give identical results.
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final ScoringSettings settings;
    private final ImageNormalizer normalizer;
    private final EdgeExtractor edgeExtractor;
    private final ContourMatcher contourMatcher;
    private final KeypointDetector keypointDetector;
    private final KeypointMatcher keypointMatcher;
    private final LocalSimilarityEstimator localSimilarity;
    private final InkPenaltyCalculator penalties;
    private final DiagnosticRenderer renderer;

    public ScoringEngine(ScoringSettings settings) {
        this(settings, new SobelEdgeExtractor());
    }

    public ScoringEngine(ScoringSettings settings, EdgeExtractor edgeExtractor) {
        this.settings = settings;
        this.edgeExtractor = edgeExtractor;
        this.normalizer = new ImageNormalizer(settings.canonicalSize());
        this.contourMatcher = new ContourMatcher(settings.contourTolerance());
        this.keypointDetector = new KeypointDetector(
                settings.keypointStride(), settings.keypointMax(), settings.keypointResponseThreshold());
        this.keypointMatcher = new KeypointMatcher(settings.keypointTolerancePx(), settings.keypointEmptyScore());
        this.localSimilarity = new LocalSimilarityEstimator(settings.ssimPatchSize());
        this.penalties = new InkPenaltyCalculator(settings.inkThreshold(), settings.spatialPatchSize());
        this.renderer = new DiagnosticRenderer(settings.sideBySideGutter(), settings.overlayOpacity());
    }

    public ScoringSettings settings() {
        return settings;
    }

    public ImageNormalizer normalizer() {
        return normalizer;
    }

    public ScoringOutcome score(BufferedImage reference, BufferedImage submission, Difficulty difficulty) {
        BufferedImage refImg = normalizer.normalize(reference);
        BufferedImage subImg = normalizer.normalize(submission);

        GrayscaleBuffer refGray = GrayscaleBuffer.of(refImg);
        GrayscaleBuffer subGray = GrayscaleBuffer.of(subImg);
        GrayscaleBuffer.requireSameSize(refGray, subGray);

        EdgeMap refEdges = edgeExtractor.extract(refGray, settings.edgeThreshold());
        EdgeMap subEdges = edgeExtractor.extract(subGray, settings.edgeThreshold());

        ContourMatch contour = contourMatcher.match(refEdges, subEdges);
        log.debug("Contours: {} reference / {} submission edge pixels, precision={}, recall={}, f1={}",
                contour.referenceEdges(), contour.submissionEdges(),
                contour.precision(), contour.recall(), contour.f1());

        List<Keypoint> refKp = keypointDetector.detect(refGray);
        List<Keypoint> subKp = keypointDetector.detect(subGray);
        double kpScore = keypointMatcher.score(refKp, subKp);
        log.debug("Keypoints: {} reference, {} submission, score={}", refKp.size(), subKp.size(), kpScore);

        double localScore = localSimilarity.estimate(refGray, subGray);

        double inkPenalty = penalties.inkDensityFactor(refGray, subGray);
        double spatialPenalty = penalties.spatialExtraFactor(refGray, subGray);
        log.debug("Local similarity={}, ink penalty={}, spatial penalty={}", localScore, inkPenalty, spatialPenalty);

        ScoreBreakdown breakdown = CompositeScorer.breakdown(
                difficulty, contour.f1(), kpScore, localScore, inkPenalty, spatialPenalty);

        ScoreDetails details = new ScoreDetails(
                round4(contour.precision()),
                round4(contour.recall()),
                contour.referenceEdges(),
                contour.submissionEdges(),
                refKp.size(),
                subKp.size(),
                inkPenalty,
                spatialPenalty
        );

        return new ScoringOutcome(
                difficulty,
                breakdown,
                details,
                refImg,
                subImg,
                renderer.heatmap(refEdges, subEdges),
                renderer.sideBySide(refImg, subImg),
                renderer.overlay(refImg, subImg)
        );
    }

    private static double round4(double v) {
        return Math.round(v * 10000) / 10000.0;
    }
}
