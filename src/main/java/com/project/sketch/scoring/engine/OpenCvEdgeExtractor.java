package com.project.sketch.scoring.engine;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sobel magnitude computed by OpenCV. Uses the same 3x3 kernels as {@link SobelEdgeExtractor},
 * so both produce the same edge map; only the interior is kept, the border is zeroed.
 */
public class OpenCvEdgeExtractor implements EdgeExtractor {
    private static final Logger log = LoggerFactory.getLogger(OpenCvEdgeExtractor.class);

    private static final boolean AVAILABLE;

    static {
        boolean loaded;
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV {} loaded successfully", Core.VERSION);
            loaded = true;
        } catch (Throwable t) {
            log.error("Failed to load OpenCV, the native edge backend is unavailable", t);
            loaded = false;
        }
        AVAILABLE = loaded;
    }

    public static boolean isAvailable() {
        return AVAILABLE;
    }

    @Override
    public double[] strength(GrayscaleBuffer gray) {
        if (!AVAILABLE) {
            throw new IllegalStateException("OpenCV native library is not loaded");
        }
        final int w = gray.width(), h = gray.height();

        Mat src = new Mat(h, w, CvType.CV_64F);
        Mat gx = new Mat();
        Mat gy = new Mat();
        Mat magnitude = new Mat();
        try {
            src.put(0, 0, gray.toArray());
            Imgproc.Sobel(src, gx, CvType.CV_64F, 1, 0, 3);
            Imgproc.Sobel(src, gy, CvType.CV_64F, 0, 1, 3);
            Core.magnitude(gx, gy, magnitude);

            double[] raw = new double[w * h];
            magnitude.get(0, 0, raw);

            double[] out = new double[w * h];
            for (int y = 1; y < h - 1; y++) {
                for (int x = 1; x < w - 1; x++) {
                    int idx = y * w + x;
                    out[idx] = Math.min(SobelEdgeExtractor.MAX_STRENGTH, raw[idx]);
                }
            }
            return out;
        } finally {
            src.release();
            gx.release();
            gy.release();
            magnitude.release();
        }
    }
}
