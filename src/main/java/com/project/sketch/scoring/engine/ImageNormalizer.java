package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.exceptions.ImageDecodeException;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Decodes uploads and resamples them to the canonical square resolution.
 */
public class ImageNormalizer {
    private static final Color BACKGROUND = Color.WHITE;

    private final int canonicalSize;

    public ImageNormalizer(int canonicalSize) {
        if (canonicalSize <= 0) {
            throw new IllegalArgumentException("canonicalSize must be positive: " + canonicalSize);
        }
        this.canonicalSize = canonicalSize;
    }

    public int canonicalSize() {
        return canonicalSize;
    }

    /**
     * @param what name of the image for the error message, e.g. "sketch"
     * @throws ImageDecodeException if the bytes are not a raster format ImageIO can read
     */
    public BufferedImage decode(byte[] bytes, String what) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("The " + what + " image is empty.");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("The " + what + " image is not a valid image or is corrupted.", e);
        }
        if (image == null) {
            throw new ImageDecodeException("The " + what + " image is not a valid image or is corrupted.");
        }
        return image;
    }

    /**
     * Bilinear resample to canonical size. Transparent pixels are flattened onto white, which is
     * the paper colour of the drawing surface.
     */
    public BufferedImage normalize(BufferedImage source) {
        BufferedImage out = new BufferedImage(canonicalSize, canonicalSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, canonicalSize, canonicalSize);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, canonicalSize, canonicalSize, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
