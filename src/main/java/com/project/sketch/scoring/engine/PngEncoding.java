package com.project.sketch.scoring.engine;

import com.project.sketch.scoring.exceptions.ScoringException;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.Base64;
import javax.imageio.ImageIO;

public final class PngEncoding {
    public static final String DATA_URI_PREFIX = "data:image/png;base64,";

    private PngEncoding() {}

    public static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        }
        catch (Exception e) {
            throw new ScoringException("Failed to encode image", e);
        }
    }

    public static String toDataUri(BufferedImage img) {
        return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(toPng(img));
    }
}
