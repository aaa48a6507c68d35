package com.nilsson.imagetagger.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorConvertOp;
import java.io.IOException;
import java.nio.file.Path;

/**
 Re-encodes an image as an sRGB tagged PNG.
 * <p>Pixels in any other color space are converted first. The output carries an {@code sRGB}
 chunk and no embedded ICC profile, which keeps viewers and photo libraries from guessing.</p>
 */
public class ColorProfileNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ColorProfileNormalizer.class);

    public void normalize(Path source, Path target) throws IOException {
        BufferedImage image = PngImages.read(source);
        PngImages.writeSrgb(toSrgb(image), target);
        logger.debug("Normalized {} to sRGB at {}", source.getFileName(), target.getFileName());
    }

    static BufferedImage toSrgb(BufferedImage image) {
        ColorSpace space = image.getColorModel().getColorSpace();
        if (space.isCS_sRGB()) {
            return image;
        }

        boolean alpha = image.getColorModel().hasAlpha();
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(),
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        new ColorConvertOp(null).filter(image, converted);
        return converted;
    }
}
