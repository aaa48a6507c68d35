package com.nilsson.imagetagger.service.image;

import com.nilsson.imagetagger.support.PngFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 Tests for {@link WatermarkCompositor}: label placement, clipping on small images and the written file.
 */
class WatermarkCompositorTest {

    private final WatermarkCompositor compositor = new WatermarkCompositor();

    @TempDir
    Path tempDir;

    private static BufferedImage white(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return image;
    }

    private static int red(BufferedImage image, int x, int y) {
        return (image.getRGB(x, y) >> 16) & 0xFF;
    }

    @Test
    void testBoxIsAnchoredBottomRight() {
        BufferedImage result = compositor.composite(white(200, 100));

        // Inside the box, right of the text
        int shaded = red(result, 195, 82);
        assertTrue(shaded > 110 && shaded < 145, "Expected half-transparent black, got " + shaded);

        // Outside the box
        assertEquals(255, red(result, 10, 10));
        assertEquals(255, red(result, 99, 99));
        assertEquals(255, red(result, 195, 79));
    }

    @Test
    void testSmallImageIsClippedAtTopLeft() {
        BufferedImage result = compositor.composite(white(50, 10));

        assertEquals(50, result.getWidth());
        assertEquals(10, result.getHeight());
        int shaded = red(result, 0, 0);
        assertTrue(shaded < 145, "Box should start at the origin, got " + shaded);
    }

    @Test
    void testAlphaChannelIsKept() {
        BufferedImage argb = new BufferedImage(120, 40, BufferedImage.TYPE_INT_ARGB);

        assertTrue(compositor.composite(argb).getColorModel().hasAlpha());
        assertFalse(compositor.composite(white(120, 40)).getColorModel().hasAlpha());
    }

    @Test
    void testApplyWritesSrgbPng() throws IOException {
        Path source = PngFixtures.writePng(tempDir.resolve("base.png"), 160, 90, Map.of());
        Path target = tempDir.resolve("watermarked.png");

        compositor.apply(source, target);

        BufferedImage written = ImageIO.read(target.toFile());
        assertEquals(160, written.getWidth());
        assertEquals(90, written.getHeight());
        assertNotEquals(ImageIO.read(source.toFile()).getRGB(155, 72), written.getRGB(155, 72));
        assertTrue(PngFixtures.hasSrgbChunk(target));
    }
}
