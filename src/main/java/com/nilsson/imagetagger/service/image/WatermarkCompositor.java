package com.nilsson.imagetagger.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 <h2>WatermarkCompositor</h2>
 <p>
 Stamps a small "AI Generated" label into the bottom-right corner of an image.
 </p>
 <p>
 The label is a 100x20 box of half-transparent black with slightly transparent white text,
 right aligned. Images smaller than the box get the box clipped at their top-left edge.
 </p>
 */
public class WatermarkCompositor {

    private static final Logger logger = LoggerFactory.getLogger(WatermarkCompositor.class);

    public static final String LABEL_TEXT = "AI Generated";

    static final int BOX_WIDTH = 100;
    static final int BOX_HEIGHT = 20;
    static final int TEXT_RIGHT_EDGE = 90;
    static final int TEXT_BASELINE = 15;
    static final Color BOX_COLOR = new Color(0, 0, 0, 128);
    static final Color TEXT_COLOR = new Color(255, 255, 255, 204);
    private static final Font FONT = new Font("Arial", Font.PLAIN, 14);

    /**
     Reads {@code source}, composites the label over it and writes the result to {@code target}.
     */
    public void apply(Path source, Path target) throws IOException {
        BufferedImage base = PngImages.read(source);
        PngImages.writeSrgb(composite(base), target);
        logger.debug("Watermarked {} into {}", source.getFileName(), target.getFileName());
    }

    BufferedImage composite(BufferedImage base) {
        int width = base.getWidth();
        int height = base.getHeight();
        boolean alpha = base.getColorModel().hasAlpha();

        BufferedImage out = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = out.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            g2d.drawImage(base, 0, 0, null);
            g2d.setComposite(AlphaComposite.SrcOver);

            int boxX = Math.max(0, width - BOX_WIDTH);
            int boxY = Math.max(0, height - BOX_HEIGHT);
            g2d.setColor(BOX_COLOR);
            g2d.fillRect(boxX, boxY, BOX_WIDTH, BOX_HEIGHT);

            g2d.setFont(FONT);
            FontMetrics metrics = g2d.getFontMetrics();
            int textX = boxX + TEXT_RIGHT_EDGE - metrics.stringWidth(LABEL_TEXT);
            g2d.setColor(TEXT_COLOR);
            g2d.drawString(LABEL_TEXT, textX, boxY + TEXT_BASELINE);
        } finally {
            g2d.dispose();
        }
        return out;
    }
}
