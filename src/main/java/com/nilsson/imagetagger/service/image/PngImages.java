package com.nilsson.imagetagger.service.image;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 ImageIO helpers shared by the pixel stages of the pipeline.
 */
public final class PngImages {

    static final String PNG_METADATA_FORMAT = "javax_imageio_png_1.0";
    static final String RENDERING_INTENT = "Perceptual";

    static {
        ImageIO.scanForPlugins();
        // Keep ImageIO from spilling cache files next to our own scratch files
        ImageIO.setUseCache(false);
    }

    private PngImages() {
    }

    /**
     @throws IOException if the file cannot be read or no ImageIO reader understands it
     */
    public static BufferedImage read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("No image reader available for " + file.getFileName());
        }
        return image;
    }

    /**
     Encodes {@code image} as PNG with an {@code sRGB} chunk. The pixels must already be sRGB.
     */
    public static void writeSrgb(BufferedImage image, Path target) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IOException("No PNG writer registered with ImageIO");
        }

        ImageWriter writer = writers.next();
        try (OutputStream out = Files.newOutputStream(target);
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(image), param);

            IIOMetadataNode root = new IIOMetadataNode(PNG_METADATA_FORMAT);
            IIOMetadataNode srgb = new IIOMetadataNode("sRGB");
            srgb.setAttribute("renderingIntent", RENDERING_INTENT);
            root.appendChild(srgb);
            metadata.mergeTree(PNG_METADATA_FORMAT, root);

            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, metadata), param);
            ios.flush();
        } finally {
            writer.dispose();
        }
    }
}
