package com.nilsson.imagetagger.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.KeyValuePair;
import com.drew.metadata.Metadata;
import com.drew.metadata.png.PngDirectory;
import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.MetadataComment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 Reads the textual metadata generators embed in PNG files.
 * <p>Automatic1111 and Forge write a {@code parameters} chunk, ComfyUI writes {@code prompt}
 and {@code workflow} chunks. All {@code tEXt}, {@code zTXt} and {@code iTXt} pairs are
 returned in file order; interpreting them is left to the extraction strategies.</p>
 */
public class MetadataService {

    private static final Logger logger = LoggerFactory.getLogger(MetadataService.class);

    /**
     @throws IOException if the file cannot be read or is not a recognizable image
     */
    public ImageMetadata readMetadata(Path file) throws IOException {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException e) {
            throw new IOException("Cannot read image metadata from " + file.getFileName(), e);
        }

        List<MetadataComment> comments = new ArrayList<>();
        for (PngDirectory directory : metadata.getDirectoriesOfType(PngDirectory.class)) {
            Object textual = directory.getObject(PngDirectory.TAG_TEXTUAL_DATA);
            if (!(textual instanceof List)) continue;

            for (Object item : (List<?>) textual) {
                if (item instanceof KeyValuePair) {
                    KeyValuePair pair = (KeyValuePair) item;
                    comments.add(new MetadataComment(pair.getKey(), pair.getValue().toString()));
                }
            }
        }

        logger.debug("Read {} text comment(s) from {}", comments.size(), file.getFileName());
        return new ImageMetadata(comments);
    }
}
