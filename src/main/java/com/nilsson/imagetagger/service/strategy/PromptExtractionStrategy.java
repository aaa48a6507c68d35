package com.nilsson.imagetagger.service.strategy;

import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.PromptEntry;

import java.util.List;

public interface PromptExtractionStrategy {

    /**
     Stable name of the metadata encoding this strategy understands, reported with every
     successful extraction.
     */
    String getIdentifier();

    /**
     Attempts to read prompt text out of an image's embedded comments.
     * @param metadata The textual metadata of the image

     @return The prompts found, or {@code null} (or an empty list) when this encoding is absent or unusable
     */
    List<PromptEntry> extract(ImageMetadata metadata);
}
