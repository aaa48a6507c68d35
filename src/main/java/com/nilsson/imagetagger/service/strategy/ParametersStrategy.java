package com.nilsson.imagetagger.service.strategy;

import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.MetadataComment;
import com.nilsson.imagetagger.service.model.PromptEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Prompt extraction for Automatic1111 style {@code parameters} text.
 *
 * <p>The text chunk holds the positive prompt, optionally followed by a
 * {@code Negative prompt:} section and the generation settings. Everything before
 * the negative marker is the prompt.</p>
 */
public class ParametersStrategy implements PromptExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ParametersStrategy.class);

    public static final String IDENTIFIER = "parameters";
    public static final String COMMENT_KEYWORD = "parameters";
    public static final String SOURCE_KEY = "primary";

    static final String NEGATIVE_MARKER = "Negative prompt:";

    @Override
    public String getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public List<PromptEntry> extract(ImageMetadata metadata) {
        Optional<MetadataComment> comment = metadata.findComment(COMMENT_KEYWORD);
        if (comment.isEmpty()) {
            logger.debug("No parameters comment found");
            return null;
        }

        String text = comment.get().getText();
        int negIndex = text.indexOf(NEGATIVE_MARKER);
        String positivePrompt = negIndex > -1 ? text.substring(0, negIndex).trim() : text.trim();

        if (positivePrompt.isEmpty()) {
            logger.debug("Parameters comment has no positive prompt text");
            return null;
        }

        return List.of(new PromptEntry(SOURCE_KEY, positivePrompt));
    }
}
