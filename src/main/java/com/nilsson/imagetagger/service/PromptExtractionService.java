package com.nilsson.imagetagger.service;

import com.nilsson.imagetagger.service.model.ExtractionResult;
import com.nilsson.imagetagger.service.model.ImageMetadata;
import com.nilsson.imagetagger.service.model.PromptEntry;
import com.nilsson.imagetagger.service.strategy.JsonPromptStrategy;
import com.nilsson.imagetagger.service.strategy.ParametersStrategy;
import com.nilsson.imagetagger.service.strategy.PromptExtractionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 Runs the prompt extraction strategies in order and keeps the first usable result.
 * <p>A strategy that throws is logged and skipped, so one broken encoding never hides a
 prompt another strategy can read.</p>
 */
public class PromptExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(PromptExtractionService.class);

    private final List<PromptExtractionStrategy> strategies;

    public PromptExtractionService() {
        this(Arrays.asList(
                new ParametersStrategy(),
                new JsonPromptStrategy()
        ));
    }

    public PromptExtractionService(List<PromptExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     @return the prompts of the first strategy that found any, or {@code null} when none did
     */
    public ExtractionResult extractPrompts(ImageMetadata metadata) {
        for (PromptExtractionStrategy strategy : strategies) {
            String id = strategy.getIdentifier();
            try {
                logger.debug("Trying strategy: {}", id);
                List<PromptEntry> prompts = strategy.extract(metadata);
                if (prompts != null && !prompts.isEmpty()) {
                    logger.debug("Strategy {} succeeded with {} prompt(s)", id, prompts.size());
                    return new ExtractionResult(id, prompts);
                }
            } catch (RuntimeException e) {
                logger.error("Strategy {} failed, trying next", id, e);
            }
        }
        return null;
    }

    public List<PromptExtractionStrategy> getStrategies() {
        return strategies;
    }
}
