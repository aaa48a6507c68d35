package com.nilsson.imagetagger.service.model;

import java.util.List;
import java.util.Objects;

/**
 The prompts found by the first strategy that recognized an image's metadata.
 The prompt list is never empty.
 */
public final class ExtractionResult {

    private final String strategyId;
    private final List<PromptEntry> prompts;

    public ExtractionResult(String strategyId, List<PromptEntry> prompts) {
        this.strategyId = Objects.requireNonNull(strategyId, "strategyId");
        if (prompts == null || prompts.isEmpty()) {
            throw new IllegalArgumentException("An extraction result needs at least one prompt");
        }
        this.prompts = List.copyOf(prompts);
    }

    public String getStrategyId() {
        return strategyId;
    }

    public List<PromptEntry> getPrompts() {
        return prompts;
    }

    /**
     The prompt used for the description field of the output image.
     */
    public PromptEntry getPrimaryPrompt() {
        return prompts.get(0);
    }

    @Override
    public String toString() {
        return "ExtractionResult{strategy=" + strategyId + ", prompts=" + prompts.size() + "}";
    }
}
