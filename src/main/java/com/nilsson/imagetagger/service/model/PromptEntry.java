package com.nilsson.imagetagger.service.model;

import java.util.Objects;

/**
 One unit of prompt text pulled out of an image's metadata.
 * <p>The {@code sourceKey} names the slot the text came from, e.g. a ComfyUI node id or
 {@code "primary"} for A1111 style parameters.</p>
 */
public final class PromptEntry {

    private final String sourceKey;
    private final String originalText;

    public PromptEntry(String sourceKey, String originalText) {
        this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
        this.originalText = Objects.requireNonNull(originalText, "originalText");
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public String getOriginalText() {
        return originalText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PromptEntry)) return false;
        PromptEntry that = (PromptEntry) o;
        return sourceKey.equals(that.sourceKey) && originalText.equals(that.originalText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceKey, originalText);
    }

    @Override
    public String toString() {
        return "PromptEntry{" + sourceKey + "='" + originalText + "'}";
    }
}
