package com.nilsson.imagetagger.service.model;

import java.util.List;
import java.util.Objects;

/**
 Descriptive metadata written onto a processed image: the prompt as description and the
 matched labels as keywords.
 */
public final class ImageTags {

    private final String description;
    private final List<String> keywords;

    public ImageTags(String description, List<String> keywords) {
        this.description = Objects.requireNonNull(description, "description");
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public String getDescription() {
        return description;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageTags)) return false;
        ImageTags that = (ImageTags) o;
        return description.equals(that.description) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, keywords);
    }

    @Override
    public String toString() {
        return "ImageTags{keywords=" + keywords + "}";
    }
}
