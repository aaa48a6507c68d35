package com.nilsson.imagetagger.service.model;

import java.util.Objects;

/**
 A keyword/text pair stored in a PNG textual chunk ({@code tEXt}, {@code zTXt} or {@code iTXt}).
 */
public final class MetadataComment {

    private final String keyword;
    private final String text;

    public MetadataComment(String keyword, String text) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.text = text == null ? "" : text;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataComment)) return false;
        MetadataComment that = (MetadataComment) o;
        return keyword.equals(that.keyword) && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, text);
    }

    @Override
    public String toString() {
        return keyword + "=" + (text.length() > 60 ? text.substring(0, 60) + "..." : text);
    }
}
