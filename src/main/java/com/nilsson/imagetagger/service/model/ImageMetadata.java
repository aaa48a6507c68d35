package com.nilsson.imagetagger.service.model;

import java.util.List;
import java.util.Optional;

/**
 Embedded textual metadata of one image, in file order.
 */
public final class ImageMetadata {

    private static final ImageMetadata EMPTY = new ImageMetadata(List.of());

    private final List<MetadataComment> comments;

    public ImageMetadata(List<MetadataComment> comments) {
        this.comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public static ImageMetadata empty() {
        return EMPTY;
    }

    public static ImageMetadata of(MetadataComment... comments) {
        return new ImageMetadata(List.of(comments));
    }

    public List<MetadataComment> getComments() {
        return comments;
    }

    public boolean hasComments() {
        return !comments.isEmpty();
    }

    /**
     Returns the first comment stored under {@code keyword} (exact match).
     */
    public Optional<MetadataComment> findComment(String keyword) {
        return comments.stream()
                .filter(c -> c.getKeyword().equals(keyword))
                .findFirst();
    }
}
