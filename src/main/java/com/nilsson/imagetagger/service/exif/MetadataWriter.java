package com.nilsson.imagetagger.service.exif;

import com.nilsson.imagetagger.service.model.ImageTags;

import java.nio.file.Path;

/**
 Writes descriptive metadata into an existing image file.
 * <p>Implementations wrap a shared external tool and must be safe to call from several worker
 threads at once. The tool may leave a backup copy of the original next to the file.</p>
 */
public interface MetadataWriter extends AutoCloseable {

    void write(Path file, ImageTags tags) throws MetadataWriteException;

    /**
     Releases the underlying tool. Safe to call more than once; later writes fail.
     */
    @Override
    void close();
}
