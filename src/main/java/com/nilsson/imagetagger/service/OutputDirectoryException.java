package com.nilsson.imagetagger.service;

import java.nio.file.Path;

/**
 Thrown by {@link OutputPipeline} when the destination directory cannot be created.
 Scratch files of the job have already been released when this propagates.
 */
public class OutputDirectoryException extends RuntimeException {

    private final Path directory;

    public OutputDirectoryException(Path directory, Throwable cause) {
        super("Cannot create output directory " + directory, cause);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
