package com.nilsson.imagetagger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 State of a single {@link OutputPipeline} run.
 * <p>A job owns every scratch file it allocates, every staged output and every backup location it
 registers.
 {@link #close()} releases all of them, so opening the job in a try-with-resources block
 guarantees cleanup on success, on handled failure and on a propagated exception alike.</p>
 */
public class ProcessingJob implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingJob.class);

    public enum Stage {
        START,
        METADATA_READ,
        PROMPT_EXTRACTED,
        KEYWORDS_MATCHED,
        BASE_NORMALIZED,
        WATERMARKED,
        UNWATERMARKED,
        WRITTEN,
        CLEANED_UP,
        DONE,
        FAILED
    }

    private final Path sourceFile;
    private final Path destinationDir;
    private final TempFileManager tempFiles;
    private final List<Path> tempArtifacts = new ArrayList<>();
    private final List<Path> backupTargets = new ArrayList<>();
    private final List<Path> stagedOutputs = new ArrayList<>();

    private Stage stage = Stage.START;
    private Stage failedAt;
    private boolean closed;

    public ProcessingJob(Path sourceFile, Path destinationDir, TempFileManager tempFiles) {
        this.sourceFile = sourceFile;
        this.destinationDir = destinationDir;
        this.tempFiles = tempFiles;
    }

    // --- Scratch Files ---

    /**
     Allocates a scratch path and records it for release before handing it out.
     */
    public Path allocateTemp(String prefix, String extension) throws IOException {
        Path path = tempFiles.allocate(prefix, extension);
        tempArtifacts.add(path);
        return path;
    }

    /**
     Marks {@code destination} as a file whose metadata-tool backups must be removed on close.
     */
    public void registerBackupTarget(Path destination) {
        backupTargets.add(destination);
    }

    /**
     Marks a copy in the destination directory that is only kept if it is moved into place before
     close.
     */
    public void registerStagedOutput(Path staged) {
        stagedOutputs.add(staged);
    }

    public List<Path> getTempArtifacts() {
        return Collections.unmodifiableList(tempArtifacts);
    }

    // --- Stage Tracking ---

    public void advance(Stage next) {
        logger.debug("[{}] {} -> {}", sourceFile.getFileName(), stage, next);
        stage = next;
    }

    public void fail() {
        if (stage != Stage.FAILED) {
            failedAt = stage;
            stage = Stage.FAILED;
        }
    }

    public Stage getStage() {
        return stage;
    }

    /**
     @return the stage that was active when the job failed, or {@code null} if it did not fail
     */
    public Stage getFailedAt() {
        return failedAt;
    }

    public Path getSourceFile() {
        return sourceFile;
    }

    public Path getDestinationDir() {
        return destinationDir;
    }

    // --- Release ---

    @Override
    public void close() {
        if (closed) return;
        closed = true;

        for (Path artifact : tempArtifacts) {
            tempFiles.release(artifact);
        }
        for (Path staged : stagedOutputs) {
            tempFiles.release(staged);
        }
        for (Path target : backupTargets) {
            tempFiles.releaseBackup(target);
        }

        if (stage != Stage.FAILED) {
            advance(Stage.CLEANED_UP);
        }
    }
}
