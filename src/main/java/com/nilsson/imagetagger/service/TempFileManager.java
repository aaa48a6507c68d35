package com.nilsson.imagetagger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 Hands out scratch file paths and deletes them again.
 * <p>Names combine the current time with a random suffix so that concurrent jobs never share a
 path. The scratch directory is created on first use. Deletion never throws: a missing file is
 fine, any other failure is logged.</p>
 */
public class TempFileManager {

    private static final Logger logger = LoggerFactory.getLogger(TempFileManager.class);

    static final String BACKUP_SUFFIX = "_original";
    private static final int RANDOM_SUFFIX_LENGTH = 8;

    private final Path tempDir;

    public TempFileManager(Path tempDir) {
        this.tempDir = tempDir.toAbsolutePath();
    }

    public Path getTempDir() {
        return tempDir;
    }

    // --- Allocation ---

    /**
     Reserves a unique path in the scratch directory. The file itself is not created.

     @param prefix    leading part of the file name, e.g. {@code process_}
     @param extension trailing part including the dot, e.g. {@code .png}; may be empty
     @throws IOException if the scratch directory cannot be created
     */
    public Path allocate(String prefix, String extension) throws IOException {
        ensureTempDir();
        String name = (prefix == null ? "temp_" : prefix)
                + System.currentTimeMillis() + "_" + randomSuffix()
                + (extension == null ? "" : extension);
        return tempDir.resolve(name);
    }

    private void ensureTempDir() throws IOException {
        if (!Files.isDirectory(tempDir)) {
            Files.createDirectories(tempDir);
            logger.debug("Created temp directory at {}", tempDir);
        }
    }

    private static String randomSuffix() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(RANDOM_SUFFIX_LENGTH);
        for (int i = 0; i < RANDOM_SUFFIX_LENGTH; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString();
    }

    // --- Release ---

    /**
     Deletes {@code file} if it exists. Failures other than absence are logged, not thrown.
     */
    public void release(Path file) {
        if (file == null) return;
        try {
            if (Files.deleteIfExists(file)) {
                logger.debug("Cleaned up temp file: {}", file.getFileName());
            }
        } catch (IOException e) {
            logger.error("Failed to delete temp file {}", file, e);
        }
    }

    /**
     Removes the backup copies a metadata tool may leave next to {@code destination}.
     */
    public void releaseBackup(Path destination) {
        for (Path backup : backupCandidates(destination)) {
            release(backup);
        }
    }

    /**
     Both backup naming conventions: {@code image.png_original} as written by exiftool, and
     {@code image_original.png}.
     */
    static List<Path> backupCandidates(Path destination) {
        String name = destination.getFileName().toString();
        int dot = name.lastIndexOf('.');

        Path appended = destination.resolveSibling(name + BACKUP_SUFFIX);
        if (dot <= 0) {
            return List.of(appended);
        }
        Path beforeExtension = destination.resolveSibling(
                name.substring(0, dot) + BACKUP_SUFFIX + name.substring(dot));
        return List.of(appended, beforeExtension);
    }
}
